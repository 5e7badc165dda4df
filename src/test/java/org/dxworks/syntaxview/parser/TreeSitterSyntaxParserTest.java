package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.Language;
import org.dxworks.syntaxview.model.SyntaxNode;
import org.dxworks.syntaxview.model.SyntaxToken;
import org.dxworks.syntaxview.model.Trivia;
import org.dxworks.syntaxview.tree.Classification;
import org.dxworks.syntaxview.tree.DisplayNode;
import org.dxworks.syntaxview.tree.TreeMaterializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TreeSitterSyntaxParserTest {

    private static final String CLASS_FOO = "class Foo { void Bar() {} }";

    @Test
    void parse_Java_ClassWithMethod() {
        SyntaxNode root = parse(Language.JAVA, CLASS_FOO);
        DisplayNode display = new TreeMaterializer().materialize(root).getRoot();

        DisplayNode classDeclaration = find(display, "class_declaration - ClassDeclarationSyntax").orElseThrow();
        assertEquals(Classification.NODE, classDeclaration.getClassification());
        assertTrue(find(classDeclaration, "method_declaration - MethodDeclarationSyntax").isPresent());

        List<String> tokenLabels = new ArrayList<>();
        for (DisplayNode node : preOrder(display)) {
            if (node.getClassification() == Classification.TOKEN) {
                tokenLabels.add(node.getLabel());
            }
        }
        int foo = tokenLabels.indexOf("identifier: \"Foo\"");
        int bar = tokenLabels.indexOf("identifier: \"Bar\"");
        assertTrue(foo >= 0, tokenLabels.toString());
        assertTrue(bar > foo, tokenLabels.toString());
    }

    @Test
    void parse_CSharp_ClassWithMethod() {
        SyntaxNode root = parse(Language.CSHARP, CLASS_FOO);
        DisplayNode display = new TreeMaterializer().materialize(root).getRoot();

        DisplayNode classDeclaration = find(display, "class_declaration - ClassDeclarationSyntax").orElseThrow();
        assertTrue(find(classDeclaration, "method_declaration - MethodDeclarationSyntax").isPresent());
    }

    @Test
    void tokens_reproduce_source_in_order() {
        SyntaxNode root = parse(Language.JAVA, CLASS_FOO);

        StringBuilder texts = new StringBuilder();
        for (SyntaxToken token : root.getDescendantTokens()) {
            texts.append(token.getText());
        }
        assertEquals("classFoo{voidBar(){}}", texts.toString());
        assertEquals(CLASS_FOO, root.getFullText());
        assertEquals(CLASS_FOO, root.toString());
    }

    @Test
    void root_ends_with_end_of_file_token() {
        SyntaxNode root = parse(Language.JAVA, CLASS_FOO + "\n");

        SyntaxToken last = root.getLastToken();
        assertEquals(TreeSitterTreeBuilder.END_OF_FILE, last.getKind());
        assertEquals("", last.getText());
        assertEquals(CLASS_FOO + "\n", root.getFullText());
    }

    @Test
    void spans_are_character_offsets() {
        SyntaxNode root = parse(Language.JAVA, CLASS_FOO);

        SyntaxToken foo = tokenWithText(root, "Foo");
        assertEquals(6, foo.getSpan().getStart());
        assertEquals(9, foo.getSpan().getEnd());
        assertEquals("class_declaration", foo.getParent().getKind());
        assertInstanceOf(TreeSitterToken.class, foo);
        assertTrue(((TreeSitterToken) foo).isNamed());
    }

    @Test
    void whitespace_and_comments_become_trivia() {
        String source = "// header\nclass A {\n  int x; // trailing\n}\n";
        SyntaxNode root = parse(Language.JAVA, source);

        assertEquals(source, root.getFullText());

        SyntaxToken classKeyword = root.getFirstToken();
        assertEquals("class", classKeyword.getText());
        List<String> leadingTexts = new ArrayList<>();
        for (Trivia trivia : classKeyword.getLeadingTrivia()) {
            leadingTexts.add(trivia.getText());
        }
        assertEquals(List.of("// header", "\n"), leadingTexts);

        SyntaxToken semicolon = tokenWithText(root, ";");
        List<String> trailingTexts = new ArrayList<>();
        for (Trivia trivia : semicolon.getTrailingTrivia()) {
            trailingTexts.add(trivia.getText());
        }
        assertEquals(List.of(" ", "// trailing", "\n"), trailingTexts);

        for (SyntaxToken token : root.getDescendantTokens()) {
            assertFalse(token.getText().startsWith("//"), token.getText());
        }
    }

    @Test
    void multibyte_text_keeps_character_positions() {
        String source = "class Ä { String s = \"ü\"; }";
        SyntaxNode root = parse(Language.JAVA, source);

        assertEquals(source, root.getFullText());
        SyntaxToken name = tokenWithText(root, "Ä");
        assertEquals(6, name.getSpan().getStart());
    }

    @Test
    void broken_source_still_yields_a_tree_with_diagnostics() {
        SyntaxNode root = parse(Language.JAVA, "class {");

        assertTrue(root.containsDiagnostics());
        assertEquals("class {", root.getFullText());
    }

    @Test
    void empty_source_yields_root_with_end_of_file_only() {
        SyntaxNode root = parse(Language.JAVA, "");

        assertEquals(1, root.getChildCount());
        assertEquals(TreeSitterTreeBuilder.END_OF_FILE, root.getChildAt(0).getKind());
    }

    @Test
    void null_source_is_a_parse_failure() {
        ParseResult result = new TreeSitterSyntaxParser(Language.JAVA).parse(null);

        assertFalse(result.isSuccess());
        assertEquals("No source text to parse", result.getFailure().getMessage());
    }

    @ParameterizedTest
    @CsvSource({"csharp/Greeter.cs, CSHARP", "java/Inventory.java, JAVA"})
    void sample_file_round_trips(String sample, Language language) throws IOException {
        String source = Files.readString(Paths.get("src/test/resources/samples/" + sample), StandardCharsets.UTF_8);
        SyntaxNode root = parse(language, source);

        assertEquals(source, root.getFullText());
        assertFalse(root.containsDiagnostics());
    }

    private static SyntaxNode parse(Language language, String source) {
        ParseResult result = new TreeSitterSyntaxParser(language).parse(source);
        assertTrue(result.isSuccess(), () -> result.getFailure().toString());
        return result.getRoot();
    }

    private static SyntaxToken tokenWithText(SyntaxNode root, String text) {
        for (SyntaxToken token : root.getDescendantTokens()) {
            if (token.getText().equals(text)) return token;
        }
        throw new AssertionError("No token " + text);
    }

    private static Optional<DisplayNode> find(DisplayNode root, String label) {
        for (DisplayNode node : preOrder(root)) {
            if (node.getLabel().equals(label)) return Optional.of(node);
        }
        return Optional.empty();
    }

    private static List<DisplayNode> preOrder(DisplayNode root) {
        List<DisplayNode> result = new ArrayList<>();
        Deque<DisplayNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DisplayNode node = stack.pop();
            result.add(node);
            for (int i = node.getChildren().size() - 1; i >= 0; i--) {
                stack.push(node.getChildren().get(i));
            }
        }
        return result;
    }
}
