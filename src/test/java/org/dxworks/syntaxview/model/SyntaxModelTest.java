package org.dxworks.syntaxview.model;

import org.dxworks.syntaxview.TestTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SyntaxModelTest {

    @Test
    void token_span_excludes_trivia_and_full_span_includes_it() {
        SyntaxToken token = new SyntaxToken("identifier", "name",
                TriviaList.of(new Trivia("whitespace", "  ")),
                TriviaList.of(new Trivia("whitespace", " "), new Trivia("end_of_line", "\n")),
                10);

        assertEquals(new TextSpan(12, 4), token.getSpan());
        assertEquals(TextSpan.fromBounds(10, 18), token.getFullSpan());
        assertEquals("  name \n", token.getFullText());
        assertEquals("name", token.toString());
        assertEquals("[12..16)", token.getSpan().toString());
    }

    @Test
    void node_text_round_trips_source() {
        SyntaxNode root = TestTrees.classFoo();

        assertEquals(TestTrees.CLASS_FOO_SOURCE, root.getFullText());
        assertEquals(TestTrees.CLASS_FOO_SOURCE, root.toString());
        assertEquals(11, root.getDescendantTokens().size());
        assertEquals("class", root.getFirstToken().getText());
        assertEquals("end_of_file", root.getLastToken().getKind());
    }

    @Test
    void parents_are_wired_and_shared_children_keep_their_first_parent() {
        SyntaxToken shared = new SyntaxToken("identifier", "x");
        SyntaxNode first = TestTrees.node("argument", "ArgumentSyntax", shared);
        SyntaxNode second = TestTrees.node("argument", "ArgumentSyntax", shared);

        assertSame(first, shared.getParent());
        assertSame(shared, second.getChildAt(0));
        assertNull(first.getParent());
    }

    @Test
    void children_are_read_only() {
        SyntaxNode root = TestTrees.classFoo();

        assertThrows(UnsupportedOperationException.class,
                () -> root.getChildren().add(new SyntaxToken("identifier", "y")));
    }

    @Test
    void missing_tokens_mark_diagnostics() {
        SyntaxToken missing = new SyntaxToken(SyntaxNode.UNKNOWN_RAW_KIND, "semicolon", "",
                TriviaList.EMPTY, TriviaList.EMPTY, 0, true);
        SyntaxNode statement = TestTrees.node("expression_statement", "ExpressionStatementSyntax",
                new SyntaxToken("identifier", "x"), missing);

        assertTrue(statement.containsDiagnostics());
        assertFalse(statement.isMissing());
        assertFalse(TestTrees.classFoo().containsDiagnostics());
    }

    @Test
    void extended_schema_keeps_parent_order_and_overrides_by_name() {
        PropertySchema schema = PropertySchema.extend(SyntaxToken.SCHEMA)
                .add(SyntaxProperty.of("Text", SyntaxToken.class, t -> "override"))
                .add(SyntaxProperty.of("Extra", SyntaxToken.class, t -> 1))
                .build();

        assertEquals(SyntaxToken.SCHEMA.size() + 1, schema.size());
        assertEquals("Kind", schema.getProperties().get(0).getName());
        assertEquals("Extra", schema.getProperties().get(schema.size() - 1).getName());
        SyntaxProperty text = schema.getProperties().stream()
                .filter(p -> p.getName().equals("Text")).findFirst().orElseThrow();
        assertEquals("override", text.read(new SyntaxToken("identifier", "x")));
    }

    @Test
    void indexed_properties_require_an_index() {
        SyntaxProperty item = SyntaxNode.SCHEMA.getProperties().stream()
                .filter(SyntaxProperty::isIndexed).findFirst().orElseThrow();
        SyntaxNode root = TestTrees.classFoo();

        assertEquals("Item", item.getName());
        assertThrows(IllegalStateException.class, () -> item.read(root));
        assertSame(root.getChildAt(1), item.read(root, 1));
    }

    @Test
    void trivia_list_reports_width_and_text() {
        TriviaList trivia = TriviaList.of(List.of(new Trivia("whitespace", "  "), new Trivia("comment", "// c")));

        assertEquals(6, trivia.getFullWidth());
        assertEquals("  // c", trivia.getText());
        assertEquals(0, TriviaList.EMPTY.getFullWidth());
    }
}
