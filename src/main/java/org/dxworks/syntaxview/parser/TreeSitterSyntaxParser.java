package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterJava;

import java.util.Objects;

public class TreeSitterSyntaxParser implements SyntaxParser {

    private final Language language;

    public TreeSitterSyntaxParser(Language language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public Language getLanguage() {
        return language;
    }

    @Override
    public ParseResult parse(String sourceText) {
        if (sourceText == null) {
            return ParseResult.failure(new ParseFailure("No source text to parse"));
        }

        TSParser parser;
        try {
            parser = new TSParser();
            parser.setLanguage(grammarFor(language));
        } catch (RuntimeException | LinkageError e) {
            return ParseResult.failure("Failed to initialize Tree-sitter for " + language.getName(), e);
        }

        try {
            TSTree tree = parser.parseString(null, sourceText);
            if (tree == null) {
                return ParseResult.failure(new ParseFailure("Tree-sitter returned no tree for " + language.getName() + " source"));
            }
            TSNode rootNode = tree.getRootNode();
            if (rootNode == null || rootNode.isNull()) {
                return ParseResult.failure(new ParseFailure("Tree-sitter returned an empty tree for " + language.getName() + " source"));
            }
            return ParseResult.success(new TreeSitterTreeBuilder(sourceText).build(rootNode));
        } catch (RuntimeException e) {
            return ParseResult.failure("Failed to parse " + language.getName() + " source", e);
        }
    }

    static TSLanguage grammarFor(Language language) {
        return switch (language) {
            case JAVA -> new TreeSitterJava();
            case CSHARP -> new TreeSitterCSharp();
        };
    }
}
