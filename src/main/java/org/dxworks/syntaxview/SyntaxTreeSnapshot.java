package org.dxworks.syntaxview;

import org.dxworks.syntaxview.model.SyntaxNode;
import org.dxworks.syntaxview.tree.MaterializedTree;

import java.util.Objects;

/**
 * One fully built parse: the source, its syntax tree and the display tree materialized from it.
 * The snapshot keeps the syntax tree reachable for the display nodes that point into it.
 */
public final class SyntaxTreeSnapshot {
    private final String sourceText;
    private final SyntaxNode root;
    private final MaterializedTree displayTree;

    public SyntaxTreeSnapshot(String sourceText, SyntaxNode root, MaterializedTree displayTree) {
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
        this.root = Objects.requireNonNull(root, "root");
        this.displayTree = Objects.requireNonNull(displayTree, "displayTree");
    }

    public String getSourceText() {
        return sourceText;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public MaterializedTree getDisplayTree() {
        return displayTree;
    }
}
