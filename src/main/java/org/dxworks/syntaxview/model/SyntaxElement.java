package org.dxworks.syntaxview.model;

/**
 * An element of a parsed syntax tree: either an interior {@link SyntaxNode}
 * or a leaf {@link SyntaxToken}.
 */
public interface SyntaxElement {

    String getKind();

    /**
     * Name of the concrete variant, e.g. {@code ClassDeclarationSyntax}.
     */
    String getTypeName();

    boolean isToken();

    SyntaxNode getParent();

    /**
     * Span of the element without its outermost leading and trailing trivia.
     */
    TextSpan getSpan();

    TextSpan getFullSpan();

    /**
     * Source text of the element including all of its trivia.
     */
    String getFullText();

    /**
     * Ordered properties exposed by the concrete variant.
     */
    PropertySchema getPropertySchema();
}
