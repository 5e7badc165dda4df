package org.dxworks.syntaxview.model;

import java.util.Objects;

/**
 * Leaf element of a syntax tree carrying literal source text and its trivia.
 */
public class SyntaxToken implements SyntaxElement {

    public static final PropertySchema SCHEMA = PropertySchema.builder()
            .add(SyntaxProperty.of("Kind", SyntaxToken.class, SyntaxToken::getKind))
            .add(SyntaxProperty.of("RawKind", SyntaxToken.class, SyntaxToken::getRawKind))
            .add(SyntaxProperty.of("Text", SyntaxToken.class, SyntaxToken::getText))
            .add(SyntaxProperty.of("Span", SyntaxToken.class, SyntaxToken::getSpan))
            .add(SyntaxProperty.of("FullSpan", SyntaxToken.class, SyntaxToken::getFullSpan))
            .add(SyntaxProperty.of("Width", SyntaxToken.class, SyntaxToken::getWidth))
            .add(SyntaxProperty.of("FullWidth", SyntaxToken.class, SyntaxToken::getFullWidth))
            .add(SyntaxProperty.of("Parent", SyntaxToken.class, SyntaxToken::getParent))
            .add(SyntaxProperty.of("LeadingTrivia", SyntaxToken.class, SyntaxToken::getLeadingTrivia))
            .add(SyntaxProperty.of("TrailingTrivia", SyntaxToken.class, SyntaxToken::getTrailingTrivia))
            .add(SyntaxProperty.of("HasLeadingTrivia", SyntaxToken.class, SyntaxToken::hasLeadingTrivia))
            .add(SyntaxProperty.of("HasTrailingTrivia", SyntaxToken.class, SyntaxToken::hasTrailingTrivia))
            .add(SyntaxProperty.of("IsMissing", SyntaxToken.class, SyntaxToken::isMissing))
            .build();

    private final int rawKind;
    private final String kind;
    private final String text;
    private final TriviaList leadingTrivia;
    private final TriviaList trailingTrivia;
    private final int position;
    private final boolean missing;
    private SyntaxNode parent;

    public SyntaxToken(String kind, String text) {
        this(SyntaxNode.UNKNOWN_RAW_KIND, kind, text, TriviaList.EMPTY, TriviaList.EMPTY, 0, false);
    }

    public SyntaxToken(String kind, String text, TriviaList leadingTrivia, TriviaList trailingTrivia, int position) {
        this(SyntaxNode.UNKNOWN_RAW_KIND, kind, text, leadingTrivia, trailingTrivia, position, false);
    }

    /**
     * @param position offset of the start of the leading trivia in the source text
     * @param missing  whether the parser inserted this token without any source text
     */
    public SyntaxToken(int rawKind, String kind, String text, TriviaList leadingTrivia,
                       TriviaList trailingTrivia, int position, boolean missing) {
        if (position < 0) throw new IllegalArgumentException("position must not be negative: " + position);
        this.rawKind = rawKind;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.leadingTrivia = leadingTrivia != null ? leadingTrivia : TriviaList.EMPTY;
        this.trailingTrivia = trailingTrivia != null ? trailingTrivia : TriviaList.EMPTY;
        this.position = position;
        this.missing = missing;
    }

    void attachTo(SyntaxNode newParent) {
        if (parent == null) {
            parent = newParent;
        }
    }

    @Override
    public String getKind() {
        return kind;
    }

    public int getRawKind() {
        return rawKind;
    }

    @Override
    public String getTypeName() {
        return getClass().getSimpleName();
    }

    @Override
    public boolean isToken() {
        return true;
    }

    @Override
    public SyntaxNode getParent() {
        return parent;
    }

    public String getText() {
        return text;
    }

    public TriviaList getLeadingTrivia() {
        return leadingTrivia;
    }

    public TriviaList getTrailingTrivia() {
        return trailingTrivia;
    }

    public boolean hasLeadingTrivia() {
        return !leadingTrivia.isEmpty();
    }

    public boolean hasTrailingTrivia() {
        return !trailingTrivia.isEmpty();
    }

    public boolean isMissing() {
        return missing;
    }

    public int getWidth() {
        return text.length();
    }

    public int getFullWidth() {
        return leadingTrivia.getFullWidth() + text.length() + trailingTrivia.getFullWidth();
    }

    @Override
    public TextSpan getSpan() {
        return new TextSpan(position + leadingTrivia.getFullWidth(), text.length());
    }

    @Override
    public TextSpan getFullSpan() {
        return new TextSpan(position, getFullWidth());
    }

    @Override
    public String getFullText() {
        return leadingTrivia.getText() + text + trailingTrivia.getText();
    }

    @Override
    public PropertySchema getPropertySchema() {
        return SCHEMA;
    }

    @Override
    public String toString() {
        return text;
    }
}
