package org.dxworks.syntaxview.model;

import java.util.Objects;

/**
 * Non-semantic text attached to a token, such as whitespace, line breaks or comments.
 */
public final class Trivia {
    private final String kind;
    private final String text;

    public Trivia(String kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
