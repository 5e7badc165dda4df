package org.dxworks.syntaxview.model;

import java.util.Objects;

public final class TextSpan {
    private final int start;
    private final int length;

    public TextSpan(int start, int length) {
        if (start < 0) throw new IllegalArgumentException("start must not be negative: " + start);
        if (length < 0) throw new IllegalArgumentException("length must not be negative: " + length);
        this.start = start;
        this.length = length;
    }

    public static TextSpan fromBounds(int start, int end) {
        return new TextSpan(start, end - start);
    }

    public int getStart() {
        return start;
    }

    public int getLength() {
        return length;
    }

    public int getEnd() {
        return start + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextSpan)) return false;
        TextSpan other = (TextSpan) o;
        return start == other.start && length == other.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, length);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + getEnd() + ")";
    }
}
