package org.dxworks.syntaxview.parser;

/**
 * Zero-based row and byte column reported by Tree-sitter.
 */
public final class SourcePoint {
    private final int row;
    private final int column;

    public SourcePoint(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
