package org.dxworks.syntaxview.inspect;

/**
 * Bounds the length of values rendered as single display rows.
 */
public final class TextTruncation {

    public static final String ELLIPSIS = "...";

    private TextTruncation() {
        // utility class
    }

    /**
     * Returns {@code text} unchanged when it fits in {@code maxLength}; otherwise cuts it at the
     * first line break or at {@code maxLength}, whichever comes first, and appends {@link #ELLIPSIS}.
     */
    public static String truncate(String text, int maxLength) {
        int limit = Math.max(0, maxLength);
        if (text == null || text.isEmpty() || text.length() <= limit) {
            return text;
        }
        int cut = limit;
        int lineBreak = firstLineBreak(text);
        if (lineBreak != -1) {
            cut = Math.min(lineBreak, limit);
        }
        return text.substring(0, cut) + ELLIPSIS;
    }

    static int firstLineBreak(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') return i;
        }
        return -1;
    }
}
