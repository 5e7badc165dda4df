package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.model.Trivia;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the source text between two tokens into trivia pieces.
 */
final class TriviaScanner {

    static final String WHITESPACE = "whitespace";
    static final String END_OF_LINE = "end_of_line";
    static final String SKIPPED_TEXT = "skipped_text";

    private TriviaScanner() {
        // utility class
    }

    static List<Trivia> scan(String gap) {
        List<Trivia> pieces = new ArrayList<>();
        int i = 0;
        while (i < gap.length()) {
            char c = gap.charAt(i);
            int start = i;
            if (c == '\r' || c == '\n') {
                i += (c == '\r' && i + 1 < gap.length() && gap.charAt(i + 1) == '\n') ? 2 : 1;
                pieces.add(new Trivia(END_OF_LINE, gap.substring(start, i)));
            } else if (isInlineWhitespace(c)) {
                while (i < gap.length() && isInlineWhitespace(gap.charAt(i))) i++;
                pieces.add(new Trivia(WHITESPACE, gap.substring(start, i)));
            } else {
                while (i < gap.length() && !isLineBreak(gap.charAt(i)) && !isInlineWhitespace(gap.charAt(i))) i++;
                pieces.add(new Trivia(SKIPPED_TEXT, gap.substring(start, i)));
            }
        }
        return pieces;
    }

    static boolean isEndOfLine(Trivia trivia) {
        return END_OF_LINE.equals(trivia.getKind());
    }

    private static boolean isLineBreak(char c) {
        return c == '\r' || c == '\n';
    }

    private static boolean isInlineWhitespace(char c) {
        return !isLineBreak(c) && (Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF');
    }
}
