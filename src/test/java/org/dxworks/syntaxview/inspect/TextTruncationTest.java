package org.dxworks.syntaxview.inspect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TextTruncationTest {

    @Test
    void keeps_text_that_fits() {
        String text = "a".repeat(50);
        assertSame(text, TextTruncation.truncate(text, 50));
        assertEquals("short", TextTruncation.truncate("short", 100));
    }

    @Test
    void keeps_empty_and_null() {
        assertEquals("", TextTruncation.truncate("", 0));
        assertNull(TextTruncation.truncate(null, 10));
    }

    @Test
    void cuts_long_single_line_at_max_length() {
        assertEquals("abcde...", TextTruncation.truncate("abcdefghij", 5));
    }

    @Test
    void cuts_at_first_line_break_before_max_length() {
        assertEquals("first...", TextTruncation.truncate("first\nsecond line that is long", 20));
        assertEquals("first...", TextTruncation.truncate("first\r\nsecond line that is long", 20));
        assertEquals("first...", TextTruncation.truncate("first\rsecond line that is long", 20));
    }

    @Test
    void line_break_after_max_length_does_not_extend_the_cut() {
        String text = "0123456789abcdef\nrest";
        assertEquals("0123456789...", TextTruncation.truncate(text, 10));
    }

    @Test
    void multi_line_text_that_fits_is_left_alone() {
        assertEquals("a\nb", TextTruncation.truncate("a\nb", 10));
    }

    @Test
    void leading_line_break_cuts_everything() {
        assertEquals("...", TextTruncation.truncate("\n" + "x".repeat(20), 10));
    }

    @Test
    void negative_max_length_behaves_like_zero() {
        assertEquals("...", TextTruncation.truncate("abc", -5));
    }

    @Test
    void result_is_prefix_plus_ellipsis_for_many_inputs() {
        String[] samples = {
                "plain text without breaks but long enough",
                "line one\nline two\nline three",
                "\r\nstarts with a break",
                "x".repeat(200),
                "tab\tseparated\tvalues and more text"
        };
        for (String sample : samples) {
            for (int max = 0; max <= 45; max++) {
                String result = TextTruncation.truncate(sample, max);
                if (sample.length() <= max) {
                    assertEquals(sample, result);
                    continue;
                }
                assertTrue(result.endsWith(TextTruncation.ELLIPSIS), result);
                String prefix = result.substring(0, result.length() - TextTruncation.ELLIPSIS.length());
                assertTrue(sample.startsWith(prefix));
                int lineBreak = TextTruncation.firstLineBreak(sample);
                int expectedCut = lineBreak == -1 ? max : Math.min(lineBreak, max);
                assertEquals(expectedCut, prefix.length());
            }
        }
    }
}
