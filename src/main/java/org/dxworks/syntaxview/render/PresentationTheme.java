package org.dxworks.syntaxview.render;

import org.dxworks.syntaxview.tree.Classification;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal styling for display tree labels, chosen by the caller per rendering.
 */
public final class PresentationTheme {

    private static final String RESET = "\u001B[0m";

    public static final PresentationTheme PLAIN = new PresentationTheme("", "", "");

    /** 24-bit colors readable on dark terminal backgrounds. */
    public static final PresentationTheme DARK = new PresentationTheme(
            "\u001B[38;2;100;150;255m",
            "\u001B[38;2;0;200;0m",
            RESET);

    private final Map<Classification, String> styles = new EnumMap<>(Classification.class);
    private final String reset;

    public PresentationTheme(String nodeStyle, String tokenStyle, String reset) {
        styles.put(Classification.NODE, Objects.requireNonNull(nodeStyle, "nodeStyle"));
        styles.put(Classification.TOKEN, Objects.requireNonNull(tokenStyle, "tokenStyle"));
        this.reset = Objects.requireNonNull(reset, "reset");
    }

    public String style(Classification classification, String text) {
        String style = styles.get(classification);
        if (style.isEmpty()) {
            return text;
        }
        return style + text + reset;
    }
}
