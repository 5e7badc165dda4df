package org.dxworks.syntaxview.render;

import org.dxworks.syntaxview.inspect.PropertyEntry;

import java.util.List;

/**
 * Renders property entries as a two-column table. Error rows are marked with {@code !}.
 */
public class PropertyTableRenderer {

    public String render(List<PropertyEntry> entries) {
        int width = 0;
        for (PropertyEntry entry : entries) {
            width = Math.max(width, entry.getName().length());
        }
        String continuation = " ".repeat(width + 4);

        StringBuilder sb = new StringBuilder();
        for (PropertyEntry entry : entries) {
            sb.append(entry.isError() ? "! " : "  ")
              .append(entry.getName())
              .append(" ".repeat(width - entry.getName().length()))
              .append("  ");
            String value = entry.getFormattedValue() == null ? "null" : entry.getFormattedValue();
            String[] lines = value.split("\r\n|\r|\n", -1);
            sb.append(lines[0]).append('\n');
            for (int i = 1; i < lines.length; i++) {
                sb.append(continuation).append(lines[i].stripLeading()).append('\n');
            }
        }
        return sb.toString();
    }
}
