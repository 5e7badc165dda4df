package org.dxworks.syntaxview.render;

import org.dxworks.syntaxview.tree.DisplayNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Renders a display tree as indented text, one label per line.
 */
public class TreeTextRenderer {

    private static final String INDENT = "  ";

    private final PresentationTheme theme;

    public TreeTextRenderer() {
        this(PresentationTheme.PLAIN);
    }

    public TreeTextRenderer(PresentationTheme theme) {
        this.theme = Objects.requireNonNull(theme, "theme");
    }

    public String render(DisplayNode root) {
        StringBuilder sb = new StringBuilder();
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{root, 0});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            DisplayNode node = (DisplayNode) entry[0];
            int depth = (Integer) entry[1];

            sb.append(INDENT.repeat(depth))
              .append(theme.style(node.getClassification(), node.getLabel()))
              .append('\n');

            List<DisplayNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Object[]{children.get(i), depth + 1});
            }
        }
        return sb.toString();
    }
}
