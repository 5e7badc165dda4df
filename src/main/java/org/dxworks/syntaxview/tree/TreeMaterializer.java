package org.dxworks.syntaxview.tree;

import org.dxworks.syntaxview.model.ChildSyntaxList;
import org.dxworks.syntaxview.model.SyntaxElement;
import org.dxworks.syntaxview.model.SyntaxNode;
import org.dxworks.syntaxview.model.SyntaxToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Converts a parsed syntax tree into a tree of {@link DisplayNode}s, in source order.
 * <p>
 * The walk uses an explicit work stack. Nodes nested deeper than {@code maxDepth} are replaced by a
 * placeholder leaf instead of being expanded, and every replacement is reported as a
 * {@link TraversalAnomaly}.
 */
public class TreeMaterializer {

    public static final int DEFAULT_MAX_DEPTH = 2000;
    public static final String DEPTH_LIMIT_SUFFIX = " [depth limit exceeded]";
    public static final String MISSING_CHILD_LABEL = "<missing child>";

    private final int maxDepth;

    public TreeMaterializer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TreeMaterializer(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public MaterializedTree materialize(SyntaxElement root) {
        Objects.requireNonNull(root, "root");
        List<TraversalAnomaly> anomalies = new ArrayList<>();

        if (root.isToken()) {
            return new MaterializedTree(root, tokenLeaf(root), anomalies);
        }

        DisplayNode rootDisplay = new DisplayNode(nodeLabel(root), Classification.NODE, root, false);
        Deque<Frame> stack = new ArrayDeque<>();
        if (root instanceof SyntaxNode) {
            stack.push(new Frame((SyntaxNode) root, rootDisplay, 0));
        }

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            ChildSyntaxList children = frame.node.getChildren();
            List<Frame> expanded = new ArrayList<>();
            int childDepth = frame.depth + 1;

            for (int i = 0; i < children.size(); i++) {
                SyntaxElement child = children.get(i);
                if (child == null) {
                    frame.display.addChild(new DisplayNode(MISSING_CHILD_LABEL, Classification.NODE, null, true));
                    anomalies.add(new TraversalAnomaly(TraversalAnomaly.Type.MISSING_CHILD,
                            frame.display.getLabel(), i, childDepth));
                    continue;
                }

                if (child.isToken()) {
                    frame.display.addChild(tokenLeaf(child));
                    continue;
                }

                if (childDepth > maxDepth) {
                    frame.display.addChild(new DisplayNode(nodeLabel(child) + DEPTH_LIMIT_SUFFIX,
                            Classification.NODE, child, true));
                    anomalies.add(new TraversalAnomaly(TraversalAnomaly.Type.DEPTH_LIMIT_EXCEEDED,
                            frame.display.getLabel(), i, childDepth));
                    continue;
                }

                DisplayNode childDisplay = new DisplayNode(nodeLabel(child), Classification.NODE, child, false);
                frame.display.addChild(childDisplay);
                if (child instanceof SyntaxNode) {
                    expanded.add(new Frame((SyntaxNode) child, childDisplay, childDepth));
                }
            }

            // children are already attached in order; pushing in reverse only keeps the walk left-to-right
            for (int i = expanded.size() - 1; i >= 0; i--) {
                stack.push(expanded.get(i));
            }
        }

        return new MaterializedTree(root, rootDisplay, anomalies);
    }

    public static String nodeLabel(SyntaxElement node) {
        return node.getKind() + " - " + node.getTypeName();
    }

    public static String tokenLabel(SyntaxElement token) {
        String text = token instanceof SyntaxToken ? ((SyntaxToken) token).getText() : token.toString();
        if (text == null || text.isEmpty()) {
            return token.getKind();
        }
        return token.getKind() + ": \"" + text + "\"";
    }

    private static DisplayNode tokenLeaf(SyntaxElement token) {
        return new DisplayNode(tokenLabel(token), Classification.TOKEN, token, false);
    }

    private static final class Frame {
        final SyntaxNode node;
        final DisplayNode display;
        final int depth;

        Frame(SyntaxNode node, DisplayNode display, int depth) {
            this.node = node;
            this.display = display;
            this.depth = depth;
        }
    }
}
