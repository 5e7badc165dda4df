package org.dxworks.syntaxview.tree;

import org.dxworks.syntaxview.model.SyntaxElement;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Presentation-ready node of a materialized syntax tree.
 * <p>
 * Holds only a weak reference to the element it was built from; the parsed tree is kept alive by
 * the snapshot that owns both.
 */
public final class DisplayNode {
    private final String label;
    private final Classification classification;
    private final WeakReference<SyntaxElement> backingElement;
    private final boolean placeholder;
    private final List<DisplayNode> children = new ArrayList<>();
    private final List<DisplayNode> childrenView = Collections.unmodifiableList(children);

    DisplayNode(String label, Classification classification, SyntaxElement backingElement, boolean placeholder) {
        this.label = Objects.requireNonNull(label, "label");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.backingElement = new WeakReference<>(backingElement);
        this.placeholder = placeholder;
    }

    void addChild(DisplayNode child) {
        children.add(child);
    }

    public String getLabel() {
        return label;
    }

    public Classification getClassification() {
        return classification;
    }

    public Optional<SyntaxElement> getBackingElement() {
        return Optional.ofNullable(backingElement.get());
    }

    /**
     * Whether this node stands in for a child that could not be materialized.
     */
    public boolean isPlaceholder() {
        return placeholder;
    }

    public List<DisplayNode> getChildren() {
        return childrenView;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Structural equality: same label, classification, placeholder flag and children.
     * Backing elements are not compared.
     */
    public boolean sameStructureAs(DisplayNode other) {
        if (other == null) return false;
        List<DisplayNode[]> pending = new ArrayList<>();
        pending.add(new DisplayNode[]{this, other});
        while (!pending.isEmpty()) {
            DisplayNode[] pair = pending.remove(pending.size() - 1);
            DisplayNode a = pair[0];
            DisplayNode b = pair[1];
            if (!a.label.equals(b.label)
                    || a.classification != b.classification
                    || a.placeholder != b.placeholder
                    || a.children.size() != b.children.size()) {
                return false;
            }
            for (int i = 0; i < a.children.size(); i++) {
                pending.add(new DisplayNode[]{a.children.get(i), b.children.get(i)});
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return label;
    }
}
