package org.dxworks.syntaxview.tree;

import java.util.Objects;

/**
 * A child slot that could not be materialized and was replaced by a placeholder.
 */
public final class TraversalAnomaly {

    public enum Type {
        DEPTH_LIMIT_EXCEEDED,
        MISSING_CHILD
    }

    private final Type type;
    private final String parentLabel;
    private final int childIndex;
    private final int depth;

    public TraversalAnomaly(Type type, String parentLabel, int childIndex, int depth) {
        this.type = Objects.requireNonNull(type, "type");
        this.parentLabel = parentLabel;
        this.childIndex = childIndex;
        this.depth = depth;
    }

    public Type getType() {
        return type;
    }

    public String getParentLabel() {
        return parentLabel;
    }

    public int getChildIndex() {
        return childIndex;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return type + " at depth " + depth + " (child " + childIndex + " of " + parentLabel + ")";
    }
}
