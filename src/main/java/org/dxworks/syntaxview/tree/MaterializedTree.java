package org.dxworks.syntaxview.tree;

import org.dxworks.syntaxview.model.SyntaxElement;

import java.util.List;
import java.util.Objects;

/**
 * A display tree together with the syntax tree it was built from.
 * <p>
 * Display nodes refer to their elements weakly; this object keeps the syntax tree reachable for as
 * long as it is itself reachable.
 */
public final class MaterializedTree {
    private final SyntaxElement syntaxRoot;
    private final DisplayNode root;
    private final List<TraversalAnomaly> anomalies;

    public MaterializedTree(SyntaxElement syntaxRoot, DisplayNode root, List<TraversalAnomaly> anomalies) {
        this.syntaxRoot = Objects.requireNonNull(syntaxRoot, "syntaxRoot");
        this.root = Objects.requireNonNull(root, "root");
        this.anomalies = List.copyOf(anomalies);
    }

    public SyntaxElement getSyntaxRoot() {
        return syntaxRoot;
    }

    public DisplayNode getRoot() {
        return root;
    }

    public List<TraversalAnomaly> getAnomalies() {
        return anomalies;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
