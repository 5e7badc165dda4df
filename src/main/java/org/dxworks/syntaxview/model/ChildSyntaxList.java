package org.dxworks.syntaxview.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered child nodes and tokens of a {@link SyntaxNode}, in source order.
 */
public final class ChildSyntaxList extends AbstractList<SyntaxElement> {
    private final List<SyntaxElement> children;

    ChildSyntaxList(List<? extends SyntaxElement> children) {
        // may hold null slots; the materializer reports them
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public SyntaxElement get(int index) {
        return children.get(index);
    }

    @Override
    public int size() {
        return children.size();
    }
}
