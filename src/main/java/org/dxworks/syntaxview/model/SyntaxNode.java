package org.dxworks.syntaxview.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Interior element of a syntax tree. Children are kept in source order.
 */
public class SyntaxNode implements SyntaxElement {

    public static final PropertySchema SCHEMA = PropertySchema.builder()
            .add(SyntaxProperty.of("Kind", SyntaxNode.class, SyntaxNode::getKind))
            .add(SyntaxProperty.of("RawKind", SyntaxNode.class, SyntaxNode::getRawKind))
            .add(SyntaxProperty.of("TypeName", SyntaxNode.class, SyntaxNode::getTypeName))
            .add(SyntaxProperty.of("Span", SyntaxNode.class, SyntaxNode::getSpan))
            .add(SyntaxProperty.of("FullSpan", SyntaxNode.class, SyntaxNode::getFullSpan))
            .add(SyntaxProperty.of("Parent", SyntaxNode.class, SyntaxNode::getParent))
            .add(SyntaxProperty.of("ChildNodesAndTokens", SyntaxNode.class, SyntaxNode::getChildren))
            .add(SyntaxProperty.indexed("Item", SyntaxNode.class, SyntaxNode::getChildAt))
            .add(SyntaxProperty.of("ChildCount", SyntaxNode.class, SyntaxNode::getChildCount))
            .add(SyntaxProperty.of("FirstToken", SyntaxNode.class, SyntaxNode::getFirstToken))
            .add(SyntaxProperty.of("LastToken", SyntaxNode.class, SyntaxNode::getLastToken))
            .add(SyntaxProperty.of("HasLeadingTrivia", SyntaxNode.class, SyntaxNode::hasLeadingTrivia))
            .add(SyntaxProperty.of("HasTrailingTrivia", SyntaxNode.class, SyntaxNode::hasTrailingTrivia))
            .add(SyntaxProperty.of("IsMissing", SyntaxNode.class, SyntaxNode::isMissing))
            .add(SyntaxProperty.of("ContainsDiagnostics", SyntaxNode.class, SyntaxNode::containsDiagnostics))
            .build();

    public static final int UNKNOWN_RAW_KIND = -1;

    private final int rawKind;
    private final String kind;
    private final String typeName;
    private final ChildSyntaxList children;
    private SyntaxNode parent;

    public SyntaxNode(String kind, String typeName, List<? extends SyntaxElement> children) {
        this(UNKNOWN_RAW_KIND, kind, typeName, children);
    }

    public SyntaxNode(int rawKind, String kind, String typeName, List<? extends SyntaxElement> children) {
        this.rawKind = rawKind;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.children = new ChildSyntaxList(Objects.requireNonNull(children, "children"));
        for (SyntaxElement child : this.children) {
            if (child instanceof SyntaxNode) {
                ((SyntaxNode) child).attachTo(this);
            } else if (child instanceof SyntaxToken) {
                ((SyntaxToken) child).attachTo(this);
            }
        }
    }

    // a shared element keeps the parent it was first attached to
    void attachTo(SyntaxNode newParent) {
        if (parent == null) {
            parent = newParent;
        }
    }

    @Override
    public String getKind() {
        return kind;
    }

    public int getRawKind() {
        return rawKind;
    }

    @Override
    public String getTypeName() {
        return typeName;
    }

    @Override
    public boolean isToken() {
        return false;
    }

    @Override
    public SyntaxNode getParent() {
        return parent;
    }

    public ChildSyntaxList getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public SyntaxElement getChildAt(int index) {
        return children.get(index);
    }

    /**
     * All tokens below this node in source order.
     */
    public List<SyntaxToken> getDescendantTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxElement element = stack.pop();
            if (element instanceof SyntaxToken) {
                tokens.add((SyntaxToken) element);
            } else if (element instanceof SyntaxNode) {
                ChildSyntaxList list = ((SyntaxNode) element).getChildren();
                for (int i = list.size() - 1; i >= 0; i--) {
                    SyntaxElement child = list.get(i);
                    if (child != null) stack.push(child);
                }
            }
        }
        return tokens;
    }

    public SyntaxToken getFirstToken() {
        List<SyntaxToken> tokens = getDescendantTokens();
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public SyntaxToken getLastToken() {
        List<SyntaxToken> tokens = getDescendantTokens();
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    @Override
    public TextSpan getFullSpan() {
        List<SyntaxToken> tokens = getDescendantTokens();
        if (tokens.isEmpty()) return new TextSpan(0, 0);
        int start = tokens.get(0).getFullSpan().getStart();
        int end = tokens.get(tokens.size() - 1).getFullSpan().getEnd();
        return TextSpan.fromBounds(start, Math.max(start, end));
    }

    @Override
    public TextSpan getSpan() {
        List<SyntaxToken> tokens = getDescendantTokens();
        if (tokens.isEmpty()) return new TextSpan(0, 0);
        int start = tokens.get(0).getSpan().getStart();
        int end = tokens.get(tokens.size() - 1).getSpan().getEnd();
        return TextSpan.fromBounds(start, Math.max(start, end));
    }

    public boolean hasLeadingTrivia() {
        SyntaxToken first = getFirstToken();
        return first != null && first.hasLeadingTrivia();
    }

    public boolean hasTrailingTrivia() {
        SyntaxToken last = getLastToken();
        return last != null && last.hasTrailingTrivia();
    }

    public boolean isMissing() {
        for (SyntaxToken token : getDescendantTokens()) {
            if (!token.isMissing()) return false;
        }
        return true;
    }

    public boolean containsDiagnostics() {
        for (SyntaxToken token : getDescendantTokens()) {
            if (token.isMissing()) return true;
        }
        return false;
    }

    @Override
    public String getFullText() {
        StringBuilder sb = new StringBuilder();
        for (SyntaxToken token : getDescendantTokens()) {
            sb.append(token.getFullText());
        }
        return sb.toString();
    }

    @Override
    public PropertySchema getPropertySchema() {
        return SCHEMA;
    }

    /**
     * Source text without the leading trivia of the first token and the trailing trivia of the last one.
     */
    @Override
    public String toString() {
        List<SyntaxToken> tokens = getDescendantTokens();
        if (tokens.isEmpty()) return "";
        String full = getFullText();
        int from = tokens.get(0).getLeadingTrivia().getFullWidth();
        int to = full.length() - tokens.get(tokens.size() - 1).getTrailingTrivia().getFullWidth();
        return to <= from ? "" : full.substring(from, to);
    }
}
