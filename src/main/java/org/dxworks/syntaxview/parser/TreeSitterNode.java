package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.model.PropertySchema;
import org.dxworks.syntaxview.model.SyntaxElement;
import org.dxworks.syntaxview.model.SyntaxNode;
import org.dxworks.syntaxview.model.SyntaxProperty;
import org.dxworks.syntaxview.model.TextSpan;

import java.util.List;

/**
 * Interior node converted from a Tree-sitter node, keeping the grammar details Tree-sitter reports.
 */
public class TreeSitterNode extends SyntaxNode {

    public static final PropertySchema SCHEMA = PropertySchema.extend(SyntaxNode.SCHEMA)
            .add(SyntaxProperty.of("IsNamed", TreeSitterNode.class, TreeSitterNode::isNamed))
            .add(SyntaxProperty.of("FieldName", TreeSitterNode.class, TreeSitterNode::getFieldName))
            .add(SyntaxProperty.of("HasError", TreeSitterNode.class, TreeSitterNode::hasError))
            .add(SyntaxProperty.of("StartPoint", TreeSitterNode.class, TreeSitterNode::getStartPoint))
            .add(SyntaxProperty.of("EndPoint", TreeSitterNode.class, TreeSitterNode::getEndPoint))
            .add(SyntaxProperty.of("ByteRange", TreeSitterNode.class, TreeSitterNode::getByteRange))
            .build();

    private final boolean named;
    private final boolean hasError;
    private final String fieldName;
    private final SourcePoint startPoint;
    private final SourcePoint endPoint;
    private final TextSpan byteRange;

    TreeSitterNode(int symbol, String kind, List<? extends SyntaxElement> children, boolean named,
                   boolean hasError, String fieldName, SourcePoint startPoint, SourcePoint endPoint,
                   TextSpan byteRange) {
        super(symbol, kind, SyntaxNames.toTypeName(kind), children);
        this.named = named;
        this.hasError = hasError;
        this.fieldName = fieldName;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.byteRange = byteRange;
    }

    public boolean isNamed() {
        return named;
    }

    public boolean hasError() {
        return hasError;
    }

    /**
     * Name of the grammar field this node fills in its parent, or {@code null}.
     */
    public String getFieldName() {
        return fieldName;
    }

    public SourcePoint getStartPoint() {
        return startPoint;
    }

    public SourcePoint getEndPoint() {
        return endPoint;
    }

    public TextSpan getByteRange() {
        return byteRange;
    }

    @Override
    public boolean containsDiagnostics() {
        return hasError || super.containsDiagnostics();
    }

    @Override
    public PropertySchema getPropertySchema() {
        return SCHEMA;
    }
}
