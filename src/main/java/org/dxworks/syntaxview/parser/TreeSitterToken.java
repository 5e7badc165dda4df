package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.model.PropertySchema;
import org.dxworks.syntaxview.model.SyntaxProperty;
import org.dxworks.syntaxview.model.SyntaxToken;
import org.dxworks.syntaxview.model.TextSpan;
import org.dxworks.syntaxview.model.TriviaList;

public class TreeSitterToken extends SyntaxToken {

    public static final PropertySchema SCHEMA = PropertySchema.extend(SyntaxToken.SCHEMA)
            .add(SyntaxProperty.of("IsNamed", TreeSitterToken.class, TreeSitterToken::isNamed))
            .add(SyntaxProperty.of("FieldName", TreeSitterToken.class, TreeSitterToken::getFieldName))
            .add(SyntaxProperty.of("StartPoint", TreeSitterToken.class, TreeSitterToken::getStartPoint))
            .add(SyntaxProperty.of("EndPoint", TreeSitterToken.class, TreeSitterToken::getEndPoint))
            .add(SyntaxProperty.of("ByteRange", TreeSitterToken.class, TreeSitterToken::getByteRange))
            .build();

    private final boolean named;
    private final String fieldName;
    private final SourcePoint startPoint;
    private final SourcePoint endPoint;
    private final TextSpan byteRange;

    TreeSitterToken(int symbol, String kind, String text, TriviaList leadingTrivia, TriviaList trailingTrivia,
                    int position, boolean missing, boolean named, String fieldName,
                    SourcePoint startPoint, SourcePoint endPoint, TextSpan byteRange) {
        super(symbol, kind, text, leadingTrivia, trailingTrivia, position, missing);
        this.named = named;
        this.fieldName = fieldName;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.byteRange = byteRange;
    }

    public boolean isNamed() {
        return named;
    }

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
    public PropertySchema getPropertySchema() {
        return SCHEMA;
    }
}
