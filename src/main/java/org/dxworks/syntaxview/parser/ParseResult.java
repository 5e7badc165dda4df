package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.model.SyntaxNode;

import java.util.NoSuchElementException;
import java.util.Objects;

public final class ParseResult {
    private final SyntaxNode root;
    private final ParseFailure failure;

    private ParseResult(SyntaxNode root, ParseFailure failure) {
        this.root = root;
        this.failure = failure;
    }

    public static ParseResult success(SyntaxNode root) {
        return new ParseResult(Objects.requireNonNull(root, "root"), null);
    }

    public static ParseResult failure(ParseFailure failure) {
        return new ParseResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public static ParseResult failure(String message, Throwable cause) {
        return failure(new ParseFailure(message, cause));
    }

    public boolean isSuccess() {
        return root != null;
    }

    public SyntaxNode getRoot() {
        if (root == null) {
            throw new NoSuchElementException("Parse failed: " + failure);
        }
        return root;
    }

    public ParseFailure getFailure() {
        if (failure == null) {
            throw new NoSuchElementException("Parse succeeded");
        }
        return failure;
    }
}
