package org.dxworks.syntaxview.parser;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a source text could not be turned into a syntax tree at all.
 */
public final class ParseFailure {
    private final String message;
    private final Throwable cause;

    public ParseFailure(String message) {
        this(message, null);
    }

    public ParseFailure(String message, Throwable cause) {
        this.message = Objects.requireNonNull(message, "message");
        this.cause = cause;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return cause == null ? message : message + ": " + cause.getMessage();
    }
}
