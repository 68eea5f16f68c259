package com.swipesentinel.api;

/**
 * A failed model call, tagged with its {@link ModelErrorKind}.
 *
 * Never escapes the decision layer: policies convert it into an error outcome.
 */
public class ModelCallException extends Exception {

    private final ModelErrorKind kind;

    public ModelCallException(ModelErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelCallException(ModelErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ModelErrorKind getKind() { return kind; }
}
