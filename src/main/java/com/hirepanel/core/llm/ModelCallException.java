package com.hirepanel.core.llm;

import com.hirepanel.core.model.ErrorKind;

/**
 * Thrown when a model call fails; {@link #kind()} classifies the failure.
 */
public class ModelCallException extends RuntimeException {

    private final ErrorKind kind;

    public ModelCallException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelCallException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
