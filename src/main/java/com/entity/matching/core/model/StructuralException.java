package com.entity.matching.core.model;

/**
 * Runtime exception thrown when input data cannot be matched as given:
 * duplicated row keys, mismatched field sets, unknown bucket keys or
 * unreadable tables. Raised before any scoring starts and never retried.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
