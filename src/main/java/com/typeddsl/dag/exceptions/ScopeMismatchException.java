package com.typeddsl.dag.exceptions;

/**
 * Thrown when a scope is closed while a different program sits on top of the
 * stack. The stack is left as it was.
 */
public class ScopeMismatchException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public ScopeMismatchException(String message) {
        super(message);
    }
}
