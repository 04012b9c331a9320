package com.typeddsl.dag.exceptions;

/**
 * Thrown when a program is popped from a scope stack that holds none.
 */
public class EmptyScopeStackException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public EmptyScopeStackException(String message) {
        super(message);
    }
}
