package com.typeddsl.dag.exceptions;

/**
 * Thrown when the current program is requested but no scope is open on the
 * calling thread.
 */
public class NoActiveProgramException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public NoActiveProgramException(String message) {
        super(message);
    }
}
