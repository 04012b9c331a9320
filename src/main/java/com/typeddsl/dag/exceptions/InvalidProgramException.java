package com.typeddsl.dag.exceptions;

/**
 * Thrown when a null program is handed to the scope stack.
 */
public class InvalidProgramException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidProgramException(String message) {
        super(message);
    }
}
