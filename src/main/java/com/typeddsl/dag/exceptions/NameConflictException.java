package com.typeddsl.dag.exceptions;

/**
 * Thrown when a user-declared value name is registered twice in the same
 * program, or when a user name intrudes on the reserved anonymous namespace.
 *
 * <p>
 * The failed registration has no side effect: the program stays usable and
 * the original binding of the name is untouched.
 */
public class NameConflictException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String name;

    public NameConflictException(String name, String message) {
        super(message);
        this.name = name;
    }

    public NameConflictException(String name) {
        this(name, "Var name already exists: " + name);
    }

    /** The offending value name. */
    public String name() {
        return name;
    }
}
