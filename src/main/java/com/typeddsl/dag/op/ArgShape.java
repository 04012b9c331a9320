package com.typeddsl.dag.op;

/**
 * How an operator takes its arguments.
 */
public enum ArgShape {
    /** Exactly {@code fixedArity} arguments. */
    FIXED,
    /** A single homogeneous list, any length. */
    LIST,
    /** Homogeneous varargs, any count. */
    VARIADIC,
    /** {@code fixedArity} leading arguments, then homogeneous varargs. */
    PREFIX_VARIADIC
}
