package com.typeddsl.dag.api;

import com.typeddsl.dag.dsl.Program;

/**
 * Anything that can be passed to an operator: a declared variable or the
 * result of another operator application.
 *
 * <p>
 * The type parameter only exists for the compiler. It lets operator
 * signatures such as {@code Op2<String, String, Integer>} reject ill-typed
 * arguments at the call site; nothing is checked at run time.
 *
 * @param <T> The type of the value this operand stands for.
 */
public interface Operand<T> {

    /**
     * Resolves the value name that a consuming operation should list as its
     * input. For a pending operator result this records the operation first.
     *
     * @return The value name, never null.
     */
    String valueName();

    /**
     * The program this operand belongs to. Operators use it to decide where the
     * application is recorded.
     */
    Program program();
}
