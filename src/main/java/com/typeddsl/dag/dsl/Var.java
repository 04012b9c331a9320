package com.typeddsl.dag.dsl;

import com.typeddsl.dag.api.Operand;

/**
 * A variable of a program: a value name that operator results can be bound
 * to, any number of times.
 *
 * <p>
 * Each {@link #set(Value)} records the operation with this variable's name as
 * its output. A later assignment shadows the earlier one: consumers recorded
 * in between read the earlier value, consumers recorded afterwards read the
 * new one.
 *
 * <p>
 * Variables come in three flavors:
 * <ul>
 * <li><b>Named:</b> the name is claimed in the program's registry and the
 * final assignment is assumed to be observed from outside.</li>
 * <li><b>Anonymous:</b> the program generates a name; its operations survive
 * only if something live consumes them.</li>
 * <li><b>Placeholder:</b> an external input, always live.</li>
 * </ul>
 *
 * @param <T> Compile-time type of the value.
 */
public final class Var<T> implements Operand<T> {
    private final Program program;
    private final String name;
    private final boolean anonymous;
    private final boolean placeholder;
    private int assignments;

    Var(Program program, String name, boolean anonymous, boolean placeholder) {
        this.program = program;
        this.name = name;
        this.anonymous = anonymous;
        this.placeholder = placeholder;
    }

    // ── Declarations against the current program ────────────────

    /** Declares a named variable in {@link ProgramContext#current()}. */
    public static <T> Var<T> named(String name) {
        return ProgramContext.current().var(name);
    }

    /** Declares an anonymous variable in {@link ProgramContext#current()}. */
    public static <T> Var<T> anonymous() {
        return ProgramContext.current().var();
    }

    /** Declares a placeholder in {@link ProgramContext#current()}. */
    public static <T> Var<T> placeholder(String name) {
        return ProgramContext.current().placeholder(name);
    }

    // ── Assignment ──────────────────────────────────────────────

    /**
     * Binds this variable to the result of an operator application.
     *
     * @return this, for chaining.
     */
    public Var<T> set(Value<? extends T> value) {
        value.assignTo(this);
        return this;
    }

    void markAssigned() {
        assignments++;
    }

    // ── Accessors ────────────────────────────────────────────────

    public String name() {
        return name;
    }

    @Override
    public String valueName() {
        return name;
    }

    @Override
    public Program program() {
        return program;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    /** Number of operations bound to this variable so far. */
    public int assignments() {
        return assignments;
    }

    /** True once the variable has a producer: a placeholder or an assignment. */
    public boolean isBound() {
        return placeholder || assignments > 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
