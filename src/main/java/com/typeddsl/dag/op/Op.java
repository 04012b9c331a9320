package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Program;
import com.typeddsl.dag.dsl.ProgramContext;
import com.typeddsl.dag.dsl.Value;

import java.util.List;

/**
 * Base class for operators. An operator is only a name and a
 * {@link Signature}; applying it records nothing until the result is bound.
 *
 * <p>
 * The program an application goes to is taken from its first operand. An
 * operator applied to no operands falls back to
 * {@link ProgramContext#current()}.
 *
 * @param <R> Result type.
 */
public abstract class Op<R> {
    private final String name;
    private final Signature signature;

    protected Op(String name, Signature signature) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Operator name must not be blank");
        if (signature == null)
            throw new IllegalArgumentException("Operator " + name + " needs a signature");
        this.name = name;
        this.signature = signature;
    }

    /** The operator class recorded in the graph. */
    public String name() {
        return name;
    }

    public Signature signature() {
        return signature;
    }

    protected final Value<R> invoke(List<? extends Operand<?>> args) {
        signature.check(name, args.size());
        Program program = args.isEmpty() ? ProgramContext.current() : args.get(0).program();
        return program.apply(name, signature.outputs(), args);
    }

    @Override
    public String toString() {
        return name;
    }
}
