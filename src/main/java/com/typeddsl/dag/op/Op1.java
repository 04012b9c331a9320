package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.List;

/**
 * Operator with one argument.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code new Op1<Integer, Integer>("add_one")}</li>
 * <li>{@code new Op1<String, Integer>("parse_int")}</li>
 * </ul>
 */
public class Op1<A, R> extends Op<R> {

    public Op1(String name) {
        this(name, 1);
    }

    /** A multi-output operator; unpack its results with {@link Value#unpack}. */
    public Op1(String name, int outputs) {
        super(name, Signature.fixed(1).withOutputs(outputs));
    }

    public Value<R> call(Operand<? extends A> a) {
        return invoke(List.of(a));
    }
}
