package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.List;

/**
 * Operator with three arguments.
 */
public class Op3<A, B, C, R> extends Op<R> {

    public Op3(String name) {
        this(name, 1);
    }

    public Op3(String name, int outputs) {
        super(name, Signature.fixed(3).withOutputs(outputs));
    }

    public Value<R> call(Operand<? extends A> a, Operand<? extends B> b, Operand<? extends C> c) {
        return invoke(List.of(a, b, c));
    }
}
