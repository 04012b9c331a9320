package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.List;

/**
 * Operator with two arguments.
 */
public class Op2<A, B, R> extends Op<R> {

    public Op2(String name) {
        this(name, 1);
    }

    public Op2(String name, int outputs) {
        super(name, Signature.fixed(2).withOutputs(outputs));
    }

    public Value<R> call(Operand<? extends A> a, Operand<? extends B> b) {
        return invoke(List.of(a, b));
    }
}
