package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.Arrays;

/**
 * Operator over homogeneous varargs.
 */
public class OpVariadic<A, R> extends Op<R> {

    public OpVariadic(String name) {
        this(name, 1);
    }

    public OpVariadic(String name, int outputs) {
        super(name, Signature.variadic().withOutputs(outputs));
    }

    @SafeVarargs
    public final Value<R> call(Operand<? extends A>... args) {
        return invoke(Arrays.asList(args));
    }
}
