package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator with two leading arguments of their own types followed by
 * homogeneous varargs.
 */
public class OpPrefix2Variadic<P, Q, A, R> extends Op<R> {

    public OpPrefix2Variadic(String name) {
        this(name, 1);
    }

    public OpPrefix2Variadic(String name, int outputs) {
        super(name, Signature.prefixVariadic(2).withOutputs(outputs));
    }

    @SafeVarargs
    public final Value<R> call(Operand<? extends P> first, Operand<? extends Q> second, Operand<? extends A>... rest) {
        List<Operand<?>> args = new ArrayList<>(rest.length + 2);
        args.add(first);
        args.add(second);
        for (Operand<? extends A> arg : rest)
            args.add(arg);
        return invoke(args);
    }
}
