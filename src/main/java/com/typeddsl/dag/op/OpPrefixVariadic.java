package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator with one leading argument of its own type followed by homogeneous
 * varargs, e.g. {@code format(template, arg...)}.
 */
public class OpPrefixVariadic<P, A, R> extends Op<R> {

    public OpPrefixVariadic(String name) {
        this(name, 1);
    }

    public OpPrefixVariadic(String name, int outputs) {
        super(name, Signature.prefixVariadic(1).withOutputs(outputs));
    }

    @SafeVarargs
    public final Value<R> call(Operand<? extends P> prefix, Operand<? extends A>... rest) {
        List<Operand<?>> args = new ArrayList<>(rest.length + 1);
        args.add(prefix);
        for (Operand<? extends A> arg : rest)
            args.add(arg);
        return invoke(args);
    }
}
