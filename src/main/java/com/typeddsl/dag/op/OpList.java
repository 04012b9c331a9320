package com.typeddsl.dag.op;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.dsl.Value;

import java.util.List;

/**
 * Operator over a homogeneous list of arguments, e.g. a merge of N model
 * outputs built in a loop. The list may be empty only when a program is
 * active on the calling thread.
 */
public class OpList<A, R> extends Op<R> {

    public OpList(String name) {
        this(name, 1);
    }

    public OpList(String name, int outputs) {
        super(name, Signature.list().withOutputs(outputs));
    }

    public Value<R> call(List<? extends Operand<? extends A>> args) {
        return invoke(List.copyOf(args));
    }
}
