package com.typeddsl.dag.dsl;

import com.typeddsl.dag.api.Operand;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of applying an operator, not yet recorded.
 *
 * <p>
 * A value is recorded when it is bound: assigned to a {@link Var}, unpacked
 * into several variables, or passed to another operator. In the last case the
 * operation is recorded once, under an anonymous name, and that name is
 * reused if the same value is passed again.
 *
 * <p>
 * The input names are fixed when the value is created. If one of those inputs
 * is reassigned before the value is recorded, the value would silently read
 * the new binding; recording it is refused instead.
 *
 * @param <T> Compile-time type of the result.
 */
public final class Value<T> implements Operand<T> {
    private final Program program;
    private final String opClass;
    private final List<String> inputNames;
    private final int outputCount;
    private final int createdAt;

    private String anonymousName;

    Value(Program program, String opClass, List<String> inputNames, int outputCount) {
        this.program = program;
        this.opClass = opClass;
        this.inputNames = List.copyOf(inputNames);
        this.outputCount = outputCount;
        this.createdAt = program.logSize();
    }

    /**
     * Records the operation under an anonymous name, once, and returns that
     * name.
     *
     * @throws IllegalStateException if the operator produces several values.
     */
    @Override
    public String valueName() {
        if (anonymousName == null) {
            requireSingleOutput();
            String generated = program.nextAnonymousName();
            record(List.of(generated));
            anonymousName = generated;
        }
        return anonymousName;
    }

    /**
     * Binds every output of a multi-output operator, in order.
     *
     * @throws IllegalArgumentException if the number of variables differs from
     *                                  the operator's output count, a variable
     *                                  repeats, or belongs to another program.
     */
    public void unpack(Var<?>... outputs) {
        if (outputs.length != outputCount)
            throw new IllegalArgumentException("Operation " + opClass + " produces " + outputCount
                    + " value(s), cannot unpack into " + outputs.length);
        List<String> names = new ArrayList<>(outputs.length);
        Set<Var<?>> seen = new HashSet<>();
        for (Var<?> out : outputs) {
            requireSameProgram(out);
            if (!seen.add(out))
                throw new IllegalArgumentException("Var " + out.name() + " listed twice when unpacking " + opClass);
            names.add(out.name());
        }
        record(names);
        for (Var<?> out : outputs)
            out.markAssigned();
    }

    void assignTo(Var<?> target) {
        requireSameProgram(target);
        requireSingleOutput();
        record(List.of(target.name()));
        target.markAssigned();
    }

    /**
     * Fails the way {@link #valueName()} would, without recording anything.
     */
    void checkOperand() {
        if (anonymousName != null)
            return;
        requireSingleOutput();
        requireFreshInputs();
    }

    private void record(List<String> outputs) {
        requireFreshInputs();
        program.record(opClass, inputNames, outputs);
    }

    private void requireFreshInputs() {
        for (String in : inputNames)
            if (program.lastProducer(in) >= createdAt)
                throw new IllegalStateException("Input '" + in + "' of " + opClass
                        + " was reassigned after the operator was applied; apply it again");
    }

    private void requireSingleOutput() {
        if (outputCount != 1)
            throw new IllegalStateException("Operation " + opClass + " produces " + outputCount
                    + " values; unpack it into variables");
    }

    private void requireSameProgram(Var<?> var) {
        if (var.program() != program)
            throw new IllegalArgumentException("Var " + var.name() + " belongs to program '"
                    + var.program().name() + "', not '" + program.name() + "'");
    }

    @Override
    public Program program() {
        return program;
    }

    public String opClass() {
        return opClass;
    }

    public List<String> inputNames() {
        return inputNames;
    }

    public int outputCount() {
        return outputCount;
    }

    /** True once the operation has been recorded under an anonymous name. */
    public boolean isMaterialized() {
        return anonymousName != null;
    }

    @Override
    public String toString() {
        return opClass + inputNames;
    }
}
