package com.typeddsl.dag.ir;

import java.util.List;

/**
 * One entry of the pending-operation log.
 *
 * <p>
 * {@code inputs} and {@code outputs} hold value names, never node names.
 * Placeholder pseudo-records have no inputs and a single output, and are
 * never turned into graph nodes.
 *
 * @param position    0-based index in the log.
 * @param nodeName    Stable node identifier, see {@link ValueNames#nodeName}.
 * @param opClass     Operator class.
 * @param inputs      Consumed value names, in argument order.
 * @param outputs     Produced value names, non-empty.
 * @param placeholder Whether this record only introduces a placeholder.
 */
public record OperationRecord(int position, String nodeName, String opClass,
        List<String> inputs, List<String> outputs, boolean placeholder) {

    public OperationRecord {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        if (outputs.isEmpty())
            throw new IllegalArgumentException("Operation " + nodeName + " has no outputs");
    }

    public boolean produces(String valueName) {
        return outputs.contains(valueName);
    }

    public boolean consumes(String valueName) {
        return inputs.contains(valueName);
    }
}
