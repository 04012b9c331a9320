package com.typeddsl.dag.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only log of the operations and placeholders a program has recorded,
 * in declaration order.
 *
 * <p>
 * Each record gets a monotonic position. The log keeps a "last producer"
 * index from value name to the position of the most recent record producing
 * it, so a later producer shadows an earlier one.
 *
 * <p>
 * The log is consumed through {@link #snapshot()}, which copies it so that
 * optimization never aliases state that recording keeps mutating.
 *
 * <p>
 * Not thread-safe.
 */
public final class PendingOps {
    private final List<OperationRecord> records = new ArrayList<>();
    private final Map<String, Integer> lastProducer = new HashMap<>();
    private final Set<String> placeholders = new LinkedHashSet<>();

    // Per-class call counter backing the node naming policy
    private final Map<String, Integer> classUses = new HashMap<>();
    private int operationCount;

    /**
     * Appends one operation.
     *
     * @param opClass Operator class, non-blank.
     * @param inputs  Consumed value names, in argument order. May repeat.
     * @param outputs Produced value names. Non-empty, no duplicates.
     * @return The appended record, carrying its position and node name.
     */
    public OperationRecord addOperation(String opClass, List<String> inputs, List<String> outputs) {
        validate(opClass, inputs, outputs);
        int nth = classUses.merge(opClass, 1, Integer::sum) - 1;
        operationCount++;
        return append(ValueNames.nodeName(opClass, nth), opClass, inputs, outputs, false);
    }

    /**
     * Checks an operation the way {@link #addOperation} does, without
     * appending it.
     *
     * @throws IllegalArgumentException if the op class is blank, or the
     *                                  outputs are missing or repeated, or a
     *                                  name is empty.
     */
    public static void validate(String opClass, List<String> inputs, List<String> outputs) {
        if (opClass == null || opClass.isBlank())
            throw new IllegalArgumentException("Operation class must not be blank");
        if (outputs == null || outputs.isEmpty())
            throw new IllegalArgumentException("Operation " + opClass + " must produce at least one value");
        requireNames(opClass, "input", inputs);
        requireNames(opClass, "output", outputs);
        if (new HashSet<>(outputs).size() != outputs.size())
            throw new IllegalArgumentException("Operation " + opClass + " lists an output twice: " + outputs);
    }

    /**
     * Declares {@code name} as an external input. The first call also appends a
     * zero-input record producing the name, so placeholders take part in
     * producer resolution like any other value.
     *
     * @return false if the name was already a placeholder (nothing recorded).
     */
    public boolean addPlaceholder(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Placeholder name must not be empty");
        if (!placeholders.add(name))
            return false;
        append(ValueNames.placeholderNodeName(name), ValueNames.PLACEHOLDER_OP, List.of(), List.of(name), true);
        return true;
    }

    /** Position of the most recent record producing {@code name}, or -1. */
    public int lastProducer(String name) {
        return lastProducer.getOrDefault(name, -1);
    }

    public boolean isPlaceholder(String name) {
        return placeholders.contains(name);
    }

    public OperationRecord record(int position) {
        return records.get(position);
    }

    /** Total records, placeholder pseudo-records included. */
    public int size() {
        return records.size();
    }

    /** Records created by {@link #addOperation}. */
    public int operationCount() {
        return operationCount;
    }

    /** Immutable copy of the log as it stands. */
    public IrSnapshot snapshot() {
        return new IrSnapshot(records, placeholders);
    }

    private OperationRecord append(String nodeName, String opClass, List<String> inputs, List<String> outputs,
            boolean placeholder) {
        int position = records.size();
        var record = new OperationRecord(position, nodeName, opClass, inputs, outputs, placeholder);
        records.add(record);
        for (String out : outputs)
            lastProducer.put(out, position);
        return record;
    }

    private static void requireNames(String opClass, String kind, List<String> names) {
        if (names == null)
            throw new IllegalArgumentException("Operation " + opClass + " has a null " + kind + " list");
        for (String name : names)
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("Operation " + opClass + " has an empty " + kind + " name");
    }
}
