package com.typeddsl.dag.ir;

import com.typeddsl.dag.engine.Graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Frozen copy of a {@link PendingOps} log, the optimizer's input.
 */
public final class IrSnapshot {
    private final List<OperationRecord> records;
    private final Set<String> placeholders;

    IrSnapshot(List<OperationRecord> records, Collection<String> placeholders) {
        this.records = List.copyOf(records);
        this.placeholders = Collections.unmodifiableSet(new LinkedHashSet<>(placeholders));
    }

    /**
     * Re-derives a log from a finalized graph: one placeholder record per
     * placeholder, then the graph's nodes in order under their existing names.
     * Optimizing the result yields a graph equal to {@code graph}.
     */
    public static IrSnapshot fromGraph(Graph graph) {
        List<OperationRecord> derived = new ArrayList<>(graph.placeholders().size() + graph.nodeCount());
        for (String p : graph.placeholders())
            derived.add(new OperationRecord(derived.size(), ValueNames.placeholderNodeName(p),
                    ValueNames.PLACEHOLDER_OP, List.of(), List.of(p), true));
        for (Graph.Node node : graph.nodes())
            derived.add(new OperationRecord(derived.size(), node.name(), node.opClass(),
                    node.inputs(), node.outputs(), false));
        return new IrSnapshot(derived, graph.placeholders());
    }

    /** All records in position order, placeholder pseudo-records included. */
    public List<OperationRecord> records() {
        return records;
    }

    /** Placeholder names in declaration order. */
    public Set<String> placeholders() {
        return placeholders;
    }

    public boolean isPlaceholder(String name) {
        return placeholders.contains(name);
    }

    public int size() {
        return records.size();
    }
}
