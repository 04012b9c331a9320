package com.typeddsl.dag.engine;

import com.typeddsl.dag.ir.IrSnapshot;
import com.typeddsl.dag.ir.OperationRecord;
import com.typeddsl.dag.ir.ValueNames;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Dead-code elimination: turns an IR snapshot into a {@link Graph} holding
 * only the operations whose results are observable.
 *
 * Algorithm (mark and sweep over the value/operation dependency relation):
 *
 * 1. Resolve: walk the records in order. Every input of record i resolves to
 * the most recent record before i that produced that name, or to nothing (a
 * free value). The outputs of i then become the latest producers of their
 * names. This is what makes a rebinding shadow the previous producer, and
 * what lets {@code x = f(x)} consume the previous {@code x}.
 *
 * 2. Roots: every placeholder and every user-declared (non-anonymous) name is
 * assumed to be observed from outside. Its final producer is live.
 * Anonymous intermediates are not roots.
 *
 * 3. Propagate: a worklist of live records; each live record makes the
 * producers of its inputs live. Resolution only points backwards, so the
 * relation is acyclic and the walk terminates.
 *
 * 4. Sweep: unmarked records are dropped. A multi-output record is kept
 * whole when any one of its outputs is needed. Placeholder pseudo-records
 * never become nodes; the placeholder set is carried over as is.
 *
 * The result is deterministic: the same snapshot always yields an equal
 * graph, and so does the snapshot re-derived from a result
 * ({@link IrSnapshot#fromGraph(Graph)}).
 *
 * Stateless and safe to share between threads.
 */
public final class DeadCodeEliminator {
    private static final Logger log = LogManager.getLogger(DeadCodeEliminator.class);

    /**
     * Runs the pass.
     *
     * @param graphName Name given to the resulting graph.
     * @param ir        The snapshot to optimize. Not modified.
     * @return The pruned graph.
     */
    public Graph optimize(String graphName, IrSnapshot ir) {
        final List<OperationRecord> records = ir.records();
        final int n = records.size();

        // 1. Producer resolution, by position
        int[][] inputProducers = new int[n][];
        Map<String, Integer> latest = new HashMap<>();
        for (int i = 0; i < n; i++) {
            OperationRecord r = records.get(i);
            List<String> inputs = r.inputs();
            int[] producers = new int[inputs.size()];
            for (int j = 0; j < producers.length; j++)
                producers[j] = latest.getOrDefault(inputs.get(j), -1);
            inputProducers[i] = producers;
            for (String out : r.outputs())
                latest.put(out, i);
        }

        // 2. Roots
        boolean[] live = new boolean[n];
        boolean[] observable = new boolean[n];
        int[] worklist = new int[n];
        int head = 0, tail = 0;
        for (var entry : latest.entrySet()) {
            if (!isRoot(ir, entry.getKey()))
                continue;
            int producer = entry.getValue();
            observable[producer] = true;
            if (!live[producer]) {
                live[producer] = true;
                worklist[tail++] = producer;
            }
        }

        // 3. Backward propagation
        while (head < tail) {
            int curr = worklist[head++];
            for (int p : inputProducers[curr]) {
                if (p >= 0 && !live[p]) {
                    live[p] = true;
                    worklist[tail++] = p;
                }
            }
        }

        // 4. Sweep
        List<Graph.Node> nodes = new ArrayList<>();
        Set<String> freeValues = new LinkedHashSet<>();
        var topo = GraphTopology.builder();
        int eliminated = 0;
        for (int i = 0; i < n; i++) {
            OperationRecord r = records.get(i);
            if (r.placeholder())
                continue;
            if (!live[i]) {
                eliminated++;
                if (log.isTraceEnabled())
                    log.trace("Eliminated {} in '{}'", describe(r), graphName);
                continue;
            }
            var node = new Graph.Node(r.nodeName(), r.opClass(), r.inputs(), r.outputs());
            nodes.add(node);
            topo.addNode(node);
            if (observable[i])
                topo.markObservable(node.name());

            int[] producers = inputProducers[i];
            for (int j = 0; j < producers.length; j++) {
                int p = producers[j];
                if (p < 0) {
                    String input = r.inputs().get(j);
                    if (!ir.isPlaceholder(input))
                        freeValues.add(input);
                } else if (!records.get(p).placeholder()) {
                    topo.addEdge(records.get(p).nodeName(), node.name());
                }
            }
        }

        if (!freeValues.isEmpty())
            log.debug("Graph '{}' consumes values nothing produces: {}", graphName, freeValues);
        log.debug("Optimized '{}': {} live, {} eliminated, {} placeholders",
                graphName, nodes.size(), eliminated, ir.placeholders().size());
        return new Graph(graphName, nodes, ir.placeholders(), freeValues, topo.build());
    }

    private static boolean isRoot(IrSnapshot ir, String valueName) {
        return ir.isPlaceholder(valueName) || !ValueNames.isAnonymous(valueName);
    }

    private static String describe(OperationRecord r) {
        return "{" + String.join(", ", r.inputs()) + "} -> {" + r.nodeName() + "} -> {"
                + String.join(", ", r.outputs()) + "}";
    }
}
