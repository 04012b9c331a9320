package com.typeddsl.dag.engine;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded node-level dependency DAG of a finalized graph.
 *
 * An edge P -> C exists when node C consumes a value whose producer, at the
 * point C was recorded, was node P. Consumers such as code generators walk
 * this structure instead of re-resolving value names.
 *
 * Data layout:
 * - topoOrder: nodes sorted topologically. Iterating 0..N visits producers
 * before consumers.
 * - childrenList: one flattened int array with the topological indices of
 * all children of all nodes.
 * - childrenOffset: childrenOffset[i] is where node i's children start in
 * childrenList; they end at childrenOffset[i+1] (exclusive).
 * - observableWords: bitset, one bit per node, set when the node produces a
 * value that is observable outside the graph (a root of liveness).
 */
@Log4j2
public final class GraphTopology {
    private final Graph.Node[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> nameToIndex;
    private final long[] observableWords;

    private GraphTopology(Graph.Node[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex, long[] observableWords) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
        this.observableWords = observableWords;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public Graph.Node node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public boolean isObservable(int ti) {
        return (observableWords[ti >> 6] & (1L << ti)) != 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Names of the nodes consuming a value produced by {@code name}. */
    public List<String> successors(String name) {
        int ti = topoIndex(name);
        int cc = childCount(ti);
        List<String> out = new ArrayList<>(cc);
        for (int i = 0; i < cc; i++)
            out.add(topoOrder[child(ti, i)].name());
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for the topology. Rejects duplicates, dangling edges, self-edges
     * and cycles.
     */
    public static final class Builder {
        private final List<Graph.Node> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();
        private final Set<Integer> observableIndices = new HashSet<>();

        public Builder addNode(Graph.Node node) {
            if (nameToIdx.containsKey(node.name()))
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            int idx = nodes.size();
            nodes.add(node);
            nameToIdx.put(node.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Adds producer -> consumer. A repeated edge is recorded once. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new IllegalStateException("Self-edge not allowed: " + from);
            List<Integer> children = forwardEdges.get(requireIndex(from));
            int child = requireIndex(to);
            if (!children.contains(child))
                children.add(child);
            return this;
        }

        public Builder markObservable(String name) {
            observableIndices.add(requireIndex(name));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        /**
         * Compiles the topology with Kahn's algorithm. Ties are broken by
         * insertion order, so an already-ordered node list keeps its order.
         */
        public GraphTopology build() {
            final int n = nodes.size();
            int[] pending = new int[n];
            for (List<Integer> children : forwardEdges.values())
                for (int child : children)
                    pending[child]++;

            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (pending[i] == 0)
                    ready.add(i);

            // order[ti] = insertion index, rank[insertion index] = ti
            int[] order = new int[n];
            int[] rank = new int[n];
            int placed = 0;
            while (!ready.isEmpty()) {
                int idx = ready.poll();
                rank[idx] = placed;
                order[placed++] = idx;
                for (int child : forwardEdges.get(idx))
                    if (--pending[child] == 0)
                        ready.add(child);
            }
            if (placed != n)
                throw new IllegalStateException("Cycle detected! Processed " + placed + " of " + n);

            Graph.Node[] sorted = new Graph.Node[n];
            Map<String, Integer> indexByName = new HashMap<>(n * 2);
            long[] observable = new long[(n + 63) / 64];
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++) {
                sorted[ti] = nodes.get(order[ti]);
                indexByName.put(sorted[ti].name(), ti);
                if (observableIndices.contains(order[ti]))
                    observable[ti >> 6] |= 1L << ti;
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(order[ti]).size();
            }

            int[] children = new int[offsets[n]];
            int[] parents = new int[n];
            int cursor = 0;
            for (int ti = 0; ti < n; ti++) {
                for (int child : forwardEdges.get(order[ti])) {
                    int childTi = rank[child];
                    children[cursor++] = childTi;
                    parents[childTi]++;
                }
            }
            log.trace("Compiled topology: {} nodes, {} edges", n, children.length);
            return new GraphTopology(sorted, offsets, children, parents, indexByName, observable);
        }
    }
}
