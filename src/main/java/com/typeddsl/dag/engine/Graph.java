package com.typeddsl.dag.engine;

import java.util.*;

/**
 * A finalized dataflow graph: the live operations of a program, in the order
 * they were recorded.
 *
 * The Graph is produced by {@link DeadCodeEliminator} and is immutable. It
 * holds no reference back to the program it came from, so it can be handed
 * to analysis or code generation while the program is discarded.
 *
 * Name Resolution:
 * Nodes are looked up by their node name (e.g. {@code add_one:0}), values by
 * their value name. A value name may be produced by more than one node when
 * the program rebinds a variable; {@link #producerOf(String)} reports the
 * latest one.
 *
 * Equality is structural over the nodes and the placeholder set; the graph
 * name does not take part.
 */
public final class Graph {
    private final String name;
    private final List<Node> nodes;
    private final Map<String, Node> nodesByName;
    private final Set<String> placeholders;
    private final Map<String, String> producers;
    private final Set<String> freeValues;
    private final GraphTopology topology;

    /**
     * A retained operation.
     *
     * @param name    Unique node name.
     * @param opClass Operator class.
     * @param inputs  Consumed value names, in argument order.
     * @param outputs Produced value names.
     */
    public record Node(String name, String opClass, List<String> inputs, List<String> outputs) {
        public Node {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        /** Renders the node as {@code {a, b} -> {name} -> {c}}. */
        public String describe() {
            return "{" + String.join(", ", inputs) + "} -> {" + name + "} -> {" + String.join(", ", outputs) + "}";
        }
    }

    Graph(String name, List<Node> nodes, Set<String> placeholders, Set<String> freeValues, GraphTopology topology) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.placeholders = Collections.unmodifiableSet(new LinkedHashSet<>(placeholders));
        this.freeValues = Collections.unmodifiableSet(new LinkedHashSet<>(freeValues));
        this.topology = topology;

        Map<String, Node> byName = new HashMap<>(nodes.size() * 2);
        Map<String, String> latest = new HashMap<>();
        for (Node node : this.nodes) {
            byName.put(node.name(), node);
            for (String out : node.outputs())
                latest.put(out, node.name());
        }
        this.nodesByName = byName;
        this.producers = latest;
    }

    /** Name of the program this graph was finalized from. */
    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Live nodes in recording order. */
    public List<Node> nodes() {
        return nodes;
    }

    public boolean hasNode(String nodeName) {
        return nodesByName.containsKey(nodeName);
    }

    /**
     * @throws IllegalArgumentException if no live node has this name.
     */
    public Node node(String nodeName) {
        return requireNode(nodeName);
    }

    public boolean isPlaceholder(String valueName) {
        return placeholders.contains(valueName);
    }

    /** Placeholders in declaration order, consumed or not. */
    public Set<String> placeholders() {
        return placeholders;
    }

    /** True if {@code nodeName} is live and lists {@code valueName} as an output. */
    public boolean produces(String nodeName, String valueName) {
        Node node = nodesByName.get(nodeName);
        return node != null && node.outputs().contains(valueName);
    }

    /** True if {@code nodeName} is live and lists {@code valueName} as an input. */
    public boolean consumes(String nodeName, String valueName) {
        Node node = nodesByName.get(nodeName);
        return node != null && node.inputs().contains(valueName);
    }

    public List<String> inputsOf(String nodeName) {
        return requireNode(nodeName).inputs();
    }

    public List<String> outputsOf(String nodeName) {
        return requireNode(nodeName).outputs();
    }

    /** Human-readable rendering of one node, see {@link Node#describe()}. */
    public String describe(String nodeName) {
        return requireNode(nodeName).describe();
    }

    /**
     * Returns the name of the last live node producing {@code valueName}, or
     * null if no live node produces it (placeholders and free values).
     */
    public String producerOf(String valueName) {
        return producers.get(valueName);
    }

    /** Names of the live nodes listing {@code valueName} as an input. */
    public List<String> consumersOf(String valueName) {
        List<String> out = new ArrayList<>();
        for (Node node : nodes)
            if (node.inputs().contains(valueName))
                out.add(node.name());
        return out;
    }

    /**
     * True if some live node consumes {@code fromValue} and produces
     * {@code toValue}.
     */
    public boolean hasEdge(String fromValue, String toValue) {
        for (Node node : nodes)
            if (node.inputs().contains(fromValue) && node.outputs().contains(toValue))
                return true;
        return false;
    }

    /**
     * Values consumed by live nodes that no earlier operation produced and that
     * were never declared as placeholders.
     */
    public Set<String> freeValues() {
        return freeValues;
    }

    /** Node-level dependency structure. */
    public GraphTopology topology() {
        return topology;
    }

    private Node requireNode(String nodeName) {
        Node node = nodesByName.get(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Graph other))
            return false;
        return nodes.equals(other.nodes) && placeholders.equals(other.placeholders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, placeholders);
    }

    @Override
    public String toString() {
        return "Graph[" + name + ", nodes=" + nodes.size() + ", placeholders=" + placeholders.size() + "]";
    }
}
