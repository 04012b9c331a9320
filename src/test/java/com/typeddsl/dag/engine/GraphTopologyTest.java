package com.typeddsl.dag.engine;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphTopologyTest {

    private Graph.Node node(String name) {
        return new Graph.Node(name, "op", List.of(), List.of(name + "_out"));
    }

    @Test
    public void testEmptyTopology() {
        GraphTopology order = GraphTopology.builder().build();
        assertEquals(0, order.nodeCount());
    }

    @Test
    public void testLinearTopology() {
        // A -> B -> C
        GraphTopology order = GraphTopology.builder()
                .addNode(node("A")).addNode(node("B")).addNode(node("C"))
                .addEdge("A", "B")
                .addEdge("B", "C")
                .markObservable("C")
                .build();

        assertEquals(3, order.nodeCount());
        assertEquals("A", order.node(0).name());
        assertEquals("B", order.node(1).name());
        assertEquals("C", order.node(2).name());

        assertFalse(order.isObservable(0));
        assertTrue(order.isObservable(2));

        assertEquals(1, order.childCount(0));
        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));
        assertEquals(0, order.childCount(2));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(2));
    }

    @Test
    public void testDiamondTopology() {
        // A
        // / \
        // B C
        // \ /
        // D
        GraphTopology order = GraphTopology.builder()
                .addNode(node("A")).addNode(node("B")).addNode(node("C")).addNode(node("D"))
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        int idxB = order.topoIndex("B");
        int idxC = order.topoIndex("C");
        int idxD = order.topoIndex("D");
        assertEquals(0, order.topoIndex("A"));
        assertTrue(idxD > idxB);
        assertTrue(idxD > idxC);
        assertEquals(2, order.childCount(0));
        assertEquals(2, order.parentCount(idxD));
        assertEquals(List.of("B", "C"), order.successors("A"));
    }

    @Test
    public void testInsertionOrderBreaksTies() {
        GraphTopology order = GraphTopology.builder()
                .addNode(node("Z")).addNode(node("Y")).addNode(node("X"))
                .build();
        assertEquals("Z", order.node(0).name());
        assertEquals("Y", order.node(1).name());
        assertEquals("X", order.node(2).name());
    }

    @Test
    public void testRepeatedEdgeCountedOnce() {
        GraphTopology order = GraphTopology.builder()
                .addNode(node("A")).addNode(node("B"))
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(1, order.childCount(0));
        assertEquals(1, order.parentCount(1));
    }

    @Test(expected = IllegalStateException.class)
    public void testCycleDetection() {
        GraphTopology.builder()
                .addNode(node("A")).addNode(node("B")).addNode(node("C"))
                .addEdge("A", "B")
                .addEdge("B", "C")
                .addEdge("C", "A")
                .build();
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfEdgeRejected() {
        GraphTopology.builder()
                .addNode(node("A"))
                .addEdge("A", "A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeException() {
        GraphTopology.builder()
                .addNode(node("A"))
                .addNode(node("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTargetException() {
        GraphTopology.builder()
                .addNode(node("A"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownObservableMark() {
        GraphTopology.builder().markObservable("UNKNOWN");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        GraphTopology.builder().addNode(node("A")).build().topoIndex("UNKNOWN");
    }
}
