package com.typeddsl.dag.ir;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PendingOpsTest {

    private PendingOps ops;

    @Before
    public void setUp() {
        ops = new PendingOps();
    }

    @Test
    public void testPerClassNodeNaming() {
        ops.addPlaceholder("input");
        OperationRecord a = ops.addOperation("add_one", List.of("input"), List.of("t1"));
        OperationRecord s = ops.addOperation("square", List.of("t1"), List.of("t2"));
        OperationRecord b = ops.addOperation("add_one", List.of("t2"), List.of("t3"));

        assertEquals("add_one:0", a.nodeName());
        assertEquals("square:0", s.nodeName());
        assertEquals("add_one:1", b.nodeName());
        assertEquals(1, a.position());
        assertEquals(3, b.position());
        assertEquals(3, ops.operationCount());
        assertEquals(4, ops.size());
    }

    @Test
    public void testLastProducerShadowing() {
        ops.addOperation("f", List.of("x"), List.of("v"));
        assertEquals(0, ops.lastProducer("v"));
        ops.addOperation("g", List.of("y"), List.of("v"));
        assertEquals(1, ops.lastProducer("v"));
        assertEquals(-1, ops.lastProducer("x"));
    }

    @Test
    public void testPlaceholderRecordedOnce() {
        assertTrue(ops.addPlaceholder("input"));
        assertFalse(ops.addPlaceholder("input"));
        assertEquals(1, ops.size());
        assertEquals(0, ops.operationCount());
        assertTrue(ops.isPlaceholder("input"));

        OperationRecord r = ops.record(0);
        assertTrue(r.placeholder());
        assertTrue(r.inputs().isEmpty());
        assertEquals(List.of("input"), r.outputs());
        assertEquals(0, ops.lastProducer("input"));
    }

    @Test
    public void testSnapshotIsIsolatedFromLaterRecording() {
        ops.addPlaceholder("a");
        ops.addOperation("f", List.of("a"), List.of("b"));
        IrSnapshot snap = ops.snapshot();

        ops.addPlaceholder("c");
        ops.addOperation("g", List.of("b"), List.of("d"));

        assertEquals(2, snap.size());
        assertEquals(1, snap.placeholders().size());
        assertFalse(snap.isPlaceholder("c"));
        assertEquals(4, ops.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testSnapshotRecordsAreReadOnly() {
        ops.addOperation("f", List.of(), List.of("b"));
        ops.snapshot().records().clear();
    }

    @Test
    public void testRecordsCopyTheirNameLists() {
        var inputs = new java.util.ArrayList<>(List.of("x"));
        OperationRecord r = ops.addOperation("f", inputs, List.of("y"));
        inputs.add("z");
        assertEquals(List.of("x"), r.inputs());
    }

    @Test
    public void testRepeatedInputsAllowed() {
        OperationRecord r = ops.addOperation("mul", List.of("x", "x"), List.of("sq"));
        assertEquals(2, r.inputs().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyOutputsRejected() {
        ops.addOperation("f", List.of("x"), List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateOutputsRejected() {
        ops.addOperation("split", List.of("x"), List.of("a", "a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankOpClassRejected() {
        ops.addOperation(" ", List.of("x"), List.of("y"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyInputNameRejected() {
        ops.addOperation("f", List.of(""), List.of("y"));
    }

    @Test
    public void testRejectedOperationDoesNotConsumeCounter() {
        try {
            ops.addOperation("f", List.of("x"), List.of());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // nothing recorded
        }
        assertEquals("f:0", ops.addOperation("f", List.of("x"), List.of("y")).nodeName());
        assertEquals(1, ops.size());
    }
}
