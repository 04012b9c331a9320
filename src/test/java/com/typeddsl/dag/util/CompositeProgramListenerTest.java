package com.typeddsl.dag.util;

import com.typeddsl.dag.dsl.Program;
import com.typeddsl.dag.dsl.Var;
import com.typeddsl.dag.op.Op1;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeProgramListenerTest {

    @Test
    public void testFansOutToAllListeners() {
        OptimizationStatsListener first = new OptimizationStatsListener();
        OptimizationStatsListener second = new OptimizationStatsListener();
        CompositeProgramListener composite = new CompositeProgramListener().add(first).add(second);
        assertEquals(2, composite.size());

        Program p = Program.create("fanout");
        p.setListener(composite);
        Op1<Integer, Integer> addOne = new Op1<>("add_one");
        Var<Integer> in = p.placeholder("in");
        p.<Integer>var("out").set(addOne.call(in));
        p.graph();

        for (OptimizationStatsListener l : new OptimizationStatsListener[] { first, second }) {
            assertEquals(1, l.placeholdersDeclared());
            assertEquals(1, l.operationsRecorded());
            assertEquals(1, l.totalFinalizations());
            assertEquals(1, l.lastLive());
        }
    }

    @Test
    public void testEmptyCompositeIsNoOp() {
        CompositeProgramListener composite = new CompositeProgramListener();
        composite.onPlaceholder("p", "x");
        composite.onFinalized("p", 0, 0, 0L);
        assertEquals(0, composite.size());
    }
}
