package com.typeddsl.dag.dsl;

import com.typeddsl.dag.exceptions.EmptyScopeStackException;
import com.typeddsl.dag.exceptions.InvalidProgramException;
import com.typeddsl.dag.exceptions.NoActiveProgramException;
import com.typeddsl.dag.exceptions.ScopeMismatchException;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class ProgramContextTest {

    @After
    public void tearDown() {
        while (ProgramContext.isActive())
            ProgramContext.exit();
    }

    @Test(expected = NoActiveProgramException.class)
    public void testCurrentWithoutProgram() {
        ProgramContext.current();
    }

    @Test(expected = EmptyScopeStackException.class)
    public void testExitEmptyStack() {
        ProgramContext.exit();
    }

    @Test(expected = InvalidProgramException.class)
    public void testEnterNull() {
        ProgramContext.enter(null);
    }

    @Test
    public void testNestedScopes() {
        Program outer = Program.create("outer");
        Program inner = Program.create("inner");
        try (var o = ProgramContext.enter(outer)) {
            assertSame(outer, ProgramContext.current());
            try (var i = ProgramContext.enter(inner)) {
                assertSame(inner, ProgramContext.current());
                assertEquals(2, ProgramContext.depth());
            }
            assertSame(outer, ProgramContext.current());
        }
        assertFalse(ProgramContext.isActive());
    }

    @Test
    public void testScopeUnwindsOnException() {
        Program p = Program.create("failing");
        try (var scope = p.enter()) {
            Var.named("x");
            Var.named("x");
            fail("Expected NameConflictException");
        } catch (IllegalArgumentException expected) {
            // scope already closed here
        }
        assertFalse(ProgramContext.isActive());
        assertTrue(p.isDeclared("x"));
    }

    @Test
    public void testVarFactoriesUseCurrentProgram() {
        Program p = Program.create("factories");
        try (var scope = p.enter()) {
            Var<Integer> in = Var.placeholder("in");
            Var<Integer> out = Var.named("out");
            Var<Integer> tmp = Var.anonymous();
            assertSame(p, in.program());
            assertSame(p, out.program());
            assertTrue(tmp.isAnonymous());
        }
        assertTrue(p.snapshot().isPlaceholder("in"));
    }

    @Test
    public void testMismatchedCloseLeavesStackIntact() {
        Program outer = Program.create("outer");
        Program inner = Program.create("inner");
        var outerScope = ProgramContext.enter(outer);
        var innerScope = ProgramContext.enter(inner);
        try {
            outerScope.close();
            fail("Expected ScopeMismatchException");
        } catch (ScopeMismatchException expected) {
            // inner still open
        }
        assertEquals(2, ProgramContext.depth());
        assertTrue(outerScope.isActive());

        innerScope.close();
        outerScope.close();
        assertFalse(ProgramContext.isActive());
    }

    @Test
    public void testCloseIsIdempotent() {
        Program p = Program.create("p");
        var scope = ProgramContext.enter(p);
        scope.close();
        scope.close();
        assertFalse(scope.isActive());
        assertEquals(0, ProgramContext.depth());
    }

    @Test(expected = EmptyScopeStackException.class)
    public void testCloseAfterManualExit() {
        var scope = ProgramContext.enter(Program.create("p"));
        ProgramContext.exit();
        scope.close();
    }

    @Test
    public void testSameProgramEnteredTwice() {
        Program p = Program.create("p");
        try (var a = p.enter(); var b = p.enter()) {
            assertEquals(2, ProgramContext.depth());
        }
        assertEquals(0, ProgramContext.depth());
    }

    @Test
    public void testQueriesOnIdleThreadLeaveNoStack() throws Exception {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread t = new Thread(() -> {
            try {
                assertFalse(ProgramContext.isActive());
                assertEquals(0, ProgramContext.depth());
                try {
                    ProgramContext.current();
                    fail("Expected NoActiveProgramException");
                } catch (NoActiveProgramException expected) {
                    // nothing entered on this thread
                }
                try (var scope = Program.create("late").enter()) {
                    assertEquals(1, ProgramContext.depth());
                }
                assertEquals(0, ProgramContext.depth());
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        t.start();
        t.join();
        assertNull(failure.get());
    }

    @Test
    public void testStacksAreThreadLocal() throws Exception {
        Program mine = Program.create("mine");
        AtomicReference<Boolean> otherSawProgram = new AtomicReference<>();
        AtomicReference<String> otherCurrent = new AtomicReference<>();
        try (var scope = mine.enter()) {
            Thread t = new Thread(() -> {
                otherSawProgram.set(ProgramContext.isActive());
                Program theirs = Program.create("theirs");
                try (var s = theirs.enter()) {
                    otherCurrent.set(ProgramContext.current().name());
                }
            });
            t.start();
            t.join();
            assertSame(mine, ProgramContext.current());
        }
        assertFalse(otherSawProgram.get());
        assertEquals("theirs", otherCurrent.get());
    }
}
