package com.typeddsl.dag.dsl;

import com.typeddsl.dag.exceptions.EmptyScopeStackException;
import com.typeddsl.dag.exceptions.InvalidProgramException;
import com.typeddsl.dag.exceptions.NoActiveProgramException;
import com.typeddsl.dag.exceptions.ScopeMismatchException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of active programs, one per thread.
 *
 * <p>
 * Builder code that has no program reference at hand (for instance
 * {@link Var#named(String)}, or an operator applied to no arguments) records
 * against whatever program is on top of the calling thread's stack. Nesting
 * is allowed: a helper that builds a sub-graph enters its own program and the
 * outer one becomes current again when the helper's scope closes.
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * Program p = Program.create("pricing");
 * try (var scope = ProgramContext.enter(p)) {
 *     Var<Double> spot = Var.placeholder("spot");
 *     ...
 * }
 * Graph g = p.graph();
 * }</pre>
 *
 * <p>
 * The stack is thread-local, so threads building unrelated programs never
 * observe each other's scopes. A scope must be closed on the thread that
 * opened it.
 */
public final class ProgramContext {
    private static final Logger log = LogManager.getLogger(ProgramContext.class);

    private static final ThreadLocal<Deque<Program>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private ProgramContext() {
    }

    /**
     * Pushes {@code program} and returns the guard that pops it. Use it with
     * try-with-resources so the pop runs on every exit path.
     *
     * @throws InvalidProgramException if {@code program} is null.
     */
    public static Scope enter(Program program) {
        if (program == null)
            throw new InvalidProgramException("Cannot push null program to context");
        STACK.get().push(program);
        log.debug("Entered program '{}' (depth {})", program.name(), depth());
        return new Scope(program);
    }

    /**
     * Pops the top program without checking who pushed it. Prefer closing the
     * {@link Scope} returned by {@link #enter(Program)}.
     *
     * @return The popped program.
     * @throws EmptyScopeStackException if no program is active.
     */
    public static Program exit() {
        Deque<Program> stack = STACK.get();
        if (stack.isEmpty()) {
            STACK.remove();
            throw new EmptyScopeStackException("Cannot pop from empty program stack");
        }
        Program popped = stack.pop();
        if (stack.isEmpty())
            STACK.remove();
        log.debug("Exited program '{}' (depth {})", popped.name(), depth());
        return popped;
    }

    /**
     * @return The program on top of the calling thread's stack.
     * @throws NoActiveProgramException if no program is active.
     */
    public static Program current() {
        Program top = peek();
        if (top == null)
            throw new NoActiveProgramException("No active program context");
        return top;
    }

    public static boolean isActive() {
        return peek() != null;
    }

    public static int depth() {
        Deque<Program> stack = STACK.get();
        int depth = stack.size();
        if (depth == 0)
            STACK.remove();
        return depth;
    }

    // Queries must not leave an empty stack behind on threads that never enter
    private static Program peek() {
        Deque<Program> stack = STACK.get();
        if (stack.isEmpty()) {
            STACK.remove();
            return null;
        }
        return stack.peek();
    }

    /**
     * Guard for one {@link ProgramContext#enter(Program)}. Closing it pops the
     * program exactly once; further closes do nothing.
     */
    public static final class Scope implements AutoCloseable {
        private final Program program;
        private boolean active = true;

        private Scope(Program program) {
            this.program = program;
        }

        public Program program() {
            return program;
        }

        public boolean isActive() {
            return active;
        }

        /**
         * @throws EmptyScopeStackException if the stack was emptied behind this
         *                                  scope's back.
         * @throws ScopeMismatchException   if another program is on top, i.e. an
         *                                  inner scope was left open. The stack is
         *                                  not modified.
         */
        @Override
        public void close() {
            if (!active)
                return;
            Program top = peek();
            if (top == null)
                throw new EmptyScopeStackException(
                        "Cannot close scope of program '" + program.name() + "': program stack is empty");
            if (top != program)
                throw new ScopeMismatchException("Cannot close scope of program '" + program.name()
                        + "': program '" + top.name() + "' is still active");
            exit();
            active = false;
        }
    }
}
