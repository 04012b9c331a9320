package com.typeddsl.dag.dsl;

import com.typeddsl.dag.api.Operand;
import com.typeddsl.dag.api.ProgramListener;
import com.typeddsl.dag.engine.DeadCodeEliminator;
import com.typeddsl.dag.engine.Graph;
import com.typeddsl.dag.ir.IrSnapshot;
import com.typeddsl.dag.ir.NameRegistry;
import com.typeddsl.dag.ir.OperationRecord;
import com.typeddsl.dag.ir.PendingOps;
import com.typeddsl.dag.ir.ValueNames;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Program -- the construction-time state of one dataflow graph.
 *
 * <p>
 * A program owns a {@link NameRegistry} and a {@link PendingOps} log. Every
 * declaration or binding call appends to the log; nothing is ever evaluated.
 * {@link #graph()} runs dead-code elimination over a snapshot of the log and
 * returns the finalized {@link Graph}.
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * Op1<Integer, Integer> addOne = new Op1<>("add_one");
 * Program p = Program.create("chain");
 * Var<Integer> input = p.placeholder("input");
 * Var<Integer> output = p.var("output");
 * output.set(addOne.call(addOne.call(input)));
 * Graph g = p.graph();
 * }</pre>
 *
 * <p>
 * Lifecycle: once {@link #graph()} has been called the program is finalized
 * and rejects further declarations and bindings. Calling {@link #graph()}
 * again is allowed and returns an equal graph.
 *
 * <p>
 * The program is stateful and not thread-safe.
 */
@Log4j2
public final class Program {
    private final String name;
    private final NameRegistry names = new NameRegistry();
    private final PendingOps ops = new PendingOps();
    private final Map<String, Var<?>> vars = new HashMap<>();
    private final DeadCodeEliminator optimizer = new DeadCodeEliminator();

    private ProgramListener listener;
    private int anonymousCount;

    // Flag to prevent modification after finalization
    private boolean finalized;

    private Program(String name) {
        this.name = name;
    }

    /**
     * Creates an empty program.
     *
     * @param name A human-readable name, carried over to the graph and used in
     *             log messages.
     */
    public static Program create(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Program name must not be blank");
        return new Program(name);
    }

    public String name() {
        return name;
    }

    public void setListener(ProgramListener listener) {
        this.listener = listener;
    }

    /** Shortcut for {@link ProgramContext#enter(Program)}. */
    public ProgramContext.Scope enter() {
        return ProgramContext.enter(this);
    }

    // ── Declarations ─────────────────────────────────────────────

    /**
     * Declares a named variable.
     *
     * @throws com.typeddsl.dag.exceptions.NameConflictException if the name was
     *                                                           declared before.
     */
    public <T> Var<T> var(String name) {
        checkNotFinalized();
        if (ValueNames.ANONYMOUS.equals(name))
            return var();
        names.register(name);
        Var<T> v = new Var<>(this, name, false, false);
        vars.put(name, v);
        return v;
    }

    /** Declares a variable with a generated name. Nothing is registered. */
    public <T> Var<T> var() {
        checkNotFinalized();
        String generated = nextAnonymousName();
        Var<T> v = new Var<>(this, generated, true, false);
        vars.put(generated, v);
        return v;
    }

    /**
     * Declares an external input.
     *
     * @throws com.typeddsl.dag.exceptions.NameConflictException if the name was
     *                                                           declared before.
     */
    public <T> Var<T> placeholder(String name) {
        checkNotFinalized();
        names.register(name);
        ops.addPlaceholder(name);
        Var<T> v = new Var<>(this, name, false, true);
        vars.put(name, v);
        if (listener != null)
            listener.onPlaceholder(this.name, name);
        return v;
    }

    /**
     * Returns the variable declared under {@code name}, or null.
     */
    @SuppressWarnings("unchecked")
    public <T> Var<T> lookup(String name) {
        return (Var<T>) vars.get(name);
    }

    public boolean isDeclared(String name) {
        return vars.containsKey(name);
    }

    // ── Binding ──────────────────────────────────────────────────

    /**
     * Applies an operator to operands without recording anything yet. Operator
     * classes in {@code com.typeddsl.dag.op} funnel through here after checking
     * their signature.
     *
     * <p>
     * Pending operands are recorded first, under anonymous names, in argument
     * order. All operands are checked before any of them is recorded, so a
     * rejected application leaves the program as it was.
     *
     * @throws IllegalArgumentException if an operand belongs to another
     *                                  program.
     */
    public <R> Value<R> apply(String opClass, int outputCount, List<? extends Operand<?>> args) {
        checkNotFinalized();
        for (Operand<?> arg : args) {
            if (arg.program() != this)
                throw new IllegalArgumentException("Operand of " + opClass + " belongs to program '"
                        + arg.program().name() + "', not '" + name + "'");
            if (arg instanceof Value<?> pending)
                pending.checkOperand();
        }
        List<String> inputNames = new ArrayList<>(args.size());
        for (Operand<?> arg : args)
            inputNames.add(arg.valueName());
        return new Value<>(this, opClass, inputNames, outputCount);
    }

    /**
     * Records {@code outputName = opClass(inputNames...)} directly.
     *
     * <p>
     * If {@code outputName} has not been declared it is declared now, as a
     * named variable (or anonymous, for the {@code "__var"} sentinel).
     * Otherwise the existing variable is rebound, shadowing its previous
     * producer.
     *
     * @return The output variable.
     */
    @SuppressWarnings("unchecked")
    public <T> Var<T> bind(String outputName, String opClass, List<String> inputNames) {
        return (Var<T>) bindAll(Collections.singletonList(outputName), opClass, inputNames).get(0);
    }

    /**
     * Multi-output form of {@link #bind(String, String, List)}. Nothing is
     * declared unless the whole operation is valid.
     *
     * @return The output variables, in order.
     */
    public List<Var<?>> bindAll(List<String> outputNames, String opClass, List<String> inputNames) {
        checkNotFinalized();
        if (outputNames == null)
            throw new IllegalArgumentException("Operation " + opClass + " has a null output list");
        PendingOps.validate(opClass, inputNames, previewOutputs(outputNames));

        List<Var<?>> outs = new ArrayList<>(outputNames.size());
        List<String> resolved = new ArrayList<>(outputNames.size());
        for (String outputName : outputNames) {
            Var<?> existing = lookup(outputName);
            Var<?> out = existing != null ? existing : var(outputName);
            outs.add(out);
            resolved.add(out.name());
        }
        record(opClass, inputNames, resolved);
        for (Var<?> out : outs)
            out.markAssigned();
        return outs;
    }

    // Names the outputs will get, checking undeclared ones against the registry
    private List<String> previewOutputs(List<String> outputNames) {
        List<String> preview = new ArrayList<>(outputNames.size());
        int nextAnonymous = anonymousCount;
        for (String outputName : outputNames) {
            if (ValueNames.ANONYMOUS.equals(outputName)) {
                preview.add(ValueNames.anonymous(nextAnonymous++));
            } else {
                if (!vars.containsKey(outputName))
                    names.check(outputName);
                preview.add(outputName);
            }
        }
        return preview;
    }

    OperationRecord record(String opClass, List<String> inputs, List<String> outputs) {
        checkNotFinalized();
        OperationRecord record = ops.addOperation(opClass, inputs, outputs);
        log.trace("[{}] recorded {} {} -> {}", name, record.nodeName(), inputs, outputs);
        if (listener != null)
            listener.onOperation(name, record);
        return record;
    }

    String nextAnonymousName() {
        return ValueNames.anonymous(anonymousCount++);
    }

    int lastProducer(String valueName) {
        return ops.lastProducer(valueName);
    }

    int logSize() {
        return ops.size();
    }

    /** Operations recorded so far, placeholders excluded, dead ones included. */
    public int operationCount() {
        return ops.operationCount();
    }

    // ── Finalization ─────────────────────────────────────────────

    /** Immutable copy of the log as it stands. */
    public IrSnapshot snapshot() {
        return ops.snapshot();
    }

    /**
     * Finalizes the program: runs dead-code elimination over a snapshot of
     * the log. The first call freezes the program; later calls return equal
     * graphs.
     *
     * @return The optimized graph.
     */
    public Graph graph() {
        if (!finalized) {
            finalized = true;
            log.debug("Finalizing program '{}' ({} operations, {} names)", name, ops.operationCount(), names.size());
        }
        long start = System.nanoTime();
        Graph graph = optimizer.optimize(name, ops.snapshot());
        long duration = System.nanoTime() - start;
        if (listener != null)
            listener.onFinalized(name, ops.operationCount(), graph.nodeCount(), duration);
        return graph;
    }

    public boolean isFinalized() {
        return finalized;
    }

    private void checkNotFinalized() {
        if (finalized)
            throw new IllegalStateException("Program '" + name + "' already finalized");
    }

    @Override
    public String toString() {
        return "Program[" + name + ", operations=" + ops.operationCount() + "]";
    }
}
