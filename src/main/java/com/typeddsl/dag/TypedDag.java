package com.typeddsl.dag;

import com.typeddsl.dag.dsl.Program;
import com.typeddsl.dag.dsl.ProgramContext;
import com.typeddsl.dag.engine.Graph;

import java.util.function.Consumer;

/**
 * typed-dag -- builds optimized dataflow graphs from typed builder code.
 *
 * <h2>Philosophy</h2>
 * <p>
 * Client code describes a computation as a sequence of variable assignments
 * and operator applications. Nothing is executed. The library records every
 * application in an append-only log and, on finalization, keeps only the
 * operations that contribute to an observable value:
 * <ul>
 * <li><b>Nodes</b> are operator applications, named {@code op_class:n}.</li>
 * <li><b>Edges</b> are named values.</li>
 * <li><b>Roots</b> are placeholders and user-named variables; anonymous
 * intermediates survive only if a root depends on them.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Deterministic:</b> the same sequence of builder calls always yields
 * the same node names and the same graph.</li>
 * <li><b>Scoped:</b> programs can be nested through
 * {@link ProgramContext}, one stack per thread.</li>
 * </ul>
 */
public final class TypedDag {

    private TypedDag() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new, empty program.
     *
     * @param name A descriptive name for the program.
     * @return A new {@link Program}.
     */
    public static Program program(String name) {
        return Program.create(name);
    }

    /**
     * Creates a program, makes it current for the duration of {@code body},
     * and finalizes it. The program is popped even if {@code body} throws.
     *
     * @return The finalized graph.
     */
    public static Graph define(String name, Consumer<Program> body) {
        Program program = Program.create(name);
        try (var scope = ProgramContext.enter(program)) {
            body.accept(program);
        }
        return program.graph();
    }
}
