package com.typeddsl.dag.api;

import com.typeddsl.dag.ir.OperationRecord;

/**
 * Observability interface for watching a program being built and finalized.
 *
 * Implementations are registered with
 * {@link com.typeddsl.dag.dsl.Program#setListener(ProgramListener)}. Typical
 * uses:
 *
 * - Debugging: tracing which operations a piece of builder code records.
 * - Metrics: how much of a program survives dead-code elimination, and how
 * long finalization takes.
 *
 * Callbacks run synchronously on the building thread. An exception thrown
 * from a callback propagates to the builder call that triggered it.
 */
public interface ProgramListener {

    /**
     * Called after a placeholder has been declared.
     *
     * @param program The program name.
     * @param name    The placeholder's value name.
     */
    void onPlaceholder(String program, String name);

    /**
     * Called after an operation has been appended to the log.
     *
     * @param program The program name.
     * @param record  The appended record, with its position and node name.
     */
    void onOperation(String program, OperationRecord record);

    /**
     * Called each time the program is finalized into a graph.
     *
     * @param program       The program name.
     * @param recorded      Operations in the log (placeholders excluded).
     * @param live          Operations that survived dead-code elimination.
     * @param durationNanos Time spent optimizing.
     */
    void onFinalized(String program, int recorded, int live, long durationNanos);
}
