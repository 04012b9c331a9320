package com.typeddsl.dag.util;

import com.typeddsl.dag.api.ProgramListener;
import com.typeddsl.dag.ir.OperationRecord;
import java.util.Arrays;

/**
 * Fans {@link ProgramListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeProgramListener implements ProgramListener {
    private ProgramListener[] listeners = new ProgramListener[0];

    public CompositeProgramListener add(ProgramListener listener) {
        ProgramListener[] old = listeners;
        ProgramListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPlaceholder(String program, String name) {
        for (ProgramListener l : listeners)
            l.onPlaceholder(program, name);
    }

    @Override
    public void onOperation(String program, OperationRecord record) {
        for (ProgramListener l : listeners)
            l.onOperation(program, record);
    }

    @Override
    public void onFinalized(String program, int recorded, int live, long durationNanos) {
        for (ProgramListener l : listeners)
            l.onFinalized(program, recorded, live, durationNanos);
    }
}
