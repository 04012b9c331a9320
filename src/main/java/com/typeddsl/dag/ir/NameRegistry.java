package com.typeddsl.dag.ir;

import com.typeddsl.dag.exceptions.NameConflictException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tracks the user-declared value names already taken in one program.
 *
 * <p>
 * The namespace is monotonic: there is no way to release a name, even if the
 * value it stood for is later overwritten or eliminated as dead code.
 * Anonymous values are never registered; the {@link ValueNames#ANONYMOUS}
 * sentinel always passes.
 *
 * <p>
 * Not thread-safe.
 */
public final class NameRegistry {
    private final Set<String> names = new LinkedHashSet<>();

    /**
     * Claims {@code name} for this program.
     *
     * @param name The user-declared value name, or the anonymous sentinel.
     * @throws NameConflictException    if the name is already taken, or uses the
     *                                  reserved anonymous prefix.
     * @throws IllegalArgumentException if the name is null or empty.
     */
    public void register(String name) {
        check(name);
        if (!name.equals(ValueNames.ANONYMOUS))
            names.add(name);
    }

    /**
     * Same checks as {@link #register(String)}, without claiming the name.
     */
    public void check(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Var name must not be empty");
        if (name.equals(ValueNames.ANONYMOUS))
            return;
        if (ValueNames.isAnonymous(name))
            throw new NameConflictException(name,
                    "Var name uses the reserved prefix '" + ValueNames.ANONYMOUS + "': " + name);
        if (names.contains(name))
            throw new NameConflictException(name);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return names.size();
    }

    /** Registered names in registration order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(names);
    }
}
