package com.typeddsl.dag.ir;

/**
 * Conventions for value and node names.
 *
 * <p>
 * Anonymous values live in a reserved namespace: every generated name starts
 * with {@link #ANONYMOUS} and embeds a per-program counter, so it can never
 * collide with a name the caller chose. The bare sentinel itself stands for
 * "no name" when handed to the {@link NameRegistry}.
 */
public final class ValueNames {
    /** Sentinel and reserved prefix for anonymous values. */
    public static final String ANONYMOUS = "__var";

    /** Op class of the pseudo-records that introduce placeholders. */
    public static final String PLACEHOLDER_OP = "__placeholder";

    private ValueNames() {
    }

    /** True for the sentinel and for every generated name. */
    public static boolean isAnonymous(String name) {
        return name.startsWith(ANONYMOUS);
    }

    /** Generated name for the {@code n}-th anonymous value of a program. */
    public static String anonymous(int n) {
        return ANONYMOUS + "#" + n;
    }

    /** Node name under the per-class counter policy, e.g. {@code add_one:2}. */
    public static String nodeName(String opClass, int nthUse) {
        return opClass + ":" + nthUse;
    }

    static String placeholderNodeName(String valueName) {
        return PLACEHOLDER_OP + ":" + valueName;
    }
}
