package com.typeddsl.dag.op;

/**
 * Argument and result shape of an operator, checked each time the operator is
 * applied. Argument types are left to the compiler through the typed
 * {@link Op} subclasses.
 *
 * @param shape      How arguments are passed.
 * @param fixedArity Number of fixed arguments (the prefix, for
 *                   {@link ArgShape#PREFIX_VARIADIC}); 0 for lists and varargs.
 * @param outputs    Number of values the operator produces, at least 1.
 */
public record Signature(ArgShape shape, int fixedArity, int outputs) {

    public Signature {
        if (shape == null)
            throw new IllegalArgumentException("Signature shape must not be null");
        if (fixedArity < 0)
            throw new IllegalArgumentException("Negative arity: " + fixedArity);
        if (outputs < 1)
            throw new IllegalArgumentException("An operator produces at least one value, got " + outputs);
        if ((shape == ArgShape.LIST || shape == ArgShape.VARIADIC) && fixedArity != 0)
            throw new IllegalArgumentException(shape + " signatures take no fixed arguments");
    }

    public static Signature fixed(int arity) {
        return new Signature(ArgShape.FIXED, arity, 1);
    }

    public static Signature list() {
        return new Signature(ArgShape.LIST, 0, 1);
    }

    public static Signature variadic() {
        return new Signature(ArgShape.VARIADIC, 0, 1);
    }

    public static Signature prefixVariadic(int prefix) {
        return new Signature(ArgShape.PREFIX_VARIADIC, prefix, 1);
    }

    /** Same argument shape, with {@code outputs} results. */
    public Signature withOutputs(int outputs) {
        return new Signature(shape, fixedArity, outputs);
    }

    public boolean accepts(int argc) {
        return switch (shape) {
            case FIXED -> argc == fixedArity;
            case LIST, VARIADIC -> argc >= 0;
            case PREFIX_VARIADIC -> argc >= fixedArity;
        };
    }

    /**
     * @throws IllegalArgumentException if {@code argc} arguments do not fit.
     */
    public void check(String opClass, int argc) {
        if (!accepts(argc))
            throw new IllegalArgumentException("Operation " + opClass + " expects " + describeArity()
                    + " argument(s), got " + argc);
    }

    private String describeArity() {
        return switch (shape) {
            case FIXED -> Integer.toString(fixedArity);
            case LIST, VARIADIC -> "any number of";
            case PREFIX_VARIADIC -> "at least " + fixedArity;
        };
    }
}
