package com.bmg.ir.api;

/**
 * The instruction kinds of the IR, each with a fixed signature.
 *
 * <p>
 * This enum is the single source of truth for operator signatures: the number
 * of operands, the required type of each operand in order, and the type of the
 * result. {@link com.bmg.ir.engine.GraphValidator} checks every operator node
 * against it.
 *
 * <pre>
 * CONSTANT                ()                      -> REAL
 * ADD                     (REAL, REAL)            -> REAL
 * MULTIPLY                (REAL, REAL)            -> REAL
 * DISTRIBUTION_NORMAL     (REAL mean, REAL sd)    -> DISTRIBUTION
 * DISTRIBUTION_BETA       (REAL, REAL)            -> DISTRIBUTION
 * DISTRIBUTION_BERNOULLI  (REAL probability)      -> DISTRIBUTION
 * SAMPLE                  (DISTRIBUTION)          -> REAL
 * OBSERVE                 (DISTRIBUTION, REAL)    -> NONE
 * QUERY                   (REAL)                  -> NONE
 * </pre>
 */
public enum Operator {
    /** A scalar constant, like 1.2. */
    CONSTANT(Type.REAL),

    /** Sum of two scalars. */
    ADD(Type.REAL, Type.REAL, Type.REAL),

    /** Product of two scalars. */
    MULTIPLY(Type.REAL, Type.REAL, Type.REAL),

    /** A normal distribution parameterized by mean and standard deviation. */
    DISTRIBUTION_NORMAL(Type.DISTRIBUTION, Type.REAL, Type.REAL),

    /**
     * A beta distribution. Both parameters are reals; their meaning is left to
     * the inference engine.
     */
    DISTRIBUTION_BETA(Type.DISTRIBUTION, Type.REAL, Type.REAL),

    /** A bernoulli distribution parameterized by the probability of yielding 1. */
    DISTRIBUTION_BERNOULLI(Type.DISTRIBUTION, Type.REAL),

    /** Draws a sample from a distribution. */
    SAMPLE(Type.REAL, Type.DISTRIBUTION),

    /** Observes a value drawn from a distribution. */
    OBSERVE(Type.NONE, Type.DISTRIBUTION, Type.REAL),

    /** Marks an intermediate result whose value inference must report. */
    QUERY(Type.NONE, Type.REAL);

    /** Number of real instructions; the upper bound when looping over operators by ordinal. */
    public static final int COUNT = values().length;

    private final Type resultType;
    private final Type[] inputTypes;

    Operator(Type resultType, Type... inputTypes) {
        this.resultType = resultType;
        this.inputTypes = inputTypes;
    }

    public Type resultType() {
        return resultType;
    }

    public int arity() {
        return inputTypes.length;
    }

    /**
     * Returns the type required of the operand at {@code position}.
     *
     * @throws IndexOutOfBoundsException if {@code position} is not below {@link #arity()}
     */
    public Type inputType(int position) {
        if (position < 0 || position >= inputTypes.length)
            throw new IndexOutOfBoundsException(
                    name() + " has " + inputTypes.length + " operands, no position " + position);
        return inputTypes[position];
    }

    public Type[] inputTypes() {
        return inputTypes.clone();
    }

    public boolean isDistribution() {
        return resultType == Type.DISTRIBUTION;
    }

    public static Operator fromString(String text) {
        for (Operator op : Operator.values()) {
            if (op.name().equalsIgnoreCase(text)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown Operator: " + text);
    }
}
