package com.bmg.ir.api;

/**
 * Classification of a rejected node sequence.
 */
public enum GraphErrorKind {
    /**
     * Broken positional identity, self or forward reference, reference to a
     * nonexistent node, or a node whose variant does not match its operator.
     */
    STRUCTURAL,
    /** Operand count differs from the operator's arity. */
    ARITY,
    /** An operand's type does not match the operator signature at its position. */
    TYPE,
    /** Query indices are not the dense sequence 0..Q-1 in creation order. */
    QUERY_INDEX,
    /** A constant is NaN or infinite. */
    VALUE,
    /** A constant parameter is outside its distribution's domain. Only reported by the range pass. */
    RANGE
}
