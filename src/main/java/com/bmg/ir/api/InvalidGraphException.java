package com.bmg.ir.api;

/**
 * Thrown when a node sequence is not a well-formed, type-correct program.
 *
 * <p>
 * Carries the {@link GraphErrorKind} of the first violation found and the
 * sequence number of the offending node, so callers can react without parsing
 * the message.
 */
public class InvalidGraphException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /** Sequence value used when the violation is not tied to a single node. */
    public static final int NO_NODE = -1;

    private final GraphErrorKind kind;
    private final int sequence;

    public InvalidGraphException(GraphErrorKind kind, int sequence, String message) {
        super(sequence == NO_NODE
                ? kind + " error: " + message
                : kind + " error at node " + sequence + ": " + message);
        this.kind = kind;
        this.sequence = sequence;
    }

    public GraphErrorKind kind() {
        return kind;
    }

    /** Position of the offending node, or {@link #NO_NODE}. */
    public int sequence() {
        return sequence;
    }
}
