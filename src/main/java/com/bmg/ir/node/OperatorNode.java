package com.bmg.ir.node;

import com.bmg.ir.api.NodeVisitor;
import com.bmg.ir.api.Operator;

import java.util.Objects;

/**
 * An operator applied to earlier nodes.
 *
 * <p>
 * Operands are held as sequence numbers in operator-specific order (for
 * {@link Operator#DISTRIBUTION_NORMAL}: mean, then standard deviation). The
 * node's type is the operator's declared result type regardless of whether the
 * operands are valid; cross-node checking is left to validation.
 */
public sealed class OperatorNode extends Node permits QueryNode {
    // Copied on the way in and on the way out
    private final int[] inNodes;

    public OperatorNode(int sequence, Operator op, int... inNodes) {
        super(sequence, op, Objects.requireNonNull(op, "op").resultType());
        this.inNodes = inNodes.clone();
    }

    public int inNodeCount() {
        return inNodes.length;
    }

    /** Sequence number of the operand at {@code position}. */
    public int inNode(int position) {
        return inNodes[position];
    }

    public int[] inNodes() {
        return inNodes.clone();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return "%" + sequence() + " = " + label() + operandList() + " : " + type();
    }

    String label() {
        return op().name();
    }

    private String operandList() {
        StringBuilder sb = new StringBuilder(8 + inNodes.length * 4).append('(');
        for (int i = 0; i < inNodes.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append('%').append(inNodes[i]);
        }
        return sb.append(')').toString();
    }
}
