package com.bmg.ir.node;

import com.bmg.ir.api.NodeVisitor;
import com.bmg.ir.api.Operator;
import com.bmg.ir.api.Type;

/**
 * A scalar literal. Always {@link Operator#CONSTANT} with type {@link Type#REAL}.
 *
 * Non-finite values are accepted here and rejected at validation.
 */
public final class ConstantNode extends Node {
    private final double value;

    public ConstantNode(int sequence, double value) {
        super(sequence, Operator.CONSTANT, Type.REAL);
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return "%" + sequence() + " = CONSTANT(" + value + ") : " + type();
    }
}
