package com.bmg.ir.node;

import com.bmg.ir.api.NodeVisitor;
import com.bmg.ir.api.Operator;
import com.bmg.ir.api.Type;

import java.util.Objects;

/**
 * One instruction of the IR.
 *
 * Identity: a node is identified by its sequence number, which is also its
 * position in the owning graph's node list. Other nodes refer to it by that
 * number only, never by object reference, so "every operand precedes its use"
 * is a property of plain integers and can be checked in one linear pass.
 *
 * Immutability: the sequence number, operator, type and variant payload are
 * fixed at construction. Nodes hold data and nothing else; all checking is done
 * by {@link com.bmg.ir.engine.GraphValidator}.
 *
 * Variants:
 * - {@link ConstantNode}: a finite real literal.
 * - {@link OperatorNode}: an operator applied to earlier nodes.
 * - {@link QueryNode}: an operator node for QUERY that also carries its query index.
 */
public abstract sealed class Node permits ConstantNode, OperatorNode {
    private final int sequence;
    private final Operator op;
    private final Type type;

    Node(int sequence, Operator op, Type type) {
        this.sequence = sequence;
        this.op = Objects.requireNonNull(op, "op");
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Position of this node in its graph; also its identifier. */
    public int sequence() {
        return sequence;
    }

    public Operator op() {
        return op;
    }

    /** The type of this node's own result. */
    public Type type() {
        return type;
    }

    public abstract <R> R accept(NodeVisitor<R> visitor);
}
