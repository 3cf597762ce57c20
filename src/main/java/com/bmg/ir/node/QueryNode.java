package com.bmg.ir.node;

import com.bmg.ir.api.NodeVisitor;
import com.bmg.ir.api.Operator;

/**
 * A {@link Operator#QUERY} over a single real operand.
 *
 * <p>
 * The query index is dense and zero-based across a graph, assigned in creation
 * order. Inference engines report results per query index; it is unrelated to
 * the node's sequence number.
 */
public final class QueryNode extends OperatorNode {
    private final int queryIndex;

    public QueryNode(int sequence, int queryIndex, int inNode) {
        super(sequence, Operator.QUERY, inNode);
        this.queryIndex = queryIndex;
    }

    public int queryIndex() {
        return queryIndex;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }

    @Override
    String label() {
        return "QUERY#" + queryIndex;
    }
}
