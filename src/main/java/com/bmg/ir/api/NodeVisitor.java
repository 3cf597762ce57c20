package com.bmg.ir.api;

import com.bmg.ir.node.ConstantNode;
import com.bmg.ir.node.OperatorNode;
import com.bmg.ir.node.QueryNode;

/**
 * Exhaustive dispatch over the node variants.
 *
 * <p>
 * Adding a variant adds a method here, so every visitor stops compiling until
 * it handles the new case.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitConstant(ConstantNode node);

    R visitOperator(OperatorNode node);

    R visitQuery(QueryNode node);
}
