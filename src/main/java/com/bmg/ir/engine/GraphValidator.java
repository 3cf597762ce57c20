package com.bmg.ir.engine;

import com.bmg.ir.api.GraphErrorKind;
import com.bmg.ir.api.InvalidGraphException;
import com.bmg.ir.api.Operator;
import com.bmg.ir.node.ConstantNode;
import com.bmg.ir.node.Node;
import com.bmg.ir.node.OperatorNode;
import com.bmg.ir.node.QueryNode;

import java.util.List;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Proves that a node sequence is a legal program.
 *
 * Algorithm: one linear pass in sequence order. Every operand must already have
 * been visited when its user is reached, so each node is checked exactly once
 * against nodes that are themselves already known to be valid.
 *
 * Per node, in this order:
 * 1. Positional identity: the node at index i reports sequence i.
 * 2. Variant: CONSTANT only as a ConstantNode, QUERY only as a QueryNode.
 * 3. Constants: the value is finite.
 * 4. References: every operand is strictly smaller than i and not negative.
 *    This alone makes the graph acyclic; no traversal is needed.
 * 5. Arity: operand count equals the operator's arity.
 * 6. Types: each operand's type equals the signature at its position.
 * 7. Query index: queries, in creation order, carry 0, 1, 2, ...
 *
 * The first violation aborts the pass with an {@link InvalidGraphException}.
 * The check order is fixed, so the same input always fails the same way.
 * Numeric ranges of parameters (stddev > 0, probability in [0, 1]) are not
 * checked here; see {@link NumericRangeChecker}.
 *
 * The validator reads its input and never mutates it.
 */
@Log4j2
public final class GraphValidator {

    private GraphValidator() {
    }

    /**
     * Validates {@code nodes}, throwing on the first violation.
     *
     * @throws InvalidGraphException if the sequence is not a valid graph
     */
    public static void validate(List<? extends Node> nodes) {
        validate("<unnamed>", nodes);
    }

    /**
     * Validates {@code nodes}; {@code graphName} is used for logging only.
     *
     * @return the number of query nodes
     * @throws InvalidGraphException if the sequence is not a valid graph
     */
    public static int validate(String graphName, List<? extends Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        try {
            int queries = validateNodes(nodes);
            log.debug("Graph '{}' valid: {} nodes, {} queries", graphName, nodes.size(), queries);
            return queries;
        } catch (InvalidGraphException e) {
            log.debug("Graph '{}' rejected: {}", graphName, e.getMessage());
            throw e;
        }
    }

    private static int validateNodes(List<? extends Node> nodes) {
        int nextQuery = 0;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node == null)
                throw error(GraphErrorKind.STRUCTURAL, i, "null node");
            if (node.sequence() != i)
                throw error(GraphErrorKind.STRUCTURAL, i,
                        "node reports sequence " + node.sequence() + " at position " + i);

            if (node instanceof ConstantNode c) {
                checkConstant(c, i);
                continue;
            }

            var on = (OperatorNode) node;
            checkVariant(on, i);
            checkReferences(on, i, nodes.size());
            checkArity(on, i);
            checkTypes(on, i, nodes);

            if (on instanceof QueryNode q) {
                if (q.queryIndex() != nextQuery)
                    throw error(GraphErrorKind.QUERY_INDEX, i, q.queryIndex() < nextQuery
                            ? "duplicate query index " + q.queryIndex() + ", expected " + nextQuery
                            : "query index " + q.queryIndex() + " leaves a gap, expected " + nextQuery);
                nextQuery++;
            }
        }
        return nextQuery;
    }

    private static void checkConstant(ConstantNode node, int i) {
        if (!Double.isFinite(node.value()))
            throw error(GraphErrorKind.VALUE, i, "constant is not finite: " + node.value());
    }

    private static void checkVariant(OperatorNode node, int i) {
        Operator op = node.op();
        if (op == Operator.CONSTANT)
            throw error(GraphErrorKind.STRUCTURAL, i, "CONSTANT must be a constant node");
        boolean isQueryNode = node instanceof QueryNode;
        if ((op == Operator.QUERY) != isQueryNode)
            throw error(GraphErrorKind.STRUCTURAL, i, isQueryNode
                    ? "query node with operator " + op
                    : "QUERY must be a query node");
    }

    private static void checkReferences(OperatorNode node, int i, int nodeCount) {
        for (int p = 0; p < node.inNodeCount(); p++) {
            int ref = node.inNode(p);
            if (ref == i)
                throw error(GraphErrorKind.STRUCTURAL, i, "operand " + p + " refers to the node itself");
            if (ref < 0 || ref >= nodeCount)
                throw error(GraphErrorKind.STRUCTURAL, i, "operand " + p + " refers to nonexistent node " + ref);
            if (ref > i)
                throw error(GraphErrorKind.STRUCTURAL, i, "operand " + p + " is a forward reference to node " + ref);
        }
    }

    private static void checkArity(OperatorNode node, int i) {
        Operator op = node.op();
        if (node.inNodeCount() != op.arity())
            throw error(GraphErrorKind.ARITY, i,
                    op + " takes " + op.arity() + " operands, got " + node.inNodeCount());
    }

    private static void checkTypes(OperatorNode node, int i, List<? extends Node> nodes) {
        Operator op = node.op();
        for (int p = 0; p < op.arity(); p++) {
            Node operand = nodes.get(node.inNode(p));
            if (operand.type() != op.inputType(p))
                throw error(GraphErrorKind.TYPE, i, op + " operand " + p + " must be " + op.inputType(p)
                        + ", node " + operand.sequence() + " is " + operand.type());
        }
    }

    private static InvalidGraphException error(GraphErrorKind kind, int sequence, String message) {
        return new InvalidGraphException(kind, sequence, message);
    }
}
