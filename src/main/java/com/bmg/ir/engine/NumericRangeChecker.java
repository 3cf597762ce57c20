package com.bmg.ir.engine;

import com.bmg.ir.api.GraphErrorKind;
import com.bmg.ir.api.InvalidGraphException;
import com.bmg.ir.api.Operator;
import com.bmg.ir.node.ConstantNode;
import com.bmg.ir.node.Node;
import com.bmg.ir.node.OperatorNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Optional semantic pass over an already validated {@link Graph}.
 *
 * <p>
 * {@link GraphValidator} only proves that distribution parameters are reals.
 * This pass additionally checks parameters whose value is known statically,
 * i.e. operands that are constants:
 * <ul>
 * <li>{@link Operator#DISTRIBUTION_NORMAL}: standard deviation &gt; 0</li>
 * <li>{@link Operator#DISTRIBUTION_BERNOULLI}: probability in [0, 1]</li>
 * </ul>
 * Beta parameters have no agreed meaning in this IR and are not checked.
 * Parameters computed by other nodes are a runtime concern of the inference
 * engine.
 */
@Log4j2
public final class NumericRangeChecker {

    private NumericRangeChecker() {
    }

    /** A constant parameter outside its distribution's domain. */
    public record RangeViolation(int sequence, Operator op, String message) {
    }

    /**
     * Returns every violation in sequence order; empty if there are none.
     */
    public static List<RangeViolation> check(Graph graph) {
        List<RangeViolation> violations = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (!(node instanceof OperatorNode on))
                continue;
            switch (on.op()) {
                case DISTRIBUTION_NORMAL -> {
                    Double sd = constantOperand(graph, on, 1);
                    if (sd != null && !(sd > 0.0))
                        violations.add(violation(graph, on, "standard deviation must be > 0, got " + sd));
                }
                case DISTRIBUTION_BERNOULLI -> {
                    Double p = constantOperand(graph, on, 0);
                    if (p != null && (p < 0.0 || p > 1.0))
                        violations.add(violation(graph, on, "probability must be in [0, 1], got " + p));
                }
                default -> {
                }
            }
        }
        return Collections.unmodifiableList(violations);
    }

    /**
     * Runs {@link #check(Graph)} and throws on the first violation.
     *
     * @throws InvalidGraphException with kind {@link GraphErrorKind#RANGE}
     */
    public static void requireNoViolations(Graph graph) {
        List<RangeViolation> violations = check(graph);
        if (!violations.isEmpty()) {
            RangeViolation first = violations.get(0);
            throw new InvalidGraphException(GraphErrorKind.RANGE, first.sequence(), first.message());
        }
    }

    private static Double constantOperand(Graph graph, OperatorNode node, int position) {
        return graph.node(node.inNode(position)) instanceof ConstantNode c ? c.value() : null;
    }

    private static RangeViolation violation(Graph graph, OperatorNode node, String message) {
        log.warn("Graph '{}' node {} ({}): {}", graph.name(), node.sequence(), node.op(), message);
        return new RangeViolation(node.sequence(), node.op(), message);
    }
}
