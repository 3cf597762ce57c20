package com.bmg.ir.util;

import com.bmg.ir.api.NodeVisitor;
import com.bmg.ir.engine.Graph;
import com.bmg.ir.node.ConstantNode;
import com.bmg.ir.node.Node;
import com.bmg.ir.node.OperatorNode;
import com.bmg.ir.node.QueryNode;

/**
 * Diagnostic utility for inspecting a built graph.
 *
 * <p>
 * Generates human-readable text and Mermaid diagrams of the graph structure.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging rejected models, or
 * documentation. Allocates strings on every call.
 */
public final class GraphExplain {
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(int sequence) {
        Node node = graph.node(sequence);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: %").append(sequence).append('\n')
                .append("  Operator: ").append(node.op()).append('\n')
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Variant: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Detail: ").append(node.accept(DETAIL)).append('\n');
        int cc = graph.consumerCount(sequence);
        sb.append("  Consumers (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append('%').append(graph.consumer(sequence, i));
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire graph, one instruction per line, in sequence order.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.queryCount()).append(" queries):\n");
        for (int i = 0; i < graph.nodeCount(); i++) {
            sb.append("  ").append(graph.node(i));
            int cc = graph.consumerCount(i);
            if (cc > 0) {
                sb.append("  -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append('%').append(graph.consumer(i, j));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Edges are labelled with the operand position they feed.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in sequence order
        for (Node node : graph.nodes()) {
            sb.append("  n").append(node.sequence()).append("[\"%").append(node.sequence()).append(' ')
                    .append(node.accept(DETAIL)).append(" : ").append(node.type()).append("\"];\n");
        }

        // 2. Declare all edges afterwards
        for (Node node : graph.nodes()) {
            if (!(node instanceof OperatorNode on))
                continue;
            for (int p = 0; p < on.inNodeCount(); p++) {
                sb.append("  n").append(on.inNode(p)).append(" -- \"").append(p).append("\" --> n")
                        .append(on.sequence()).append(";\n");
            }
        }
        return sb.toString();
    }

    private static final NodeVisitor<String> DETAIL = new NodeVisitor<>() {
        @Override
        public String visitConstant(ConstantNode node) {
            return "CONSTANT " + node.value();
        }

        @Override
        public String visitOperator(OperatorNode node) {
            return node.op().name();
        }

        @Override
        public String visitQuery(QueryNode node) {
            return "QUERY #" + node.queryIndex();
        }
    };
}
