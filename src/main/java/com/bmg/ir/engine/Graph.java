package com.bmg.ir.engine;

import com.bmg.ir.api.NodeOutOfRangeException;
import com.bmg.ir.api.Operator;
import com.bmg.ir.node.Node;
import com.bmg.ir.node.OperatorNode;
import com.bmg.ir.node.QueryNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A validated, immutable IR program.
 *
 * The only way to obtain a Graph is {@link #create(String, List)} (directly or
 * through {@link com.bmg.ir.GraphFactory#build()}), which runs
 * {@link GraphValidator} first. Consumers can therefore rely on:
 * - Evaluation order: iterating {@link #nodes()} from 0 visits every operand
 *   before its users.
 * - Type soundness: every operator node's operands match its signature.
 * - Dense queries: {@link #queryNode(int)} is defined for 0..queryCount()-1.
 *
 * Consumers (the reverse of operand edges) are stored in compressed sparse row
 * form:
 * - consumerOffset[i] .. consumerOffset[i+1] delimits node i's users in
 *   consumerList.
 * - Each user appears once per node, in increasing sequence order, even when
 *   it uses the node in several operand positions.
 *
 * Thread Safety:
 * Nothing is mutable after construction, so a Graph can be read by any number
 * of threads without synchronization.
 */
public final class Graph {
    private final String name;
    private final List<Node> nodes;
    private final QueryNode[] queries;
    private final List<OperatorNode> observations;

    // CSR index and data for consumers
    private final int[] consumerOffset;
    private final int[] consumerList;

    private Graph(String name, List<Node> nodes, int queryCount) {
        this.name = name;
        this.nodes = nodes;
        int n = nodes.size();

        QueryNode[] qs = new QueryNode[queryCount];
        List<OperatorNode> obs = new ArrayList<>();
        int[] counts = new int[n];
        int[] lastUser = new int[n];
        Arrays.fill(lastUser, -1);

        // 1. Count distinct users per node
        for (Node node : nodes) {
            if (!(node instanceof OperatorNode on))
                continue;
            if (on instanceof QueryNode q)
                qs[q.queryIndex()] = q;
            else if (on.op() == Operator.OBSERVE)
                obs.add(on);
            for (int p = 0; p < on.inNodeCount(); p++) {
                int ref = on.inNode(p);
                if (lastUser[ref] != on.sequence()) {
                    lastUser[ref] = on.sequence();
                    counts[ref]++;
                }
            }
        }

        // 2. Prefix sums
        int[] offsets = new int[n + 1];
        for (int i = 0; i < n; i++)
            offsets[i + 1] = offsets[i] + counts[i];

        // 3. Fill, users arrive in sequence order
        int[] flat = new int[offsets[n]];
        int[] cursor = Arrays.copyOf(offsets, n);
        Arrays.fill(lastUser, -1);
        for (Node node : nodes) {
            if (!(node instanceof OperatorNode on))
                continue;
            for (int p = 0; p < on.inNodeCount(); p++) {
                int ref = on.inNode(p);
                if (lastUser[ref] != on.sequence()) {
                    lastUser[ref] = on.sequence();
                    flat[cursor[ref]++] = on.sequence();
                }
            }
        }

        this.queries = qs;
        this.observations = Collections.unmodifiableList(obs);
        this.consumerOffset = offsets;
        this.consumerList = flat;
    }

    /**
     * Validates {@code nodes} and returns them as a graph.
     *
     * <p>
     * The list is copied before validation; later changes to it do not affect
     * the returned graph.
     *
     * @throws com.bmg.ir.api.InvalidGraphException if the nodes are not a valid graph
     */
    public static Graph create(String name, List<? extends Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        List<Node> snapshot = Collections.unmodifiableList(new ArrayList<>(nodes));
        int queryCount = GraphValidator.validate(name, snapshot);
        return new Graph(name, snapshot, queryCount);
    }

    public static Graph create(List<? extends Node> nodes) {
        return create("<unnamed>", nodes);
    }

    public String name() {
        return name;
    }

    /** All nodes in sequence order. Unmodifiable. */
    public List<Node> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Node node(int sequence) {
        checkSequence(sequence);
        return nodes.get(sequence);
    }

    public int queryCount() {
        return queries.length;
    }

    /** Returns the query node with the given query index. */
    public QueryNode queryNode(int queryIndex) {
        if (queryIndex < 0 || queryIndex >= queries.length)
            throw new IndexOutOfBoundsException(
                    "Unknown query index: " + queryIndex + " (query count " + queries.length + ")");
        return queries[queryIndex];
    }

    /** OBSERVE nodes in sequence order. Unmodifiable. */
    public List<OperatorNode> observations() {
        return observations;
    }

    /** Number of distinct nodes that use {@code sequence} as an operand. */
    public int consumerCount(int sequence) {
        checkSequence(sequence);
        return consumerOffset[sequence + 1] - consumerOffset[sequence];
    }

    /** The {@code i}-th user of {@code sequence}, users ordered by sequence number. */
    public int consumer(int sequence, int i) {
        int count = consumerCount(sequence);
        if (i < 0 || i >= count)
            throw new IndexOutOfBoundsException("Node " + sequence + " has " + count + " consumers, no " + i);
        return consumerList[consumerOffset[sequence] + i];
    }

    private void checkSequence(int sequence) {
        if (sequence < 0 || sequence >= nodes.size())
            throw new NodeOutOfRangeException(sequence, nodes.size());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64 + nodes.size() * 32);
        sb.append("Graph ").append(name).append(" (").append(nodes.size()).append(" nodes):\n");
        for (Node node : nodes)
            sb.append("  ").append(node).append('\n');
        return sb.toString();
    }
}
