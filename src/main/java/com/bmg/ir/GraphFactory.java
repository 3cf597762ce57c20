package com.bmg.ir;

import com.bmg.ir.api.NodeOutOfRangeException;
import com.bmg.ir.api.Operator;
import com.bmg.ir.engine.Graph;
import com.bmg.ir.node.ConstantNode;
import com.bmg.ir.node.Node;
import com.bmg.ir.node.OperatorNode;
import com.bmg.ir.node.QueryNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Factory, the model-facing construction API.
 *
 * <p>
 * Nodes are appended one at a time. Each call returns the new node's
 * identifier (its sequence number), which later calls pass back as an operand.
 * Only identifiers this factory has already issued are accepted; everything
 * else about the graph (arity, operand types, query density, finite constants)
 * is checked once, by {@link #build()}.
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * GraphFactory f = MiniBmg.factory("coin");
 * int p = f.addConstant(0.5);
 * int coin = f.bernoulli(p);
 * int flip = f.sample(coin);
 * int q = f.addQuery(flip); // query index 0
 * Graph graph = f.build();
 * }</pre>
 *
 * <p>
 * The factory is stateful and not thread-safe. Once {@link #build()} is called,
 * whether it succeeds or not, the factory is invalidated and cannot be used to
 * add more nodes or build again.
 */
@Log4j2
public final class GraphFactory {
    private final String graphName;
    private final List<Node> nodes = new ArrayList<>();
    private int nextQuery;

    // Flag to prevent modification after building
    private boolean built;

    private GraphFactory(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Creates a new factory.
     *
     * @param graphName A human-readable name for the graph, used in logging and
     *                  diagnostics.
     * @return A new, empty factory.
     */
    public static GraphFactory create(String graphName) {
        return new GraphFactory(Objects.requireNonNull(graphName, "graphName"));
    }

    // ── Primitive construction ───────────────────────────────────

    /**
     * Appends a constant. Non-finite values are accepted here and rejected by
     * {@link #build()}.
     *
     * @return The new node's identifier.
     */
    public int addConstant(double value) {
        checkNotBuilt();
        int id = nodes.size();
        nodes.add(new ConstantNode(id, value));
        return id;
    }

    /**
     * Appends an operator applied to previously added nodes.
     *
     * @param op      Any operator except {@link Operator#CONSTANT} and
     *                {@link Operator#QUERY}, which have their own methods.
     * @param parents Operand identifiers, in the operator's order.
     * @return The new node's identifier.
     * @throws NodeOutOfRangeException if a parent was not issued by this factory.
     */
    public int addOperator(Operator op, int... parents) {
        checkNotBuilt();
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(parents, "parents");
        if (op == Operator.CONSTANT)
            throw new IllegalArgumentException("Use addConstant for CONSTANT nodes");
        if (op == Operator.QUERY)
            throw new IllegalArgumentException("Use addQuery for QUERY nodes");
        for (int parent : parents)
            requireExisting(parent);
        int id = nodes.size();
        nodes.add(new OperatorNode(id, op, parents));
        return id;
    }

    public int addOperator(Operator op, List<Integer> parents) {
        Objects.requireNonNull(parents, "parents");
        return addOperator(op, parents.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Appends a query over {@code parent}.
     *
     * @return The query index (0, 1, 2, ... in creation order), not the node
     *         identifier.
     * @throws NodeOutOfRangeException if the parent was not issued by this factory.
     */
    public int addQuery(int parent) {
        checkNotBuilt();
        requireExisting(parent);
        int queryIndex = nextQuery++;
        nodes.add(new QueryNode(nodes.size(), queryIndex, parent));
        return queryIndex;
    }

    /**
     * Retrieve a previously added node.
     *
     * @throws NodeOutOfRangeException if no node has that identifier.
     */
    public Node getNode(int nodeId) {
        checkNotBuilt();
        requireExisting(nodeId);
        return nodes.get(nodeId);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int queryCount() {
        return nextQuery;
    }

    // ── Fluent helpers ───────────────────────────────────────────

    public int add(int left, int right) {
        return addOperator(Operator.ADD, left, right);
    }

    public int multiply(int left, int right) {
        return addOperator(Operator.MULTIPLY, left, right);
    }

    public int normal(int mean, int stddev) {
        return addOperator(Operator.DISTRIBUTION_NORMAL, mean, stddev);
    }

    public int beta(int first, int second) {
        return addOperator(Operator.DISTRIBUTION_BETA, first, second);
    }

    public int bernoulli(int probability) {
        return addOperator(Operator.DISTRIBUTION_BERNOULLI, probability);
    }

    public int sample(int distribution) {
        return addOperator(Operator.SAMPLE, distribution);
    }

    public int observe(int distribution, int value) {
        return addOperator(Operator.OBSERVE, distribution, value);
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Validates the accumulated nodes and returns them as an immutable
     * {@link Graph}.
     *
     * <p>
     * The factory is invalidated before validation starts; a rejected graph
     * cannot be repaired, start over with a new factory.
     *
     * @return The validated graph.
     * @throws com.bmg.ir.api.InvalidGraphException on the first violation found.
     */
    public Graph build() {
        checkNotBuilt();
        built = true;
        log.debug("Building graph '{}' from {} nodes", graphName, nodes.size());
        return Graph.create(graphName, nodes);
    }

    private void requireExisting(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size())
            throw new NodeOutOfRangeException(nodeId, nodes.size());
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}
