package com.bmg.ir;

/**
 * MiniBmg: typed graph IR for probabilistic programs.
 *
 * <h2>Model</h2>
 * <p>
 * A program is a directed acyclic graph of scalar instructions:
 * <ul>
 * <li><b>Constants and arithmetic</b> produce reals.</li>
 * <li><b>Distributions</b> (normal, beta, bernoulli) are built from reals.</li>
 * <li><b>Sample, observe and query</b> connect the model to inference.</li>
 * </ul>
 *
 * <h3>Guarantees</h3>
 * <ul>
 * <li><b>Validated once:</b> a {@link com.bmg.ir.engine.Graph} only exists if
 * it passed structural and type validation. Inference code never re-checks
 * acyclicity, arity or types.</li>
 * <li><b>Immutable:</b> a built graph can be shared by concurrent readers.</li>
 * <li><b>Evaluation order:</b> nodes are stored so that every operand precedes
 * its users.</li>
 * </ul>
 */
public final class MiniBmg {

    private MiniBmg() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new graph factory.
     *
     * @param graphName A descriptive name for the graph.
     * @return A new {@link GraphFactory}.
     */
    public static GraphFactory factory(String graphName) {
        return GraphFactory.create(graphName);
    }
}
