package com.bmg.ir.api;

/**
 * Thrown when a node identifier names a node that does not exist (yet).
 */
public class NodeOutOfRangeException extends IndexOutOfBoundsException {
    private static final long serialVersionUID = 1L;

    private final int nodeId;

    public NodeOutOfRangeException(int nodeId, int nodeCount) {
        super("Unknown node: " + nodeId + " (node count " + nodeCount + ")");
        this.nodeId = nodeId;
    }

    public int nodeId() {
        return nodeId;
    }
}
