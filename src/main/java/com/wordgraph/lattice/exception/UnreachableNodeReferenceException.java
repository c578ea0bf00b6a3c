package com.wordgraph.lattice.exception;

public class UnreachableNodeReferenceException extends RuntimeException {

    private final int nodeId;

    public UnreachableNodeReferenceException(int nodeId) {
        super("Node not found in lattice snapshot: " + nodeId);
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }
}
