package com.entity.network.core.exception;

/**
 * Thrown when a graph exceeds the size an algorithm is configured to accept.
 */
public class GraphTooLargeException extends NetworkAnalyticsException {

    private final String operation;
    private final int nodeCount;
    private final int limit;

    public GraphTooLargeException(String operation, int nodeCount, int limit) {
        super(operation + " refused: " + nodeCount + " nodes exceeds limit " + limit);
        this.operation = operation;
        this.nodeCount = nodeCount;
        this.limit = limit;
    }

    public String getOperation() {
        return operation;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getLimit() {
        return limit;
    }
}
