package com.agentBridge.agentGateway.batch.exception;

/**
 * Exception thrown when a batch id is unknown or its job was purged after retention.
 */
public class BatchNotFoundException extends RuntimeException {

    private final String batchId;

    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
