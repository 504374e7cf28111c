package com.agentBridge.agentGateway.batch.exception;

/**
 * Exception thrown for a batch submission or operation the engine refuses:
 * empty or oversized batches, bad or duplicate custom ids, deleting a job that
 * is still in progress.
 */
public class InvalidBatchException extends RuntimeException {

    public InvalidBatchException(String message) {
        super(message);
    }
}
