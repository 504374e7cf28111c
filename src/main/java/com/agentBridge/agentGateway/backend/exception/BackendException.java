package com.agentBridge.agentGateway.backend.exception;

/**
 * Base class for failures reported by the agent backend. Passed through to the
 * caller with context, never retried inside the gateway.
 */
public abstract class BackendException extends RuntimeException {

    protected BackendException(String message) {
        super(message);
    }

    protected BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
