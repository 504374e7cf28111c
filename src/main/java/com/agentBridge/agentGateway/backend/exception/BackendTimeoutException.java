package com.agentBridge.agentGateway.backend.exception;

/**
 * Exception thrown when a backend call exceeds its deadline.
 */
public class BackendTimeoutException extends BackendException {

    public BackendTimeoutException(String message) {
        super(message);
    }

    public BackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
