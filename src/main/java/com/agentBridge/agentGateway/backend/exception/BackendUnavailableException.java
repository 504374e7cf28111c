package com.agentBridge.agentGateway.backend.exception;

/**
 * Exception thrown when the backend cannot be reached or fails internally.
 */
public class BackendUnavailableException extends BackendException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
