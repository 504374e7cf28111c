package com.agentBridge.agentGateway.backend.exception;

/**
 * Exception thrown when the backend refuses a request.
 */
public class BackendRejectedException extends BackendException {

    private final String reason;

    public BackendRejectedException(String reason) {
        super("Backend rejected the request: " + reason);
        this.reason = reason;
    }

    public BackendRejectedException(String reason, Throwable cause) {
        super("Backend rejected the request: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
