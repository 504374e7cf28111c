package com.agentBridge.agentGateway.gateway.exception;

/**
 * Exception thrown when a request is well-formed JSON but cannot be served as sent.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
