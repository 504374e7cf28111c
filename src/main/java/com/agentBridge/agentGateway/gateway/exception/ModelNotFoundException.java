package com.agentBridge.agentGateway.gateway.exception;

/**
 * Exception thrown when a model id is neither served nor a known alias.
 */
public class ModelNotFoundException extends RuntimeException {

    public ModelNotFoundException(String modelId) {
        super("Model not found: " + modelId);
    }
}
