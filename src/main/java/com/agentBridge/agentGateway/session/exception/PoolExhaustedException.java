package com.agentBridge.agentGateway.session.exception;

/**
 * Exception thrown when the session pool is at capacity and no session could be
 * evicted or freed within the acquire timeout. Callers should retry later.
 */
public class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
