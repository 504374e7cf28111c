package com.agentBridge.agentGateway.backend;

import com.agentBridge.agentGateway.backend.model.BackendOptions;

/**
 * Constructs backend handles for the session pool.
 */
public interface BackendFactory {

    /**
     * Creates a new stateful handle. May be expensive; the pool never calls this
     * while holding its lock.
     */
    BackendHandle create(BackendOptions options);
}
