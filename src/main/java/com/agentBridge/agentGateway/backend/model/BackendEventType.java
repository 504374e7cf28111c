package com.agentBridge.agentGateway.backend.model;

/**
 * Kinds of events a backend emits while producing a response.
 */
public enum BackendEventType {
    TEXT,
    THINKING,
    TOOL_USE,
    TOOL_RESULT,
    USAGE,
    STOP
}
