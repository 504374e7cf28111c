package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.backend.model.BackendEvent;

/**
 * Frames one event into the bytes sent to the client. May keep state across calls
 * (open content blocks, for example). An empty result means nothing is sent.
 */
@FunctionalInterface
public interface EventEncoder {

    byte[] encode(BackendEvent event);
}
