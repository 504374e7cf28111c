package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.backend.model.BackendEvent;

/**
 * Reshapes non-terminal events before they are framed. Returning null drops the event.
 */
@FunctionalInterface
public interface EventTransform {

    BackendEvent apply(BackendEvent event);

    static EventTransform identity() {
        return event -> event;
    }
}
