package com.agentBridge.agentGateway.backend;

import com.agentBridge.agentGateway.backend.model.Conversation;
import com.agentBridge.agentGateway.backend.model.InvocationOptions;

/**
 * Stateful, non-reentrant conversation capability owned by exactly one pooled session.
 *
 * Callers never invoke a handle concurrently: exclusivity is guaranteed by the
 * session lease, so implementations need no internal locking for {@link #invoke}.
 */
public interface BackendHandle {

    /**
     * Runs one conversational turn.
     *
     * @param conversation messages and per-request overrides
     * @param options streaming flag and cancellation token
     * @return events of the turn, ending with a {@code STOP} event
     * @throws com.agentBridge.agentGateway.backend.exception.BackendUnavailableException if the backend cannot be reached
     * @throws com.agentBridge.agentGateway.backend.exception.BackendTimeoutException if the call exceeds its deadline
     * @throws com.agentBridge.agentGateway.backend.exception.BackendRejectedException if the backend refuses the request
     */
    EventStream invoke(Conversation conversation, InvocationOptions options);

    /**
     * Resets the handle's conversational memory. Idempotent. Failures are thrown.
     */
    void clear();

    /**
     * Releases underlying resources. Called exactly once, when the owning session is evicted.
     */
    void close();
}
