package com.agentBridge.agentGateway.backend;

import com.agentBridge.agentGateway.backend.model.BackendEvent;

import java.util.Iterator;
import java.util.List;

/**
 * Lazy, pull-based sequence of backend events, finite once a terminal
 * {@code STOP} event has been produced.
 *
 * {@link #next()} may block while the backend works and may throw a
 * {@link com.agentBridge.agentGateway.backend.exception.BackendException}.
 * {@link #close()} abandons the remainder of the sequence.
 */
public interface EventStream extends Iterator<BackendEvent>, AutoCloseable {

    @Override
    void close();

    /**
     * Wraps an already materialized list of events.
     */
    static EventStream of(List<BackendEvent> events) {
        Iterator<BackendEvent> delegate = List.copyOf(events).iterator();
        return new EventStream() {
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && delegate.hasNext();
            }

            @Override
            public BackendEvent next() {
                if (closed) {
                    throw new IllegalStateException("Event stream is closed");
                }
                return delegate.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
