package com.agentBridge.agentGateway.session;

import com.agentBridge.agentGateway.backend.BackendHandle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Temporary, exclusive right to use a pooled session's backend handle.
 *
 * Closing the lease releases it back to the pool, which clears the handle first.
 * Closing more than once has no further effect.
 */
public final class LeasedSession implements AutoCloseable {

    private final SessionPool pool;
    private final PooledSession session;
    private final AtomicBoolean released = new AtomicBoolean();

    LeasedSession(SessionPool pool, PooledSession session) {
        this.pool = pool;
        this.session = session;
    }

    public String getSessionId() {
        return session.getId();
    }

    public boolean isAnonymous() {
        return session.isAnonymous();
    }

    /**
     * @throws IllegalStateException if the lease was already released
     */
    public BackendHandle getHandle() {
        if (released.get()) {
            throw new IllegalStateException("Lease on session " + session.getId() + " was already released");
        }
        return session.getHandle();
    }

    public boolean isReleased() {
        return released.get();
    }

    PooledSession session() {
        return session;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(this);
        }
    }
}
