package com.agentBridge.agentGateway.session;

import com.agentBridge.agentGateway.backend.BackendHandle;

import java.time.Duration;
import java.time.Instant;

/**
 * A session in the pool: one backend handle plus pool bookkeeping.
 *
 * All mutable state is read and written under the owning pool's lock. The handle
 * is attached after the slot is reserved, because creating it happens outside
 * that lock.
 */
final class PooledSession {

    private final String id;
    private final boolean anonymous;
    private final Instant createdAt;

    private BackendHandle handle;
    private Instant lastUsedAt;
    private boolean active;
    private long useCount;
    private boolean evictOnRelease;

    private PooledSession(String id, boolean anonymous, Instant now) {
        this.id = id;
        this.anonymous = anonymous;
        this.createdAt = now;
        this.lastUsedAt = now;
    }

    /**
     * Reserves a slot for a session whose handle is still being created. The
     * reservation counts as an active lease.
     */
    static PooledSession reserve(String id, boolean anonymous, Instant now) {
        PooledSession session = new PooledSession(id, anonymous, now);
        session.active = true;
        session.useCount = 1;
        return session;
    }

    void attach(BackendHandle handle) {
        this.handle = handle;
    }

    void checkout(Instant now) {
        active = true;
        lastUsedAt = now;
        useCount++;
    }

    void checkin(Instant now) {
        active = false;
        lastUsedAt = now;
    }

    boolean isExpired(Instant now, Duration ttl) {
        return !active && now.isAfter(ttlDeadline(ttl));
    }

    Instant ttlDeadline(Duration ttl) {
        return lastUsedAt.plus(ttl);
    }

    String getId() {
        return id;
    }

    boolean isAnonymous() {
        return anonymous;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    BackendHandle getHandle() {
        return handle;
    }

    Instant getLastUsedAt() {
        return lastUsedAt;
    }

    boolean isActive() {
        return active;
    }

    long getUseCount() {
        return useCount;
    }

    boolean isEvictOnRelease() {
        return evictOnRelease;
    }

    void markEvictOnRelease() {
        this.evictOnRelease = true;
    }
}
