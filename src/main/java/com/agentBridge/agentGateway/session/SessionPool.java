package com.agentBridge.agentGateway.session;

import com.agentBridge.agentGateway.backend.BackendFactory;
import com.agentBridge.agentGateway.backend.BackendHandle;
import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.cancellation.CanceledException;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.session.exception.PoolExhaustedException;
import com.agentBridge.agentGateway.session.exception.SessionNotFoundException;
import com.agentBridge.agentGateway.session.model.SessionInfo;
import com.agentBridge.agentGateway.session.model.SessionPoolStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of backend sessions keyed by session id.
 *
 * Responsibilities:
 * - Lease sessions exclusively: a session id is never checked out twice at once
 * - Enforce capacity, evicting the least recently used idle session when full
 * - Clear every session on release, unconditionally, before it can be reused
 * - Evict sessions idle past their TTL from a background reaper
 *
 * All map mutations and session bookkeeping happen under one lock. Backend
 * handles are created, cleared and closed outside of it; lease exclusivity
 * already protects the handle.
 *
 * Usage:
 * <pre>
 * try (LeasedSession lease = pool.acquire("conversation-1", token)) {
 *     lease.getHandle().invoke(conversation, options);
 * } // cleared and returned to the pool
 * </pre>
 */
@Slf4j
public class SessionPool {

    private static final String ANONYMOUS_PREFIX = "pool_session_";
    private static final String NAMED_PREFIX = "session_";

    private final BackendFactory backendFactory;
    private final BackendOptions backendOptions;
    private final SessionPoolSettings settings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition sessionReleased = lock.newCondition();
    private final Map<String, PooledSession> sessions = new HashMap<>();

    private long anonymousCounter;
    private boolean running;
    private ScheduledExecutorService reaper;

    public SessionPool(BackendFactory backendFactory, BackendOptions backendOptions, SessionPoolSettings settings) {
        this(backendFactory, backendOptions, settings, Clock.systemUTC());
    }

    public SessionPool(BackendFactory backendFactory, BackendOptions backendOptions, SessionPoolSettings settings,
                       Clock clock) {
        if (settings.getMaxSessions() < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1");
        }
        this.backendFactory = backendFactory;
        this.backendOptions = backendOptions;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Starts the pool and its background reaper. Calling it twice has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("session-reaper-");
            threadFactory.setDaemon(true);
            reaper = Executors.newSingleThreadScheduledExecutor(threadFactory);
            long intervalMillis = settings.getCleanupInterval().toMillis();
            reaper.scheduleWithFixedDelay(this::reapSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        log.info("Session pool started - max: {}, ttl: {}s, cleanupInterval: {}s",
                settings.getMaxSessions(), settings.getTtl().toSeconds(), settings.getCleanupInterval().toSeconds());
    }

    /**
     * Stops the reaper and closes every idle session. Sessions still leased are
     * closed when their lease is released.
     */
    public void stop() {
        List<PooledSession> toClose = new ArrayList<>();
        ScheduledExecutorService stoppedReaper;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            stoppedReaper = reaper;
            reaper = null;
            for (PooledSession session : List.copyOf(sessions.values())) {
                if (session.isActive()) {
                    session.markEvictOnRelease();
                } else {
                    sessions.remove(session.getId());
                    toClose.add(session);
                }
            }
            sessionReleased.signalAll();
        } finally {
            lock.unlock();
        }
        stoppedReaper.shutdownNow();
        closeAll(toClose);
        log.info("Session pool stopped - closed: {}", toClose.size());
    }

    /**
     * Acquires an exclusive lease.
     *
     * @param sessionId conversation id, or null for an anonymous session
     * @param cancellation signal checked while waiting
     * @return lease that must be closed to release the session
     * @throws PoolExhaustedException if the session stays busy or the pool stays full for the acquire timeout
     * @throws CanceledException if the token is cancelled while waiting
     */
    public LeasedSession acquire(String sessionId, CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        long waitDeadline = System.nanoTime() + settings.getAcquireTimeout().toNanos();
        List<PooledSession> toClose = new ArrayList<>();
        PooledSession reserved = null;
        PooledSession reused = null;

        lock.lock();
        try {
            while (true) {
                ensureRunning();
                cancellation.throwIfCancelled();
                Instant now = clock.instant();

                if (sessionId != null) {
                    PooledSession existing = sessions.get(sessionId);
                    if (existing != null && existing.isActive()) {
                        awaitRelease(waitDeadline, cancellation, "Session " + sessionId + " is busy");
                        continue;
                    }
                    if (existing != null && !existing.isExpired(now, settings.getTtl())) {
                        existing.checkout(now);
                        reused = existing;
                        break;
                    }
                    if (existing != null) {
                        sessions.remove(sessionId);
                        toClose.add(existing);
                        log.debug("Session expired on acquire - sessionId: {}", sessionId);
                    }
                } else {
                    PooledSession idle = leastRecentlyUsedIdle(true, now, toClose);
                    if (idle != null) {
                        idle.checkout(now);
                        reused = idle;
                        break;
                    }
                }

                if (sessions.size() >= settings.getMaxSessions()) {
                    PooledSession victim = leastRecentlyUsedIdle(false, now, toClose);
                    if (victim == null && sessions.size() >= settings.getMaxSessions()) {
                        log.warn("Pool at capacity ({}), waiting for a released session", settings.getMaxSessions());
                        awaitRelease(waitDeadline, cancellation, "Pool at capacity (" + settings.getMaxSessions() + ")");
                        continue;
                    }
                    if (victim != null) {
                        sessions.remove(victim.getId());
                        toClose.add(victim);
                        log.debug("Evicted least recently used session - sessionId: {}", victim.getId());
                    }
                }

                String id = sessionId != null ? sessionId : nextAnonymousId();
                reserved = PooledSession.reserve(id, sessionId == null, now);
                sessions.put(id, reserved);
                break;
            }
        } finally {
            lock.unlock();
        }

        closeAll(toClose);

        if (reused != null) {
            log.debug("Reusing session - sessionId: {}, uses: {}", reused.getId(), reused.getUseCount());
            return new LeasedSession(this, reused);
        }
        return createHandle(reserved, cancellation);
    }

    /**
     * Creates a named session ahead of its first request and leaves it idle in
     * the pool. Clients address it afterwards through its id.
     *
     * @return id of the new session
     */
    public String open(CancellationToken cancellation) {
        String sessionId = NAMED_PREFIX + UUID.randomUUID().toString().replace("-", "");
        try (LeasedSession ignored = acquire(sessionId, cancellation)) {
            log.info("Opened session - sessionId: {}", sessionId);
        }
        return sessionId;
    }

    /**
     * Releases a lease: clears the handle, then returns the session to the pool.
     * The clear step is never skipped. If it fails, the session is evicted and
     * closed instead of being reused; the failure is not propagated.
     */
    void release(LeasedSession lease) {
        PooledSession session = lease.session();
        boolean cleared = clear(session);

        boolean discard;
        lock.lock();
        try {
            session.checkin(clock.instant());
            boolean pooled = sessions.get(session.getId()) == session;
            discard = !cleared || session.isEvictOnRelease() || !running || !pooled;
            if (discard && pooled) {
                sessions.remove(session.getId());
            }
            sessionReleased.signalAll();
        } finally {
            lock.unlock();
        }

        if (discard) {
            closeSession(session);
        } else {
            log.debug("Released session - sessionId: {}, uses: {}", session.getId(), session.getUseCount());
        }
    }

    /**
     * Explicitly closes a session. An idle session is evicted immediately; a
     * leased one is evicted when its lease is released.
     *
     * @throws SessionNotFoundException if the id is unknown
     */
    public void invalidate(String sessionId) {
        PooledSession idle = null;
        lock.lock();
        try {
            PooledSession session = sessions.get(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            if (session.isActive()) {
                session.markEvictOnRelease();
            } else {
                sessions.remove(sessionId);
                idle = session;
                sessionReleased.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (idle != null) {
            closeSession(idle);
        }
        log.info("Invalidated session - sessionId: {}, deferred: {}", sessionId, idle == null);
    }

    /**
     * Evicts and closes idle sessions past their TTL deadline.
     *
     * @return number of sessions evicted
     */
    public int reapExpired() {
        List<PooledSession> expired = new ArrayList<>();
        int remaining;
        lock.lock();
        try {
            Instant now = clock.instant();
            for (PooledSession session : List.copyOf(sessions.values())) {
                if (session.isExpired(now, settings.getTtl())) {
                    sessions.remove(session.getId());
                    expired.add(session);
                }
            }
            remaining = sessions.size();
            if (!expired.isEmpty()) {
                sessionReleased.signalAll();
            }
        } finally {
            lock.unlock();
        }
        closeAll(expired);
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired sessions, {} remaining", expired.size(), remaining);
        }
        return expired.size();
    }

    public SessionPoolStats stats() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int active = 0;
            List<SessionInfo> infos = new ArrayList<>(sessions.size());
            for (PooledSession session : sessions.values()) {
                if (session.isActive()) {
                    active++;
                }
                infos.add(SessionInfo.builder()
                        .id(session.getId())
                        .anonymous(session.isAnonymous())
                        .active(session.isActive())
                        .ageSeconds(Duration.between(session.getCreatedAt(), now).toSeconds())
                        .idleSeconds(Duration.between(session.getLastUsedAt(), now).toSeconds())
                        .useCount(session.getUseCount())
                        .build());
            }
            return SessionPoolStats.builder()
                    .active(active)
                    .idle(sessions.size() - active)
                    .total(sessions.size())
                    .capacity(settings.getMaxSessions())
                    .ttlSeconds(settings.getTtl().toSeconds())
                    .sessions(infos)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    private LeasedSession createHandle(PooledSession reserved, CancellationToken cancellation) {
        BackendHandle handle;
        try {
            cancellation.throwIfCancelled();
            handle = backendFactory.create(backendOptions);
        } catch (RuntimeException e) {
            lock.lock();
            try {
                sessions.remove(reserved.getId(), reserved);
                sessionReleased.signalAll();
            } finally {
                lock.unlock();
            }
            log.warn("Failed to create backend handle - sessionId: {}", reserved.getId(), e);
            throw e;
        }

        lock.lock();
        try {
            reserved.attach(handle);
        } finally {
            lock.unlock();
        }
        log.debug("Created new session - sessionId: {}, anonymous: {}", reserved.getId(), reserved.isAnonymous());
        return new LeasedSession(this, reserved);
    }

    private boolean clear(PooledSession session) {
        try {
            session.getHandle().clear();
            return true;
        } catch (RuntimeException e) {
            log.warn("Error clearing session, evicting it - sessionId: {}", session.getId(), e);
            return false;
        }
    }

    /**
     * Least recently used idle session, optionally restricted to anonymous ones.
     * Expired candidates met on the way are removed and queued for closing.
     */
    private PooledSession leastRecentlyUsedIdle(boolean anonymousOnly, Instant now, List<PooledSession> toClose) {
        PooledSession candidate = null;
        for (PooledSession session : List.copyOf(sessions.values())) {
            if (session.isActive() || (anonymousOnly && !session.isAnonymous())) {
                continue;
            }
            if (session.isExpired(now, settings.getTtl())) {
                sessions.remove(session.getId());
                toClose.add(session);
                continue;
            }
            if (candidate == null || session.getLastUsedAt().isBefore(candidate.getLastUsedAt())) {
                candidate = session;
            }
        }
        return candidate;
    }

    private void awaitRelease(long waitDeadline, CancellationToken cancellation, String exhaustedMessage) {
        long remaining = waitDeadline - System.nanoTime();
        if (remaining <= 0) {
            throw new PoolExhaustedException(exhaustedMessage);
        }
        try {
            sessionReleased.awaitNanos(Math.min(remaining, cancellation.nextWaitNanos()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            throw new CanceledException("interrupted while waiting for a session");
        }
    }

    private void ensureRunning() {
        if (!running) {
            throw new IllegalStateException("Session pool is not running");
        }
    }

    private String nextAnonymousId() {
        String id;
        do {
            anonymousCounter++;
            id = String.format("%s%06d", ANONYMOUS_PREFIX, anonymousCounter);
        } while (sessions.containsKey(id));
        return id;
    }

    private void reapSafely() {
        try {
            reapExpired();
        } catch (RuntimeException e) {
            log.error("Error in session reaper", e);
        }
    }

    private void closeAll(List<PooledSession> toClose) {
        for (PooledSession session : toClose) {
            closeSession(session);
        }
    }

    private void closeSession(PooledSession session) {
        BackendHandle handle = session.getHandle();
        if (handle == null) {
            return;
        }
        try {
            handle.close();
            log.debug("Closed session - sessionId: {}, uses: {}", session.getId(), session.getUseCount());
        } catch (RuntimeException e) {
            log.warn("Error closing session - sessionId: {}", session.getId(), e);
        }
    }
}
