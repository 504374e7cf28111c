package com.agentBridge.agentGateway.session;

import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.cancellation.CanceledException;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.session.exception.PoolExhaustedException;
import com.agentBridge.agentGateway.session.exception.SessionNotFoundException;
import com.agentBridge.agentGateway.session.model.SessionInfo;
import com.agentBridge.agentGateway.session.model.SessionPoolStats;
import com.agentBridge.agentGateway.support.FakeBackendFactory;
import com.agentBridge.agentGateway.support.FakeBackendHandle;
import com.agentBridge.agentGateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPoolTest {

    private final FakeBackendFactory factory = new FakeBackendFactory();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final List<SessionPool> pools = new ArrayList<>();

    @AfterEach
    void stopPools() {
        pools.forEach(SessionPool::stop);
    }

    private SessionPool pool(int maxSessions, Duration acquireTimeout) {
        return pool(SessionPoolSettings.builder()
                .maxSessions(maxSessions)
                .ttl(Duration.ofSeconds(60))
                .cleanupInterval(Duration.ofHours(1))
                .acquireTimeout(acquireTimeout)
                .build());
    }

    private SessionPool pool(SessionPoolSettings settings) {
        SessionPool pool = new SessionPool(factory, BackendOptions.builder().model("test-model").build(), settings, clock);
        pool.start();
        pools.add(pool);
        return pool;
    }

    private static CancellationToken token() {
        return CancellationToken.create();
    }

    @Test
    void openLeavesNamedSessionIdleForLaterRequests() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        String sessionId = pool.open(token());

        assertThat(sessionId).matches("session_[0-9a-f]{32}");
        SessionPoolStats stats = pool.stats();
        assertThat(stats.getIdle()).isEqualTo(1);
        SessionInfo info = stats.getSessions().get(0);
        assertThat(info.getId()).isEqualTo(sessionId);
        assertThat(info.isAnonymous()).isFalse();
        assertThat(factory.handle(0).clears()).isEqualTo(1);

        try (LeasedSession anonymous = pool.acquire(null, token())) {
            assertThat(anonymous.getSessionId()).isNotEqualTo(sessionId);
        }
        try (LeasedSession lease = pool.acquire(sessionId, token())) {
            assertThat(lease.getHandle()).isSameAs(factory.handle(0));
        }
    }

    @Test
    void namedSessionIsReusedAndClearedOnEveryRelease() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        try (LeasedSession lease = pool.acquire("a", token())) {
            assertThat(lease.getSessionId()).isEqualTo("a");
            assertThat(lease.isAnonymous()).isFalse();
        }
        try (LeasedSession lease = pool.acquire("a", token())) {
            assertThat(lease.getHandle()).isSameAs(factory.handle(0));
        }

        assertThat(factory.created()).hasSize(1);
        assertThat(factory.handle(0).clears()).isEqualTo(2);
        assertThat(factory.handle(0).closes()).isZero();
    }

    @Test
    void releasedLeaseRejectsFurtherUseAndReleasesOnlyOnce() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        LeasedSession lease = pool.acquire("a", token());
        lease.close();
        lease.close();

        assertThat(lease.isReleased()).isTrue();
        assertThat(factory.handle(0).clears()).isEqualTo(1);
        assertThatThrownBy(lease::getHandle).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void concurrentAcquiresOfOneSessionNeverOverlap() throws Exception {
        SessionPool pool = pool(4, Duration.ofSeconds(10));
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int n = 0; n < 20; n++) {
                        try (LeasedSession ignored = pool.acquire("shared", token())) {
                            maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                            Thread.sleep(1);
                            holders.decrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxHolders.get()).isEqualTo(1);
        assertThat(factory.created()).hasSize(1);
        assertThat(factory.handle(0).clears()).isEqualTo(160);
    }

    @Test
    void secondAcquireOfBusySessionFailsAfterAcquireTimeout() {
        SessionPool pool = pool(1, Duration.ofMillis(100));

        try (LeasedSession ignored = pool.acquire("a", token())) {
            assertThatThrownBy(() -> pool.acquire("a", token()))
                    .isInstanceOf(PoolExhaustedException.class)
                    .hasMessageContaining("busy");
        }
    }

    @Test
    void waiterForBusySessionGetsItOnlyAfterClear() throws Exception {
        SessionPool pool = pool(1, Duration.ofSeconds(5));
        LeasedSession first = pool.acquire("a", token());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> clearsSeenBySecond = executor.submit(() -> {
                try (LeasedSession second = pool.acquire("a", token())) {
                    return ((FakeBackendHandle) second.getHandle()).clears();
                }
            });
            Thread.sleep(100);
            assertThat(clearsSeenBySecond).isNotDone();

            first.close();

            assertThat(clearsSeenBySecond.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void anonymousAcquiresReuseIdleSessionsAndGenerateIds() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        LeasedSession first = pool.acquire(null, token());
        LeasedSession second = pool.acquire(null, token());
        assertThat(first.isAnonymous()).isTrue();
        assertThat(first.getSessionId()).isEqualTo("pool_session_000001");
        assertThat(second.getSessionId()).isEqualTo("pool_session_000002");
        first.close();
        second.close();

        try (LeasedSession reused = pool.acquire(null, token())) {
            assertThat(reused.getSessionId()).startsWith("pool_session_");
        }
        assertThat(factory.created()).hasSize(2);
    }

    @Test
    void anonymousAcquireDoesNotTakeNamedSessions() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("named", token()).close();

        try (LeasedSession lease = pool.acquire(null, token())) {
            assertThat(lease.getSessionId()).isNotEqualTo("named");
        }
        assertThat(factory.created()).hasSize(2);
    }

    @Test
    void fullPoolEvictsLeastRecentlyUsedIdleSession() {
        SessionPool pool = pool(2, Duration.ofSeconds(1));
        pool.acquire("a", token()).close();
        clock.advance(Duration.ofSeconds(1));
        pool.acquire("b", token()).close();
        clock.advance(Duration.ofSeconds(1));

        try (LeasedSession lease = pool.acquire("c", token())) {
            assertThat(lease.getSessionId()).isEqualTo("c");
        }

        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isZero();
        SessionPoolStats stats = pool.stats();
        assertThat(stats.getTotal()).isEqualTo(2);
        assertThat(stats.getSessions()).extracting(SessionInfo::getId).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void fullPoolWithOnlyActiveSessionsIsExhausted() {
        SessionPool pool = pool(1, Duration.ofMillis(100));

        try (LeasedSession ignored = pool.acquire("a", token())) {
            assertThatThrownBy(() -> pool.acquire("b", token()))
                    .isInstanceOf(PoolExhaustedException.class)
                    .hasMessageContaining("capacity");
        }
        assertThat(factory.handle(0).closes()).isZero();
    }

    @Test
    void clearFailureEvictsSessionWithoutReachingCaller() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        factory.customize(handle -> handle.failClearWith(new IllegalStateException("clear failed")));

        LeasedSession lease = pool.acquire("a", token());
        lease.close();

        assertThat(factory.handle(0).clears()).isEqualTo(1);
        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(pool.stats().getTotal()).isZero();

        factory.customize(handle -> { });
        try (LeasedSession fresh = pool.acquire("a", token())) {
            assertThat(fresh.getHandle()).isSameAs(factory.handle(1));
        }
    }

    @Test
    void reaperEvictsExpiredIdleSessionsButNeverActiveOnes() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("idle", token()).close();
        LeasedSession active = pool.acquire("active", token());

        clock.advance(Duration.ofSeconds(61));

        assertThat(pool.reapExpired()).isEqualTo(1);
        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isZero();
        assertThat(pool.stats().getSessions()).extracting(SessionInfo::getId).containsExactly("active");

        active.close();
        assertThat(pool.reapExpired()).isZero();
    }

    @Test
    void sessionWithinTtlSurvivesReaper() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("a", token()).close();

        clock.advance(Duration.ofSeconds(59));

        assertThat(pool.reapExpired()).isZero();
        assertThat(pool.stats().getTotal()).isEqualTo(1);
    }

    @Test
    void backgroundReaperEvictsWithinCleanupInterval() throws Exception {
        SessionPool pool = pool(SessionPoolSettings.builder()
                .maxSessions(10)
                .ttl(Duration.ofSeconds(60))
                .cleanupInterval(Duration.ofMillis(50))
                .acquireTimeout(Duration.ofSeconds(1))
                .build());
        pool.acquire("a", token()).close();

        clock.advance(Duration.ofSeconds(61));

        assertThat(factory.handle(0).awaitClosed(Duration.ofSeconds(5))).isTrue();
        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(pool.stats().getTotal()).isZero();
    }

    @Test
    void reaperContinuesPastHandlesThatFailToClose() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        factory.customize(handle -> handle.failCloseWith(new IllegalStateException("stuck")));
        pool.acquire("a", token()).close();
        pool.acquire("b", token()).close();

        clock.advance(Duration.ofSeconds(61));

        assertThat(pool.reapExpired()).isEqualTo(2);
        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isEqualTo(1);
        assertThat(pool.stats().getTotal()).isZero();
    }

    @Test
    void expiredSessionIsReplacedOnAcquire() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("a", token()).close();
        clock.advance(Duration.ofSeconds(61));

        try (LeasedSession lease = pool.acquire("a", token())) {
            assertThat(lease.getHandle()).isSameAs(factory.handle(1));
        }
        assertThat(factory.handle(0).closes()).isEqualTo(1);
    }

    @Test
    void invalidateClosesIdleSessionsAndDefersActiveOnes() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("idle", token()).close();
        LeasedSession active = pool.acquire("active", token());

        pool.invalidate("idle");
        pool.invalidate("active");

        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isZero();

        active.close();
        assertThat(factory.handle(1).clears()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isEqualTo(1);
        assertThat(pool.stats().getTotal()).isZero();
    }

    @Test
    void invalidateUnknownSessionFails() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        assertThatThrownBy(() -> pool.invalidate("missing"))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void failedHandleCreationFreesReservedSlot() {
        SessionPool pool = pool(1, Duration.ofMillis(100));
        factory.failCreateWith(new IllegalStateException("backend down"));

        assertThatThrownBy(() -> pool.acquire("a", token())).hasMessage("backend down");
        assertThat(pool.stats().getTotal()).isZero();

        factory.failCreateWith(null);
        try (LeasedSession lease = pool.acquire("b", token())) {
            assertThat(lease.getSessionId()).isEqualTo("b");
        }
    }

    @Test
    void cancellationStopsWaitingForCapacity() throws Exception {
        SessionPool pool = pool(1, Duration.ofSeconds(10));
        CancellationToken cancellation = CancellationToken.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (LeasedSession ignored = pool.acquire("a", token())) {
            Future<LeasedSession> waiting = executor.submit(() -> pool.acquire("b", cancellation));
            Thread.sleep(100);

            cancellation.cancel("client went away");

            assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(CanceledException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void expiredDeadlineFailsAcquireImmediately() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));

        assertThatThrownBy(() -> pool.acquire("a", CancellationToken.withDeadline(Duration.ZERO)))
                .isInstanceOf(CanceledException.class);
        assertThat(factory.created()).isEmpty();
    }

    @Test
    void stopClosesIdleSessionsAndLeasedOnesOnRelease() {
        SessionPool pool = pool(10, Duration.ofSeconds(1));
        pool.acquire("idle", token()).close();
        LeasedSession active = pool.acquire("active", token());

        pool.stop();

        assertThat(pool.isRunning()).isFalse();
        assertThat(factory.handle(0).closes()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isZero();

        active.close();
        assertThat(factory.handle(1).clears()).isEqualTo(1);
        assertThat(factory.handle(1).closes()).isEqualTo(1);
        assertThatThrownBy(() -> pool.acquire("a", token())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void statsReportActiveIdleAndCapacity() {
        SessionPool pool = pool(5, Duration.ofSeconds(1));
        pool.acquire("idle", token()).close();

        try (LeasedSession ignored = pool.acquire("active", token())) {
            SessionPoolStats stats = pool.stats();
            assertThat(stats.getActive()).isEqualTo(1);
            assertThat(stats.getIdle()).isEqualTo(1);
            assertThat(stats.getTotal()).isEqualTo(2);
            assertThat(stats.getCapacity()).isEqualTo(5);
            assertThat(stats.getTtlSeconds()).isEqualTo(60);
        }
    }
}
