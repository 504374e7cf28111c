package com.agentBridge.agentGateway.cancellation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal threaded through session acquisition,
 * backend invocation and stream pulls.
 *
 * A token is cancelled either explicitly via {@link #cancel(String)} or implicitly
 * once its deadline passes. Deadlines are observed lazily: every suspension point
 * calls {@link #throwIfCancelled()} or waits no longer than {@link #remaining()}.
 * Child tokens created with {@link #withTimeout(Duration)} are cancelled together
 * with their parent.
 */
@Slf4j
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    /**
     * Upper bound for a single blocking wait so that explicit cancellation is
     * noticed promptly by threads parked in {@link #await(Future)}.
     */
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final CancellationToken parent;
    private final long deadlineNanos;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(CancellationToken parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a token with no deadline that is only cancelled explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, NO_DEADLINE);
    }

    /**
     * Creates a token that cancels itself once the timeout elapses.
     */
    public static CancellationToken withDeadline(Duration timeout) {
        return create().withTimeout(timeout);
    }

    /**
     * Derives a child token that is cancelled when this token is cancelled or when
     * the given timeout elapses, whichever comes first.
     */
    public CancellationToken withTimeout(Duration timeout) {
        long childDeadline = timeout == null ? NO_DEADLINE : saturatedAdd(System.nanoTime(), timeout.toNanos());
        CancellationToken child = new CancellationToken(this, Math.min(childDeadline, deadlineNanos));
        onCancel(() -> child.cancel(reasonOrDefault()));
        return child;
    }

    /**
     * Cancels the token. Only the first reason is kept; listeners run once.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why == null ? "canceled" : why)) {
            return false;
        }
        // whoever removes a listener runs it, so a concurrent onCancel never loses one
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (parent != null && parent.isCancelled()) {
            cancel(parent.reasonOrDefault());
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            cancel("timeout");
            return true;
        }
        return false;
    }

    /**
     * @return true when the cancellation was caused by the deadline passing
     */
    public boolean isTimedOut() {
        return isCancelled() && "timeout".equals(reason.get());
    }

    public String getReason() {
        isCancelled();
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CanceledException(reasonOrDefault(), isTimedOut());
        }
    }

    /**
     * Time left before the deadline, or {@code null} when the token has none.
     */
    public Duration remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return null;
        }
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    /**
     * Registers a callback fired when the token is cancelled. If the token is
     * already cancelled the callback runs immediately on the calling thread.
     */
    public void onCancel(Runnable listener) {
        if (isCancelled()) {
            listener.run();
            return;
        }
        listeners.add(listener);
        if (reason.get() != null && listeners.remove(listener)) {
            runListener(listener);
        }
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed - reason: {}", reason.get(), e);
        }
    }

    /**
     * Waits for a future while honouring this token. On cancellation the future is
     * cancelled with interruption and {@link CanceledException} is thrown.
     *
     * @throws ExecutionException if the future completed exceptionally
     */
    public <T> T await(Future<T> future) throws ExecutionException {
        while (true) {
            if (isCancelled()) {
                future.cancel(true);
                throw new CanceledException(reasonOrDefault(), isTimedOut());
            }
            try {
                return future.get(nextWaitNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // re-check the token and keep waiting
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                cancel("interrupted");
                throw new CanceledException("interrupted", false);
            }
        }
    }

    /**
     * Length of the next bounded wait: never longer than the poll slice and never
     * past the deadline.
     */
    public long nextWaitNanos() {
        if (deadlineNanos == NO_DEADLINE) {
            return POLL_SLICE_NANOS;
        }
        return Math.max(1, Math.min(POLL_SLICE_NANOS, deadlineNanos - System.nanoTime()));
    }

    private String reasonOrDefault() {
        String current = reason.get();
        return current == null ? "canceled" : current;
    }

    private static long saturatedAdd(long base, long delta) {
        long sum = base + delta;
        if (((base ^ sum) & (delta ^ sum)) < 0) {
            return NO_DEADLINE;
        }
        return sum;
    }
}
