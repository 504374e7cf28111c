package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.audit.AuditRecord;
import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.backend.EventStream;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import com.agentBridge.agentGateway.backend.model.BackendEvent;
import com.agentBridge.agentGateway.backend.model.BackendEventType;
import com.agentBridge.agentGateway.cancellation.CanceledException;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound side of a bridged stream: a pull iterator of framed chunks.
 *
 * Each upstream event yields at most one chunk, in arrival order. Whatever way
 * the stream ends (terminal event handed out, upstream failure, cancellation,
 * or {@link #close()} before the end) exactly one {@code stream_completed} record
 * is written and the finish hook runs exactly once.
 *
 * Not safe for concurrent pulls. {@link #close()} may come from another thread
 * while a pull is in flight: the disconnect is recorded and the token canceled
 * right away, but the upstream close and the finish hook run on the pulling
 * thread once its pull returns, so the backend handle is never released while
 * it is still in use.
 */
@Slf4j
public final class BridgedStream implements Iterator<byte[]>, AutoCloseable {

    private final EventStream upstream;
    private final RequestContext context;
    private final CancellationToken cancellation;
    private final EventTransform transform;
    private final EventEncoder encoder;
    private final AutoCloseable onFinish;
    private final LogSink logSink;

    private final long startNanos = System.nanoTime();
    private final AtomicBoolean completed = new AtomicBoolean();
    private final Object finishLock = new Object();

    private Thread pullingThread;
    private boolean finishDeferred;
    private boolean finished;

    private byte[] buffered;
    private boolean terminalBuffered;
    private boolean upstreamDone;
    private volatile long bytesSent;
    private volatile long chunksSent;
    private volatile CompletionCause cause;

    BridgedStream(EventStream upstream, RequestContext context, CancellationToken cancellation,
                  EventTransform transform, EventEncoder encoder, AutoCloseable onFinish, LogSink logSink) {
        this.upstream = upstream;
        this.context = context;
        this.cancellation = cancellation;
        this.transform = transform;
        this.encoder = encoder;
        this.onFinish = onFinish;
        this.logSink = logSink;
    }

    @Override
    public boolean hasNext() {
        if (completed.get()) {
            return false;
        }
        if (buffered != null) {
            return true;
        }
        if (upstreamDone) {
            return false;
        }
        byte[] chunk = guardedPull();
        if (chunk != null && completed.get()) {
            // closed by another thread while this pull was running
            terminalBuffered = false;
            return false;
        }
        buffered = chunk;
        return buffered != null;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream is complete");
        }
        byte[] chunk = buffered;
        buffered = null;
        bytesSent += chunk.length;
        chunksSent++;
        if (terminalBuffered) {
            terminalBuffered = false;
            complete(CompletionCause.SUCCESS, null);
        }
        return chunk;
    }

    /**
     * Abandons the stream. If the terminal event has not been handed out yet the
     * completion is recorded as {@link CompletionCause#CLIENT_DISCONNECTED}.
     */
    @Override
    public void close() {
        if (!completed.get()) {
            context.setDisconnectReason("client_disconnect");
            complete(CompletionCause.CLIENT_DISCONNECTED, null);
            cancellation.cancel("client disconnected");
        }
    }

    public long getBytesSent() {
        return bytesSent;
    }

    public long getChunksSent() {
        return chunksSent;
    }

    /**
     * @return how the stream ended, or null while it is still open
     */
    public CompletionCause getCause() {
        return cause;
    }

    public boolean isCompleted() {
        return completed.get();
    }

    private byte[] guardedPull() {
        synchronized (finishLock) {
            if (finished) {
                return null;
            }
            pullingThread = Thread.currentThread();
        }
        try {
            return pull();
        } finally {
            boolean runFinish;
            synchronized (finishLock) {
                pullingThread = null;
                runFinish = finishDeferred;
                finishDeferred = false;
            }
            if (runFinish) {
                finish();
            }
        }
    }

    private byte[] pull() {
        try {
            while (true) {
                if (completed.get()) {
                    return null;
                }
                cancellation.throwIfCancelled();
                if (!upstream.hasNext()) {
                    throw new BackendUnavailableException("Backend stream ended without a stop event");
                }
                BackendEvent event = upstream.next();
                trackTokens(event);

                BackendEvent outbound = event.isTerminal() ? event : transform.apply(event);
                if (outbound == null) {
                    continue;
                }
                byte[] chunk = encoder.encode(outbound);
                if (event.isTerminal()) {
                    upstreamDone = true;
                    if (chunk == null || chunk.length == 0) {
                        complete(CompletionCause.SUCCESS, null);
                        return null;
                    }
                    terminalBuffered = true;
                    return chunk;
                }
                if (chunk != null && chunk.length > 0) {
                    return chunk;
                }
            }
        } catch (CanceledException e) {
            if (completed.get()) {
                throw e;
            }
            context.markCanceled();
            complete(CompletionCause.ERROR, e);
            throw e;
        } catch (RuntimeException e) {
            complete(CompletionCause.ERROR, e);
            throw e;
        }
    }

    private void trackTokens(BackendEvent event) {
        if (event.getType() == BackendEventType.USAGE) {
            context.raiseTokensIn(event.getInputTokens());
            context.raiseTokensOut(event.getOutputTokens());
        } else if (event.getOutputTokens() > 0) {
            context.addTokensOut(event.getOutputTokens());
        }
    }

    private void complete(CompletionCause completionCause, RuntimeException error) {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        cause = completionCause;
        upstreamDone = true;
        if (error != null) {
            context.recordError(error);
        }

        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        AuditRecord.Outcome outcome = switch (completionCause) {
            case SUCCESS -> AuditRecord.Outcome.SUCCESS;
            case CLIENT_DISCONNECTED -> AuditRecord.Outcome.WARNING;
            case ERROR -> AuditRecord.Outcome.FAILURE;
        };
        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(context)) {
            logSink.record(AuditRecord.builder(AuditRecord.STREAM_COMPLETED)
                    .outcome(outcome)
                    .field("request_id", context.getRequestId())
                    .field("session_id", context.getSessionId())
                    .field("path", context.getPath())
                    .field("model", context.getModel())
                    .field("status", completionCause.getValue())
                    .field("bytes_sent", bytesSent)
                    .field("chunks_sent", chunksSent)
                    .field("duration_ms", durationMillis)
                    .field("tokens_in", context.getTokensIn())
                    .field("tokens_out", context.getTokensOut())
                    .field("canceled", context.isCanceled() ? Boolean.TRUE : null)
                    .field("error", error != null ? error.getMessage() : null)
                    .field("error_type", error != null ? error.getClass().getSimpleName() : null)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Log sink failed to record stream completion - requestId: {}", context.getRequestId(), e);
        } finally {
            finishOrDefer();
        }
    }

    private void finishOrDefer() {
        synchronized (finishLock) {
            if (finished) {
                return;
            }
            if (pullingThread != null && pullingThread != Thread.currentThread()) {
                finishDeferred = true;
                return;
            }
            finished = true;
        }
        runFinishHooks();
    }

    private void finish() {
        synchronized (finishLock) {
            if (finished) {
                return;
            }
            finished = true;
        }
        runFinishHooks();
    }

    private void runFinishHooks() {
        try {
            upstream.close();
        } catch (RuntimeException e) {
            log.warn("Error closing upstream event stream - requestId: {}", context.getRequestId(), e);
        }
        try {
            onFinish.close();
        } catch (Exception e) {
            log.warn("Error running stream finish hook - requestId: {}", context.getRequestId(), e);
        }
    }
}
