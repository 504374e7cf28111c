package com.agentBridge.agentGateway.context;

import lombok.Builder;
import lombok.Getter;

import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request context passed through the system.
 *
 * Created when request handling starts, threaded through session acquisition,
 * streaming and batch entry execution, and consumed once by the log sink when
 * the request completes. Token counters and the error are updated concurrently
 * (for example by the thread pulling a stream), so they are held atomically.
 */
@Getter
public class RequestContext {

    private static final String REQUEST_ID_PREFIX = "req_";

    /**
     * Unique id of the inbound call; taken from {@code x-request-id} or generated.
     */
    private final String requestId;

    /**
     * Session id from {@code x-session-id}, null for ephemeral requests.
     */
    private volatile String sessionId;

    private final String path;

    private final String method;

    private volatile String model;

    private final String userAgent;

    private final String clientIp;

    /**
     * Monotonic start time, see {@link System#nanoTime()}.
     */
    private final long startNanos;

    private volatile boolean stream;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong tokensIn = new AtomicLong();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong tokensOut = new AtomicLong();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<String> error = new AtomicReference<>();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean canceled = new AtomicBoolean();

    private volatile String disconnectReason;

    @Builder
    private RequestContext(String requestId, String sessionId, String path, String method, String model,
                           String userAgent, String clientIp, boolean stream) {
        this.requestId = requestId == null || requestId.isBlank() ? generateRequestId() : requestId;
        this.sessionId = sessionId;
        this.path = path;
        this.method = method;
        this.model = model;
        this.userAgent = userAgent;
        this.clientIp = clientIp;
        this.stream = stream;
        this.startNanos = System.nanoTime();
    }

    /**
     * Generates a request id in the {@code req_<12 hex>} form.
     */
    public static String generateRequestId() {
        UUID uuid = UUID.randomUUID();
        return REQUEST_ID_PREFIX + HexFormat.of().toHexDigits(uuid.getMostSignificantBits()).substring(0, 12);
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public void setStream(boolean stream) {
        this.stream = stream;
    }

    public void setDisconnectReason(String disconnectReason) {
        this.disconnectReason = disconnectReason;
    }

    public long getTokensIn() {
        return tokensIn.get();
    }

    public long getTokensOut() {
        return tokensOut.get();
    }

    public void addTokens(long input, long output) {
        tokensIn.addAndGet(input);
        tokensOut.addAndGet(output);
    }

    public void addTokensOut(long output) {
        tokensOut.addAndGet(output);
    }

    /**
     * Raises the input token count to at least the given value (usage reports are cumulative).
     */
    public void raiseTokensIn(long total) {
        tokensIn.accumulateAndGet(total, Math::max);
    }

    /**
     * Raises the output token count to at least the given value (usage reports are cumulative).
     */
    public void raiseTokensOut(long total) {
        tokensOut.accumulateAndGet(total, Math::max);
    }

    public long getTotalTokens() {
        return tokensIn.get() + tokensOut.get();
    }

    public String getError() {
        return error.get();
    }

    public void recordError(String message) {
        error.set(message);
    }

    public void recordError(Throwable throwable) {
        error.set(throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }

    public boolean isCanceled() {
        return canceled.get();
    }

    public void markCanceled() {
        canceled.set(true);
    }

    public long getDurationMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Converts the context to ordered fields for structured logging.
     */
    public Map<String, Object> toLogMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("request_id", requestId);
        fields.put("session_id", sessionId);
        fields.put("path", path);
        fields.put("method", method);
        fields.put("model", model);
        fields.put("duration_ms", getDurationMillis());
        fields.put("tokens_in", getTokensIn());
        fields.put("tokens_out", getTokensOut());
        fields.put("stream", stream);
        fields.put("canceled", isCanceled() ? Boolean.TRUE : null);
        fields.put("disconnect_reason", disconnectReason);
        fields.put("error", getError());
        return fields;
    }
}
