package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.backend.EventStream;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.context.RequestContext;
import lombok.RequiredArgsConstructor;

/**
 * Wraps a live backend event sequence into an outbound chunk stream with
 * exactly-once completion logging.
 *
 * The caller pulls chunks from the returned {@link BridgedStream} and must close
 * it when done (normally or not). The {@code onFinish} hook, typically the release
 * of the session lease, runs once after the completion record is written.
 */
@RequiredArgsConstructor
public class StreamingResponseBridge {

    private final LogSink logSink;

    public BridgedStream bridge(EventStream events, RequestContext context, CancellationToken cancellation,
                                EventTransform transform, EventEncoder encoder, AutoCloseable onFinish) {
        context.setStream(true);
        return new BridgedStream(events, context, cancellation,
                transform != null ? transform : EventTransform.identity(),
                encoder, onFinish != null ? onFinish : () -> { }, logSink);
    }

    /**
     * Bridges without a transform or finish hook.
     */
    public BridgedStream bridge(EventStream events, RequestContext context, CancellationToken cancellation,
                                EventEncoder encoder) {
        return bridge(events, context, cancellation, EventTransform.identity(), encoder, null);
    }
}
