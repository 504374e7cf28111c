package com.agentBridge.agentGateway.audit;

/**
 * {@link LogSink} that discards records.
 */
public final class NoOpLogSink implements LogSink {

    static final NoOpLogSink INSTANCE = new NoOpLogSink();

    private NoOpLogSink() {
    }

    @Override
    public void record(AuditRecord record) {
    }
}
