package com.agentBridge.agentGateway.audit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Destination for structured completion and audit records (request lifecycle,
 * stream completion, batch entry outcomes).
 *
 * Implementations must not throw: a failing sink never changes request behavior.
 */
public interface LogSink {

    void record(AuditRecord record);

    /**
     * Counters over the records seen so far, for the log stats endpoint.
     * Sinks that keep none report themselves unavailable.
     */
    default Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", false);
        stats.put("reason", "Audit records are disabled");
        return stats;
    }

    /**
     * Sink that drops every record.
     */
    static LogSink noOp() {
        return NoOpLogSink.INSTANCE;
    }
}
