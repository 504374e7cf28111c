package com.agentBridge.agentGateway.batch;

import com.agentBridge.agentGateway.batch.model.EntryResult;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;

import java.time.Instant;

/**
 * One entry of a {@link BatchJob}. Its result only moves from pending to a
 * terminal value, under the owning job's lock.
 */
public final class BatchEntry {

    private final String customId;
    private final MessagesRequest params;

    private volatile EntryResult result = EntryResult.pending();
    private volatile boolean started;
    private volatile Instant completedAt;

    BatchEntry(String customId, MessagesRequest params) {
        this.customId = customId;
        this.params = params;
    }

    public String getCustomId() {
        return customId;
    }

    public MessagesRequest getParams() {
        return params;
    }

    public EntryResult getResult() {
        return result;
    }

    public boolean isStarted() {
        return started;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return result.isTerminal();
    }

    void markStarted() {
        started = true;
    }

    void complete(EntryResult terminal, Instant now) {
        this.result = terminal;
        this.completedAt = now;
    }
}
