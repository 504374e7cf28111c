package com.agentBridge.agentGateway.batch;

import java.util.List;

/**
 * One page of jobs, newest first.
 */
public record BatchPage(List<BatchJob> data, boolean hasMore) {

    public String firstId() {
        return data.isEmpty() ? null : data.get(0).getId();
    }

    public String lastId() {
        return data.isEmpty() ? null : data.get(data.size() - 1).getId();
    }
}
