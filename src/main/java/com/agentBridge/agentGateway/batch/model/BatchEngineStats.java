package com.agentBridge.agentGateway.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchEngineStats {

    @JsonProperty("total_batches")
    private long totalBatches;

    @JsonProperty("in_progress")
    private long inProgress;

    @JsonProperty("running_entries")
    private long runningEntries;

    @JsonProperty("concurrency")
    private int concurrency;
}
