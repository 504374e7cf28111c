package com.agentBridge.agentGateway.batch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchSettings {

    /**
     * Entries of one job running at the same time.
     */
    @Builder.Default
    private int concurrency = 5;

    @Builder.Default
    private int maxBatchSize = 100;

    /**
     * Retention horizon from creation; the job is purged after it.
     */
    @Builder.Default
    private Duration retention = Duration.ofDays(29);

    @Builder.Default
    private Duration sweepInterval = Duration.ofSeconds(60);

    /**
     * Deadline for a single entry's backend call.
     */
    @Builder.Default
    private Duration entryTimeout = Duration.ofSeconds(300);
}
