package com.agentBridge.agentGateway.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-outcome entry counts of a batch job. {@code processing} covers entries
 * not yet terminal, running or not.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestCounts {

    @JsonProperty("processing")
    private int processing;

    @JsonProperty("succeeded")
    private int succeeded;

    @JsonProperty("errored")
    private int errored;

    @JsonProperty("canceled")
    private int canceled;

    @JsonProperty("expired")
    private int expired;

    public int total() {
        return processing + succeeded + errored + canceled + expired;
    }
}
