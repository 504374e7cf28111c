package com.agentBridge.agentGateway.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-session snapshot reported by pool statistics.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("anonymous")
    private boolean anonymous;

    @JsonProperty("active")
    private boolean active;

    @JsonProperty("age_seconds")
    private long ageSeconds;

    @JsonProperty("idle_seconds")
    private long idleSeconds;

    @JsonProperty("use_count")
    private long useCount;
}
