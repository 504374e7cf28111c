package com.agentBridge.agentGateway.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Read-only snapshot of the session pool for observability.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionPoolStats {

    @JsonProperty("active")
    private int active;

    @JsonProperty("idle")
    private int idle;

    @JsonProperty("total")
    private int total;

    @JsonProperty("capacity")
    private int capacity;

    @JsonProperty("ttl_seconds")
    private long ttlSeconds;

    @JsonProperty("sessions")
    private List<SessionInfo> sessions;
}
