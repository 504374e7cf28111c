package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of {@code GET /v1/models}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    @Builder.Default
    private String type = "model";

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("created_at")
    private String createdAt;
}
