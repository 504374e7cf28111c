package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response body of a non-streaming {@code POST /v1/messages}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessagesResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    @Builder.Default
    private String type = "message";

    @JsonProperty("role")
    @Builder.Default
    private String role = "assistant";

    @JsonProperty("content")
    private List<ContentBlock> content;

    @JsonProperty("model")
    private String model;

    @JsonProperty("stop_reason")
    private String stopReason;

    @JsonProperty("stop_sequence")
    private String stopSequence;

    @JsonProperty("usage")
    private Usage usage;
}
