package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountTokensResponse {

    @JsonProperty("input_tokens")
    private long inputTokens;
}
