package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /v1/messages/count_tokens}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CountTokensRequest {

    @NotBlank(message = "model cannot be blank")
    @JsonProperty("model")
    private String model;

    @NotEmpty(message = "messages cannot be empty")
    @Valid
    @JsonProperty("messages")
    private List<MessageParam> messages;

    @JsonProperty("system")
    private Object system;

    @JsonProperty("tools")
    private List<Map<String, Object>> tools;
}
