package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /v1/messages}, also used as batch entry params.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessagesRequest {

    @NotBlank(message = "model cannot be blank")
    @JsonProperty("model")
    private String model;

    @NotEmpty(message = "messages cannot be empty")
    @Valid
    @JsonProperty("messages")
    private List<MessageParam> messages;

    @Positive(message = "max_tokens must be positive")
    @JsonProperty("max_tokens")
    @Builder.Default
    private Integer maxTokens = 4096;

    /**
     * System prompt as a string or a list of text blocks.
     */
    @JsonProperty("system")
    private Object system;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("top_k")
    private Integer topK;

    @JsonProperty("stop_sequences")
    private List<String> stopSequences;

    @JsonProperty("tools")
    private List<Map<String, Object>> tools;

    @JsonProperty("tool_choice")
    private Map<String, Object> toolChoice;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}
