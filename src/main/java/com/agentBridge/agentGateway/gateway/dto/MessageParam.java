package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One input message of a Messages request.
 *
 * {@code content} is either a plain string or a list of content blocks
 * (maps with a {@code type} field), exactly as clients send it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageParam {

    @NotBlank(message = "role cannot be blank")
    @JsonProperty("role")
    private String role;

    @NotNull(message = "content is required")
    @JsonProperty("content")
    private Object content;
}
