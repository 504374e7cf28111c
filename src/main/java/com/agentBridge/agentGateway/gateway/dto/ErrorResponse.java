package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Anthropic error envelope: {@code {"type":"error","error":{"type":..,"message":..}}}.
 */
public record ErrorResponse(@JsonProperty("type") String type, @JsonProperty("error") ErrorDetail error) {

    public static ErrorResponse of(String errorType, String message) {
        return new ErrorResponse("error", new ErrorDetail(errorType, message));
    }

    public record ErrorDetail(@JsonProperty("type") String type, @JsonProperty("message") String message) {
    }
}
