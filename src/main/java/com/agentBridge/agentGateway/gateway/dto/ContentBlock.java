package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Content block of a Messages response (text, thinking, tool_use or tool_result).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBlock {

    @JsonProperty("type")
    private String type;

    @JsonProperty("text")
    private String text;

    @JsonProperty("thinking")
    private String thinking;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("input")
    private Map<String, Object> input;

    @JsonProperty("tool_use_id")
    private String toolUseId;

    @JsonProperty("content")
    private String content;

    public static ContentBlock text(String text) {
        return ContentBlock.builder().type("text").text(text).build();
    }
}
