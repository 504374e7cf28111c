package com.agentBridge.agentGateway.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Incremental event produced by a backend invocation.
 *
 * Which fields are populated depends on {@link #type}:
 * TEXT and THINKING carry {@code text} (and optionally {@code outputTokens}),
 * TOOL_USE carries the tool id, name and input, TOOL_RESULT carries the tool id
 * and {@code text}, USAGE carries token totals, STOP is the terminal marker and
 * carries the stop reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BackendEvent {

    private BackendEventType type;

    private String text;

    private String toolUseId;

    private String toolName;

    private Map<String, Object> toolInput;

    private long inputTokens;

    private long outputTokens;

    private String stopReason;

    public static BackendEvent text(String text) {
        return BackendEvent.builder().type(BackendEventType.TEXT).text(text).build();
    }

    public static BackendEvent text(String text, long outputTokens) {
        return BackendEvent.builder().type(BackendEventType.TEXT).text(text).outputTokens(outputTokens).build();
    }

    public static BackendEvent thinking(String text) {
        return BackendEvent.builder().type(BackendEventType.THINKING).text(text).build();
    }

    public static BackendEvent toolUse(String id, String name, Map<String, Object> input) {
        return BackendEvent.builder().type(BackendEventType.TOOL_USE).toolUseId(id).toolName(name).toolInput(input).build();
    }

    public static BackendEvent toolResult(String toolUseId, String content) {
        return BackendEvent.builder().type(BackendEventType.TOOL_RESULT).toolUseId(toolUseId).text(content).build();
    }

    public static BackendEvent usage(long inputTokens, long outputTokens) {
        return BackendEvent.builder().type(BackendEventType.USAGE).inputTokens(inputTokens).outputTokens(outputTokens).build();
    }

    public static BackendEvent stop(String stopReason) {
        return BackendEvent.builder().type(BackendEventType.STOP).stopReason(stopReason).build();
    }

    public boolean isTerminal() {
        return type == BackendEventType.STOP;
    }
}
