package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.backend.model.BackendEvent;
import com.agentBridge.agentGateway.backend.model.BackendEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Locale;
import java.util.Map;

/**
 * How backend-internal events (tool use, tool results) are exposed to clients,
 * selected per request with the {@code x-sdk-message-mode} header.
 *
 * - FORWARD: pass tool events through unchanged
 * - FORMATTED: turn tool events into XML-tagged text
 * - IGNORE: drop tool events, keep only text
 */
public enum MessageMode implements EventTransform {

    FORWARD {
        @Override
        public BackendEvent apply(BackendEvent event) {
            return event;
        }
    },

    FORMATTED {
        @Override
        public BackendEvent apply(BackendEvent event) {
            if (event.getType() == BackendEventType.TOOL_USE) {
                return BackendEvent.text(formatToolUse(event.getToolName(), event.getToolInput()), event.getOutputTokens());
            }
            if (event.getType() == BackendEventType.TOOL_RESULT) {
                return BackendEvent.text(formatToolResult(event.getText()), event.getOutputTokens());
            }
            return event;
        }
    },

    IGNORE {
        @Override
        public BackendEvent apply(BackendEvent event) {
            if (event.getType() == BackendEventType.TOOL_USE || event.getType() == BackendEventType.TOOL_RESULT) {
                return null;
            }
            return event;
        }
    };

    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Resolves a header value, falling back to the default for null or unknown values.
     */
    public static MessageMode fromHeader(String headerValue, MessageMode defaultMode) {
        if (headerValue == null || headerValue.isBlank()) {
            return defaultMode;
        }
        try {
            return MessageMode.valueOf(headerValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultMode;
        }
    }

    static String formatToolUse(String name, Map<String, Object> input) {
        String json;
        try {
            json = PRETTY.writeValueAsString(input == null ? Map.of() : input);
        } catch (JsonProcessingException e) {
            json = String.valueOf(input);
        }
        return "<tool_use name=\"" + name + "\">\n" + json + "\n</tool_use>";
    }

    static String formatToolResult(String content) {
        return "<tool_result>\n" + (content == null ? "" : content) + "\n</tool_result>";
    }
}
