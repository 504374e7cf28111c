package com.agentBridge.agentGateway.streaming;

import com.agentBridge.agentGateway.backend.model.BackendEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Frames backend events as Anthropic Messages streaming events
 * ({@code message_start}, {@code content_block_*}, {@code message_delta},
 * {@code message_stop}) in server-sent-events format.
 *
 * Stateful: tracks whether the message was started and which content block is
 * open. One instance per stream.
 */
public class AnthropicSseEncoder implements EventEncoder {

    private static final byte[] NOTHING = new byte[0];

    private final ObjectMapper objectMapper;
    private final String messageId;
    private final String model;

    private boolean started;
    private int nextIndex;
    private String openBlockType;
    private long inputTokens;
    private long outputTokens;

    public AnthropicSseEncoder(ObjectMapper objectMapper, String messageId, String model) {
        this.objectMapper = objectMapper;
        this.messageId = messageId;
        this.model = model;
    }

    @Override
    public byte[] encode(BackendEvent event) {
        StringBuilder frames = new StringBuilder();
        switch (event.getType()) {
            case TEXT -> {
                start(frames);
                outputTokens += event.getOutputTokens();
                openBlock(frames, "text");
                ObjectNode delta = objectMapper.createObjectNode().put("type", "text_delta").put("text", nullToEmpty(event.getText()));
                frame(frames, "content_block_delta", blockEvent("content_block_delta").set("delta", delta));
            }
            case THINKING -> {
                start(frames);
                outputTokens += event.getOutputTokens();
                openBlock(frames, "thinking");
                ObjectNode delta = objectMapper.createObjectNode().put("type", "thinking_delta").put("thinking", nullToEmpty(event.getText()));
                frame(frames, "content_block_delta", blockEvent("content_block_delta").set("delta", delta));
            }
            case TOOL_USE -> {
                start(frames);
                closeBlock(frames);
                ObjectNode block = objectMapper.createObjectNode()
                        .put("type", "tool_use")
                        .put("id", event.getToolUseId())
                        .put("name", event.getToolName());
                block.putObject("input");
                startBlock(frames, "tool_use", block);
                ObjectNode delta = objectMapper.createObjectNode()
                        .put("type", "input_json_delta")
                        .put("partial_json", toJson(event.getToolInput() == null ? Map.of() : event.getToolInput()));
                frame(frames, "content_block_delta", blockEvent("content_block_delta").set("delta", delta));
                closeBlock(frames);
            }
            case TOOL_RESULT -> {
                start(frames);
                closeBlock(frames);
                ObjectNode block = objectMapper.createObjectNode()
                        .put("type", "tool_result")
                        .put("tool_use_id", event.getToolUseId())
                        .put("content", nullToEmpty(event.getText()));
                startBlock(frames, "tool_result", block);
                closeBlock(frames);
            }
            case USAGE -> {
                inputTokens = Math.max(inputTokens, event.getInputTokens());
                outputTokens = Math.max(outputTokens, event.getOutputTokens());
            }
            case STOP -> {
                start(frames);
                closeBlock(frames);
                ObjectNode messageDelta = objectMapper.createObjectNode().put("type", "message_delta");
                messageDelta.putObject("delta")
                        .put("stop_reason", event.getStopReason() == null ? "end_turn" : event.getStopReason())
                        .putNull("stop_sequence");
                messageDelta.putObject("usage").put("output_tokens", outputTokens);
                frame(frames, "message_delta", messageDelta);
                frame(frames, "message_stop", objectMapper.createObjectNode().put("type", "message_stop"));
            }
        }
        return frames.length() == 0 ? NOTHING : frames.toString().getBytes(StandardCharsets.UTF_8);
    }

    private void start(StringBuilder frames) {
        if (started) {
            return;
        }
        started = true;
        ObjectNode messageStart = objectMapper.createObjectNode().put("type", "message_start");
        ObjectNode message = messageStart.putObject("message")
                .put("id", messageId)
                .put("type", "message")
                .put("role", "assistant")
                .put("model", model);
        message.putArray("content");
        message.putNull("stop_reason");
        message.putNull("stop_sequence");
        message.putObject("usage").put("input_tokens", inputTokens).put("output_tokens", 0);
        frame(frames, "message_start", messageStart);
    }

    private void openBlock(StringBuilder frames, String type) {
        if (type.equals(openBlockType)) {
            return;
        }
        closeBlock(frames);
        ObjectNode block = objectMapper.createObjectNode().put("type", type);
        if ("text".equals(type)) {
            block.put("text", "");
        } else {
            block.put("thinking", "");
        }
        startBlock(frames, type, block);
    }

    private void startBlock(StringBuilder frames, String type, ObjectNode block) {
        openBlockType = type;
        ObjectNode blockStart = objectMapper.createObjectNode()
                .put("type", "content_block_start")
                .put("index", nextIndex);
        blockStart.set("content_block", block);
        frame(frames, "content_block_start", blockStart);
    }

    private void closeBlock(StringBuilder frames) {
        if (openBlockType == null) {
            return;
        }
        frame(frames, "content_block_stop", blockEvent("content_block_stop"));
        openBlockType = null;
        nextIndex++;
    }

    private ObjectNode blockEvent(String type) {
        return objectMapper.createObjectNode().put("type", type).put("index", nextIndex);
    }

    private void frame(StringBuilder frames, String eventName, ObjectNode data) {
        frames.append("event: ").append(eventName).append('\n')
                .append("data: ").append(toJson(data)).append("\n\n");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize stream event", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
