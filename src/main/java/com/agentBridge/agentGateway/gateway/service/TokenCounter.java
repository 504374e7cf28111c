package com.agentBridge.agentGateway.gateway.service;

import com.agentBridge.agentGateway.gateway.dto.CountTokensRequest;
import com.agentBridge.agentGateway.gateway.dto.MessageParam;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Estimates the input tokens of a Messages request without calling the backend.
 *
 * Text counts one token per four characters. Fixed costs:
 * - 4 tokens of role overhead per message, 10 per request
 * - 1000 tokens per image
 * - documents: one token per six characters of base64 data, 1500 without data
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenCounter {

    static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD = 4;
    static final int REQUEST_OVERHEAD = 10;
    static final int IMAGE_TOKENS = 1000;
    static final int DOCUMENT_TOKENS = 1500;
    static final int BASE64_CHARS_PER_TOKEN = 6;

    private final ObjectMapper objectMapper;

    public long count(CountTokensRequest request) {
        long tokens = contentTokens(request.getSystem());
        for (MessageParam message : request.getMessages()) {
            tokens += MESSAGE_OVERHEAD + contentTokens(message.getContent());
        }
        if (request.getTools() != null) {
            for (Map<String, Object> tool : request.getTools()) {
                tokens += toolTokens(tool);
            }
        }
        tokens += REQUEST_OVERHEAD;
        log.debug("Counted tokens - model: {}, messages: {}, tokens: {}",
                request.getModel(), request.getMessages().size(), tokens);
        return tokens;
    }

    static long textTokens(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }

    private long contentTokens(Object content) {
        if (content == null) {
            return 0;
        }
        if (content instanceof String text) {
            return textTokens(text);
        }
        long tokens = 0;
        if (content instanceof List<?> blocks) {
            for (Object block : blocks) {
                if (block instanceof Map<?, ?> map) {
                    tokens += blockTokens(map);
                } else if (block instanceof String text) {
                    tokens += textTokens(text);
                }
            }
        }
        return tokens;
    }

    private long blockTokens(Map<?, ?> block) {
        Object type = block.get("type");
        if (type == null || "text".equals(type)) {
            return textTokens(asString(block.get("text")));
        }
        return switch (type.toString()) {
            case "image" -> IMAGE_TOKENS;
            case "document" -> documentTokens(block.get("source"));
            case "tool_use" -> textTokens(asString(block.get("name"))) + textTokens(toJson(block.get("input")));
            case "tool_result" -> contentTokens(block.get("content"));
            default -> 0;
        };
    }

    private static long documentTokens(Object source) {
        if (source instanceof Map<?, ?> map && map.get("data") instanceof String data && !data.isEmpty()) {
            return data.length() / BASE64_CHARS_PER_TOKEN;
        }
        return DOCUMENT_TOKENS;
    }

    private long toolTokens(Map<String, Object> tool) {
        return textTokens(asString(tool.get("name")))
                + textTokens(asString(tool.get("description")))
                + textTokens(toJson(tool.get("input_schema")));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize value for token counting - error: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    private static String asString(Object value) {
        return value == null ? "" : value.toString();
    }
}
