package com.agentBridge.agentGateway.gateway.util;

import com.agentBridge.agentGateway.backend.model.Conversation;
import com.agentBridge.agentGateway.backend.model.ConversationMessage;
import com.agentBridge.agentGateway.gateway.dto.MessageParam;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.agentBridge.agentGateway.gateway.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps Anthropic Messages requests to backend conversations.
 *
 * Text blocks are kept as text, tool results are flattened to their text
 * content, other block types (images, documents) are dropped.
 */
public final class ConversationMapper {

    private ConversationMapper() {
    }

    public static Conversation toConversation(MessagesRequest request) {
        List<ConversationMessage> messages = new ArrayList<>();
        for (MessageParam message : request.getMessages()) {
            String role = message.getRole();
            if (!"user".equals(role) && !"assistant".equals(role)) {
                throw new InvalidRequestException("Unsupported message role: " + role);
            }
            messages.add(new ConversationMessage(role, contentText(message.getContent())));
        }
        return Conversation.builder()
                .model(request.getModel())
                .systemPrompt(request.getSystem() == null ? null : contentText(request.getSystem()))
                .messages(messages)
                .maxTokens(request.getMaxTokens())
                .temperature(request.getTemperature())
                .build();
    }

    /**
     * Flattens a string or a list of content blocks into plain text.
     */
    public static String contentText(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof List<?> blocks) {
            StringBuilder text = new StringBuilder();
            for (Object block : blocks) {
                String part = blockText(block);
                if (part.isEmpty()) {
                    continue;
                }
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(part);
            }
            return text.toString();
        }
        throw new InvalidRequestException("content must be a string or a list of content blocks");
    }

    private static String blockText(Object block) {
        if (block instanceof String text) {
            return text;
        }
        if (!(block instanceof Map<?, ?> map)) {
            return "";
        }
        Object type = map.get("type");
        if ("text".equals(type)) {
            Object text = map.get("text");
            return text == null ? "" : text.toString();
        }
        if ("tool_result".equals(type)) {
            return contentText(map.get("content"));
        }
        return "";
    }
}
