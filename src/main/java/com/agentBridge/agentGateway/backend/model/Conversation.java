package com.agentBridge.agentGateway.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation passed to {@code BackendHandle.invoke}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

    /**
     * Model requested by the caller (may differ from the handle's default).
     */
    private String model;

    /**
     * Per-request system prompt, overriding the handle's configured prompt.
     */
    private String systemPrompt;

    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    /**
     * Upper bound on generated tokens, null for the backend default.
     */
    private Integer maxTokens;

    private Double temperature;

    /**
     * @return text of the last user message, or an empty string when there is none
     */
    public String lastUserText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if ("user".equals(message.getRole())) {
                return message.getText() == null ? "" : message.getText();
            }
        }
        return "";
    }
}
