package com.agentBridge.agentGateway.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Conversation configuration used when a backend handle is constructed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackendOptions {

    /**
     * Backend model identifier.
     */
    private String model;

    /**
     * System prompt applied to every turn of the conversation.
     * Null means the backend default.
     */
    private String systemPrompt;

    /**
     * Tool allow-list. Empty or null means every tool the backend offers.
     */
    private List<String> allowedTools;

    /**
     * Maximum number of agent turns per invocation.
     */
    private Integer maxTurns;
}
