package com.agentBridge.agentGateway.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message of a conversation handed to the backend ("user" or "assistant").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationMessage {

    private String role;

    private String text;
}
