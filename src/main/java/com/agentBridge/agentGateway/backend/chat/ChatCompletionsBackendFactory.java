package com.agentBridge.agentGateway.backend.chat;

import com.agentBridge.agentGateway.backend.BackendFactory;
import com.agentBridge.agentGateway.backend.BackendHandle;
import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;

/**
 * Creates {@link BackendHandle}s backed by a chat completions endpoint.
 * All handles share one HTTP client and one executor for blocking calls.
 */
@Slf4j
public class ChatCompletionsBackendFactory implements BackendFactory {

    private final ChatCompletionsClient client;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Double temperature;
    private final Integer maxCompletionTokens;

    public ChatCompletionsBackendFactory(ChatCompletionsClient client, ExecutorService executor, ObjectMapper objectMapper,
                                         Double temperature, Integer maxCompletionTokens) {
        this.client = client;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }

    @Override
    public BackendHandle create(BackendOptions options) {
        log.debug("Creating chat completions handle - model: {}, maxTurns: {}, allowedTools: {}",
                options.getModel(), options.getMaxTurns(), options.getAllowedTools());
        return new ChatCompletionsBackendHandle(client, executor, objectMapper, options, temperature, maxCompletionTokens);
    }
}
