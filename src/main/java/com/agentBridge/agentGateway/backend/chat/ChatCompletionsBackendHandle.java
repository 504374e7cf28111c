package com.agentBridge.agentGateway.backend.chat;

import com.agentBridge.agentGateway.backend.BackendHandle;
import com.agentBridge.agentGateway.backend.EventStream;
import com.agentBridge.agentGateway.backend.chat.dto.ChatCompletionsRequest;
import com.agentBridge.agentGateway.backend.chat.dto.ChatCompletionsResponse;
import com.agentBridge.agentGateway.backend.exception.BackendException;
import com.agentBridge.agentGateway.backend.exception.BackendRejectedException;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import com.agentBridge.agentGateway.backend.model.BackendEvent;
import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.backend.model.Conversation;
import com.agentBridge.agentGateway.backend.model.ConversationMessage;
import com.agentBridge.agentGateway.backend.model.InvocationOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Backend handle that keeps a conversation in process memory and sends it to a
 * chat completions endpoint on every turn.
 *
 * The blocking HTTP call runs on a shared executor so that the caller's
 * cancellation token can abandon it. A conversation that already holds
 * {@code maxTurns} assistant turns, counting both the handle's memory and the
 * history sent by the client, is rejected before the call.
 */
@Slf4j
class ChatCompletionsBackendHandle implements BackendHandle {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final ChatCompletionsClient client;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final BackendOptions options;
    private final Double defaultTemperature;
    private final Integer defaultMaxTokens;

    /**
     * Conversation memory of this handle. Reset by {@link #clear()}.
     */
    private final List<ChatCompletionsRequest.Message> memory = new ArrayList<>();

    private volatile boolean closed;

    ChatCompletionsBackendHandle(ChatCompletionsClient client, ExecutorService executor, ObjectMapper objectMapper,
                                 BackendOptions options, Double defaultTemperature, Integer defaultMaxTokens) {
        this.client = client;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.options = options;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    @Override
    public EventStream invoke(Conversation conversation, InvocationOptions invocation) {
        if (closed) {
            throw new BackendUnavailableException("Backend handle is closed");
        }
        Integer maxTurns = options.getMaxTurns();
        if (maxTurns != null && assistantTurns(conversation) >= maxTurns) {
            throw new BackendRejectedException("turn limit of " + maxTurns + " reached");
        }

        ChatCompletionsRequest request = buildRequest(conversation);
        Future<ChatCompletionsResponse> call = executor.submit(() -> client.complete(request));

        ChatCompletionsResponse response;
        try {
            response = invocation.getCancellation().await(call);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException backendException) {
                throw backendException;
            }
            throw new BackendUnavailableException("Backend call failed: " + cause.getMessage(), cause);
        }

        List<BackendEvent> events = toEvents(response);
        memory.add(ChatCompletionsRequest.Message.builder()
                .role("assistant")
                .content(response.getContent() != null ? response.getContent() : "")
                .build());
        return EventStream.of(events);
    }

    @Override
    public void clear() {
        if (closed) {
            throw new IllegalStateException("Cannot clear a closed backend handle");
        }
        memory.clear();
    }

    @Override
    public void close() {
        closed = true;
        memory.clear();
    }

    int memorySize() {
        return memory.size();
    }

    private long assistantTurns(Conversation conversation) {
        long remembered = memory.stream().filter(message -> "assistant".equals(message.getRole())).count();
        long incoming = conversation.getMessages().stream()
                .filter(message -> "assistant".equals(message.getRole()))
                .count();
        return remembered + incoming;
    }

    private ChatCompletionsRequest buildRequest(Conversation conversation) {
        String systemPrompt = conversation.getSystemPrompt() != null
                ? conversation.getSystemPrompt()
                : options.getSystemPrompt();
        if (memory.isEmpty() && systemPrompt != null && !systemPrompt.isBlank()) {
            memory.add(ChatCompletionsRequest.Message.builder().role("system").content(systemPrompt).build());
        }
        for (ConversationMessage message : conversation.getMessages()) {
            memory.add(ChatCompletionsRequest.Message.builder()
                    .role(message.getRole())
                    .content(message.getText())
                    .build());
        }

        String model = conversation.getModel() != null ? conversation.getModel() : options.getModel();
        return ChatCompletionsRequest.builder()
                .messages(List.copyOf(memory))
                .model(model)
                .temperature(conversation.getTemperature() != null ? conversation.getTemperature() : defaultTemperature)
                .maxCompletionTokens(conversation.getMaxTokens() != null ? conversation.getMaxTokens() : defaultMaxTokens)
                .stream(false)
                .build();
    }

    private List<BackendEvent> toEvents(ChatCompletionsResponse response) {
        List<BackendEvent> events = new ArrayList<>();
        String content = response.getContent();
        if (content != null && !content.isEmpty()) {
            events.add(BackendEvent.text(content));
        }
        for (ChatCompletionsResponse.ToolCall toolCall : response.getToolCalls()) {
            if (toolCall.getFunction() == null) {
                continue;
            }
            String name = toolCall.getFunction().getName();
            if (!isToolAllowed(name)) {
                log.warn("Dropping tool call outside the allow-list - tool: {}", name);
                continue;
            }
            events.add(BackendEvent.toolUse(toolCall.getId(), name, parseArguments(toolCall.getFunction().getArguments())));
        }
        if (response.getUsage() != null) {
            events.add(BackendEvent.usage(
                    nullToZero(response.getUsage().getPromptTokens()),
                    nullToZero(response.getUsage().getCompletionTokens())));
        }
        ChatCompletionsResponse.Choice choice = response.firstChoice();
        events.add(BackendEvent.stop(mapFinishReason(choice != null ? choice.getFinishReason() : null)));
        return events;
    }

    private boolean isToolAllowed(String name) {
        List<String> allowed = options.getAllowedTools();
        return allowed == null || allowed.isEmpty() || allowed.contains(name);
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Tool call arguments are not valid JSON, passing them as raw text");
            return Map.of("raw", arguments);
        }
    }

    private static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return "end_turn";
        }
        return switch (finishReason) {
            case "length" -> "max_tokens";
            case "tool_calls", "function_call" -> "tool_use";
            case "stop" -> "end_turn";
            default -> finishReason;
        };
    }

    private static long nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
