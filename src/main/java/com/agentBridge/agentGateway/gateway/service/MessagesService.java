package com.agentBridge.agentGateway.gateway.service;

import com.agentBridge.agentGateway.backend.EventStream;
import com.agentBridge.agentGateway.backend.model.BackendEvent;
import com.agentBridge.agentGateway.backend.model.BackendResult;
import com.agentBridge.agentGateway.backend.model.Conversation;
import com.agentBridge.agentGateway.backend.model.InvocationOptions;
import com.agentBridge.agentGateway.batch.MessageProcessor;
import com.agentBridge.agentGateway.cancellation.CanceledException;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.gateway.dto.ContentBlock;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;
import com.agentBridge.agentGateway.gateway.dto.Usage;
import com.agentBridge.agentGateway.gateway.util.ConversationMapper;
import com.agentBridge.agentGateway.session.LeasedSession;
import com.agentBridge.agentGateway.session.SessionPool;
import com.agentBridge.agentGateway.streaming.AnthropicSseEncoder;
import com.agentBridge.agentGateway.streaming.BridgedStream;
import com.agentBridge.agentGateway.streaming.MessageMode;
import com.agentBridge.agentGateway.streaming.StreamingResponseBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Message execution on pooled sessions.
 *
 * Responsibilities:
 * - Acquire a session lease (named from {@code x-session-id}, or anonymous)
 * - Invoke the backend under the per-request deadline
 * - Drain the result into a Messages response, or hand the live events to the streaming bridge
 * - Release the lease on every path, which clears the session
 */
@Slf4j
@Service
public class MessagesService implements MessageProcessor {

    private static final String MESSAGE_ID_PREFIX = "msg_";

    private final SessionPool sessionPool;
    private final StreamingResponseBridge streamingBridge;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final MessageMode defaultMessageMode;

    public MessagesService(SessionPool sessionPool,
                           StreamingResponseBridge streamingBridge,
                           ObjectMapper objectMapper,
                           @Value("${gateway.request.timeout:300s}") Duration requestTimeout,
                           @Value("${gateway.streaming.message-mode:forward}") String defaultMessageMode) {
        this.sessionPool = sessionPool;
        this.streamingBridge = streamingBridge;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.defaultMessageMode = MessageMode.fromHeader(defaultMessageMode, MessageMode.FORWARD);
    }

    public MessageMode getDefaultMessageMode() {
        return defaultMessageMode;
    }

    /**
     * Runs a non-streaming message request under the configured request timeout.
     */
    public MessagesResponse createMessage(MessagesRequest request, RequestContext context, MessageMode mode) {
        return execute(request, context, CancellationToken.withDeadline(requestTimeout), mode);
    }

    @Override
    public MessagesResponse process(MessagesRequest request, RequestContext context, CancellationToken cancellation) {
        return execute(request, context, cancellation, defaultMessageMode);
    }

    /**
     * Starts a streaming message request. The lease is released when the returned
     * stream completes or is closed, so the caller must always close it.
     */
    public BridgedStream streamMessage(MessagesRequest request, RequestContext context, MessageMode mode) {
        CancellationToken cancellation = CancellationToken.withDeadline(requestTimeout);
        context.setModel(request.getModel());
        Conversation conversation = ConversationMapper.toConversation(request);

        LeasedSession lease = acquire(context, cancellation);
        try {
            EventStream events = lease.getHandle().invoke(conversation,
                    InvocationOptions.builder().stream(true).cancellation(cancellation).build());
            AnthropicSseEncoder encoder = new AnthropicSseEncoder(objectMapper, generateMessageId(), request.getModel());
            log.debug("Streaming started - requestId: {}, sessionId: {}, mode: {}",
                    context.getRequestId(), lease.getSessionId(), mode);
            return streamingBridge.bridge(events, context, cancellation, mode, encoder, lease);
        } catch (RuntimeException e) {
            lease.close();
            throw failed(context, e);
        }
    }

    private MessagesResponse execute(MessagesRequest request, RequestContext context, CancellationToken cancellation,
                                     MessageMode mode) {
        context.setModel(request.getModel());
        Conversation conversation = ConversationMapper.toConversation(request);

        try (LeasedSession lease = acquire(context, cancellation)) {
            EventStream events = lease.getHandle().invoke(conversation,
                    InvocationOptions.builder().stream(false).cancellation(cancellation).build());
            BackendResult result = BackendResult.collect(events, cancellation);
            context.raiseTokensIn(result.getInputTokens());
            context.raiseTokensOut(result.getOutputTokens());
            log.debug("Message completed - requestId: {}, sessionId: {}, stopReason: {}, tokensOut: {}",
                    context.getRequestId(), lease.getSessionId(), result.getStopReason(), result.getOutputTokens());
            return toResponse(result, request.getModel(), mode);
        } catch (RuntimeException e) {
            throw failed(context, e);
        }
    }

    private LeasedSession acquire(RequestContext context, CancellationToken cancellation) {
        try {
            LeasedSession lease = sessionPool.acquire(context.getSessionId(), cancellation);
            context.setSessionId(lease.getSessionId());
            return lease;
        } catch (RuntimeException e) {
            throw failed(context, e);
        }
    }

    private static RuntimeException failed(RequestContext context, RuntimeException e) {
        if (e instanceof CanceledException) {
            context.markCanceled();
        }
        if (context.getError() == null) {
            context.recordError(e);
        }
        return e;
    }

    MessagesResponse toResponse(BackendResult result, String model, MessageMode mode) {
        List<ContentBlock> content = new ArrayList<>();
        for (BackendEvent block : result.getBlocks()) {
            BackendEvent shaped = mode.apply(block);
            if (shaped == null) {
                continue;
            }
            switch (shaped.getType()) {
                case TEXT -> appendText(content, shaped.getText());
                case THINKING -> content.add(ContentBlock.builder().type("thinking").thinking(shaped.getText()).build());
                case TOOL_USE -> content.add(ContentBlock.builder()
                        .type("tool_use")
                        .id(shaped.getToolUseId())
                        .name(shaped.getToolName())
                        .input(shaped.getToolInput())
                        .build());
                case TOOL_RESULT -> content.add(ContentBlock.builder()
                        .type("tool_result")
                        .toolUseId(shaped.getToolUseId())
                        .content(shaped.getText())
                        .build());
                default -> log.debug("Skipping non-content block - type: {}", shaped.getType());
            }
        }
        return MessagesResponse.builder()
                .id(generateMessageId())
                .content(content)
                .model(model)
                .stopReason(result.getStopReason() == null ? "end_turn" : result.getStopReason())
                .usage(new Usage(result.getInputTokens(), result.getOutputTokens()))
                .build();
    }

    private static void appendText(List<ContentBlock> content, String text) {
        if (!content.isEmpty() && "text".equals(content.get(content.size() - 1).getType())) {
            ContentBlock last = content.get(content.size() - 1);
            last.setText(last.getText() + (text == null ? "" : text));
        } else {
            content.add(ContentBlock.text(text == null ? "" : text));
        }
    }

    static String generateMessageId() {
        return MESSAGE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
