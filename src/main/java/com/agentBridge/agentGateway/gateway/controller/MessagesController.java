package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import com.agentBridge.agentGateway.gateway.dto.CountTokensRequest;
import com.agentBridge.agentGateway.gateway.dto.CountTokensResponse;
import com.agentBridge.agentGateway.gateway.dto.ErrorResponse;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;
import com.agentBridge.agentGateway.gateway.exception.ApiError;
import com.agentBridge.agentGateway.gateway.filter.RequestContextFilter;
import com.agentBridge.agentGateway.gateway.service.MessagesService;
import com.agentBridge.agentGateway.gateway.service.TokenCounter;
import com.agentBridge.agentGateway.streaming.BridgedStream;
import com.agentBridge.agentGateway.streaming.MessageMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Messages REST controller - thin HTTP layer over {@link MessagesService}.
 *
 * Non-streaming requests get a JSON message; {@code "stream": true} requests
 * get server-sent events written from the streaming bridge straight to the
 * servlet response on the handling thread.
 */
@Slf4j
@RestController
@RequestMapping("/v1/messages")
@RequiredArgsConstructor
public class MessagesController {

    static final String MESSAGE_MODE_HEADER = "x-sdk-message-mode";

    private final MessagesService messagesService;
    private final TokenCounter tokenCounter;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ResponseEntity<MessagesResponse> createMessage(
            @Valid @RequestBody MessagesRequest request,
            @RequestHeader(value = MESSAGE_MODE_HEADER, required = false) String messageModeHeader,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse) throws IOException {

        RequestContext context = RequestContextFilter.contextOf(httpRequest);
        MessageMode mode = MessageMode.fromHeader(messageModeHeader, messagesService.getDefaultMessageMode());

        if (!request.isStreaming()) {
            return ResponseEntity.ok(messagesService.createMessage(request, context, mode));
        }

        BridgedStream stream = messagesService.streamMessage(request, context, mode);
        httpResponse.setStatus(HttpServletResponse.SC_OK);
        httpResponse.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
        httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());
        httpResponse.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        writeEvents(stream, context, httpResponse.getOutputStream());
        return null;
    }

    @PostMapping("/count_tokens")
    public ResponseEntity<CountTokensResponse> countTokens(@Valid @RequestBody CountTokensRequest request) {
        return ResponseEntity.ok(new CountTokensResponse(tokenCounter.count(request)));
    }

    /**
     * Copies chunks to the client. A write failure means the client went away;
     * closing the stream then records the disconnect and releases the session.
     */
    void writeEvents(BridgedStream stream, RequestContext context, OutputStream out) throws IOException {
        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(context); stream) {
            try {
                while (stream.hasNext()) {
                    out.write(stream.next());
                    out.flush();
                }
            } catch (RuntimeException e) {
                log.warn("Stream failed - requestId: {}, error: {}", context.getRequestId(), e.getMessage());
                writeErrorEvent(out, e);
            }
        }
    }

    private void writeErrorEvent(OutputStream out, RuntimeException error) throws IOException {
        ApiError apiError = ApiError.of(error);
        String message = apiError == ApiError.INTERNAL ? "An unexpected error occurred" : error.getMessage();
        String frame = "event: error\ndata: "
                + objectMapper.writeValueAsString(ErrorResponse.of(apiError.getType(), message)) + "\n\n";
        out.write(frame.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
