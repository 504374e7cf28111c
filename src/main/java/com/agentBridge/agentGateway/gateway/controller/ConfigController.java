package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.batch.BatchProcessingEngine;
import com.agentBridge.agentGateway.gateway.service.MessagesService;
import com.agentBridge.agentGateway.gateway.service.ModelCatalog;
import com.agentBridge.agentGateway.session.SessionPool;
import com.agentBridge.agentGateway.session.model.SessionPoolStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of the running configuration and of the audit record counters.
 * Credentials and prompts are never included.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ConfigController {

    private final BackendOptions backendOptions;
    private final MessagesService messagesService;
    private final ModelCatalog modelCatalog;
    private final SessionPool sessionPool;
    private final BatchProcessingEngine batchEngine;
    private final LogSink logSink;

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        SessionPoolStats pool = sessionPool.stats();

        Map<String, Object> sessions = new LinkedHashMap<>();
        sessions.put("max_sessions", pool.getCapacity());
        sessions.put("ttl_seconds", pool.getTtlSeconds());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("default_model", backendOptions.getModel());
        response.put("models", modelCatalog.getModelIds());
        response.put("max_turns", backendOptions.getMaxTurns());
        response.put("allowed_tools", backendOptions.getAllowedTools() == null ? List.of() : backendOptions.getAllowedTools());
        response.put("system_prompt_configured", backendOptions.getSystemPrompt() != null
                && !backendOptions.getSystemPrompt().isBlank());
        response.put("message_mode", messagesService.getDefaultMessageMode().name().toLowerCase(Locale.ROOT));
        response.put("sessions", sessions);
        response.put("batch_concurrency", batchEngine.stats().getConcurrency());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/logs/stats")
    public ResponseEntity<Map<String, Object>> logStats() {
        return ResponseEntity.ok(logSink.stats());
    }
}
