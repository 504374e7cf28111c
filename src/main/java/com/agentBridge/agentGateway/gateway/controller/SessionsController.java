package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.session.SessionPool;
import com.agentBridge.agentGateway.session.model.SessionPoolStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session lifecycle over HTTP: open a named session, inspect the pool and
 * close a session explicitly (logout).
 */
@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SessionPool sessionPool;

    @PostMapping
    public ResponseEntity<Map<String, String>> create() {
        String sessionId = sessionPool.open(CancellationToken.create());
        return ResponseEntity.ok(Map.of("session_id", sessionId));
    }

    @GetMapping("/stats")
    public ResponseEntity<SessionPoolStats> stats() {
        return ResponseEntity.ok(sessionPool.stats());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable("sessionId") String sessionId) {
        sessionPool.invalidate(sessionId);

        Map<String, String> response = new LinkedHashMap<>();
        response.put("id", sessionId);
        response.put("type", "session_deleted");
        return ResponseEntity.ok(response);
    }
}
