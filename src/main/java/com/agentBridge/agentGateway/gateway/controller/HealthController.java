package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.batch.BatchProcessingEngine;
import com.agentBridge.agentGateway.session.SessionPool;
import com.agentBridge.agentGateway.session.model.SessionPoolStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SessionPool sessionPool;
    private final BatchProcessingEngine batchEngine;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        SessionPoolStats pool = sessionPool.stats();

        Map<String, Object> sessions = new LinkedHashMap<>();
        sessions.put("active", pool.getActive());
        sessions.put("idle", pool.getIdle());
        sessions.put("capacity", pool.getCapacity());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", sessionPool.isRunning() ? "healthy" : "stopped");
        response.put("sessions", sessions);
        response.put("batches", batchEngine.stats());
        return ResponseEntity.status(sessionPool.isRunning() ? 200 : 503).body(response);
    }
}
