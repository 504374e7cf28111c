package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.gateway.dto.ModelInfo;
import com.agentBridge.agentGateway.gateway.dto.ModelListResponse;
import com.agentBridge.agentGateway.gateway.service.ModelCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/models")
@RequiredArgsConstructor
public class ModelsController {

    private final ModelCatalog modelCatalog;

    @GetMapping
    public ResponseEntity<ModelListResponse> list(
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "after_id", required = false) String afterId,
            @RequestParam(value = "before_id", required = false) String beforeId) {
        return ResponseEntity.ok(modelCatalog.list(limit, afterId, beforeId));
    }

    @GetMapping("/{modelId}")
    public ResponseEntity<ModelInfo> get(@PathVariable("modelId") String modelId) {
        return ResponseEntity.ok(modelCatalog.get(modelId));
    }
}
