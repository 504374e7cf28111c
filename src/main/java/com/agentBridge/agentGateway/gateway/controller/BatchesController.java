package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.batch.BatchJob;
import com.agentBridge.agentGateway.batch.BatchPage;
import com.agentBridge.agentGateway.batch.BatchProcessingEngine;
import com.agentBridge.agentGateway.batch.BatchResults;
import com.agentBridge.agentGateway.gateway.dto.BatchListResponse;
import com.agentBridge.agentGateway.gateway.dto.BatchResultLine;
import com.agentBridge.agentGateway.gateway.dto.CreateBatchRequest;
import com.agentBridge.agentGateway.gateway.dto.DeletedBatchResponse;
import com.agentBridge.agentGateway.gateway.dto.MessageBatchResponse;
import com.agentBridge.agentGateway.gateway.exception.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Message Batches REST controller.
 */
@RestController
@RequestMapping("/v1/messages/batches")
@RequiredArgsConstructor
public class BatchesController {

    static final MediaType JSONL = MediaType.parseMediaType("application/x-jsonl");
    private static final int MAX_LIST_LIMIT = 1000;

    private final BatchProcessingEngine batchEngine;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ResponseEntity<MessageBatchResponse> create(@Valid @RequestBody CreateBatchRequest request) {
        BatchJob job = batchEngine.submit(request.getRequests());
        return ResponseEntity.ok(MessageBatchResponse.from(job));
    }

    @GetMapping
    public ResponseEntity<BatchListResponse> list(
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "after_id", required = false) String afterId,
            @RequestParam(value = "before_id", required = false) String beforeId) {

        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        BatchPage page = batchEngine.list(limit, afterId, beforeId);
        return ResponseEntity.ok(BatchListResponse.builder()
                .data(page.data().stream().map(MessageBatchResponse::from).toList())
                .hasMore(page.hasMore())
                .firstId(page.firstId())
                .lastId(page.lastId())
                .build());
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<MessageBatchResponse> get(@PathVariable("batchId") String batchId) {
        return ResponseEntity.ok(MessageBatchResponse.from(batchEngine.status(batchId)));
    }

    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<MessageBatchResponse> cancel(@PathVariable("batchId") String batchId) {
        return ResponseEntity.ok(MessageBatchResponse.from(batchEngine.cancel(batchId)));
    }

    @DeleteMapping("/{batchId}")
    public ResponseEntity<DeletedBatchResponse> delete(@PathVariable("batchId") String batchId) {
        batchEngine.delete(batchId);
        return ResponseEntity.ok(DeletedBatchResponse.of(batchId));
    }

    /**
     * Results as JSON lines in completion order. Only available once nothing is running.
     */
    @GetMapping("/{batchId}/results")
    public ResponseEntity<String> results(@PathVariable("batchId") String batchId) throws JsonProcessingException {
        BatchJob job = batchEngine.status(batchId);
        if (!job.isFinished()) {
            throw new InvalidRequestException("Batch " + batchId + " is still processing; results are not available yet");
        }
        StringBuilder lines = new StringBuilder();
        BatchResults results = batchEngine.results(batchId);
        while (results.hasNext()) {
            lines.append(objectMapper.writeValueAsString(BatchResultLine.from(results.next()))).append('\n');
        }
        return ResponseEntity.ok().contentType(JSONL).body(lines.toString());
    }
}
