package com.agentBridge.agentGateway.gateway.service;

import com.agentBridge.agentGateway.gateway.dto.ModelInfo;
import com.agentBridge.agentGateway.gateway.dto.ModelListResponse;
import com.agentBridge.agentGateway.gateway.exception.InvalidRequestException;
import com.agentBridge.agentGateway.gateway.exception.ModelNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Models advertised by the gateway, in configuration order.
 *
 * Responsibilities:
 * - List models with {@code after_id} / {@code before_id} cursors
 * - Resolve aliases to a served model id
 */
@Slf4j
public class ModelCatalog {

    public static final int MAX_LIST_LIMIT = 1000;

    private final List<String> modelIds;
    private final Map<String, String> aliases;
    private final String createdAt;

    public ModelCatalog(List<String> modelIds, Map<String, String> aliases, Instant createdAt) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(modelIds));
        ids.removeIf(id -> id == null || id.isBlank());
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("At least one model must be configured");
        }
        this.modelIds = Collections.unmodifiableList(ids);
        this.aliases = Map.copyOf(aliases);
        this.createdAt = createdAt.toString();
        log.info("Model catalog ready - models: {}, aliases: {}", this.modelIds, this.aliases.keySet());
    }

    /**
     * Parses {@code alias=modelId} entries. Blank entries are skipped.
     */
    public static Map<String, String> parseAliases(List<String> entries) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            int separator = entry.indexOf('=');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new IllegalArgumentException("Model alias must look like alias=modelId: " + entry);
            }
            aliases.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
        }
        return aliases;
    }

    public ModelListResponse list(int limit, String afterId, String beforeId) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        int start = 0;
        if (afterId != null && modelIds.contains(afterId)) {
            start = modelIds.indexOf(afterId) + 1;
        }
        int end = modelIds.size();
        if (beforeId != null && modelIds.contains(beforeId)) {
            end = modelIds.indexOf(beforeId);
        }
        List<ModelInfo> page = new ArrayList<>();
        for (int i = start; i < end && page.size() < limit; i++) {
            page.add(info(modelIds.get(i)));
        }
        return ModelListResponse.builder()
                .data(page)
                .hasMore(start + page.size() < end)
                .firstId(page.isEmpty() ? null : page.get(0).getId())
                .lastId(page.isEmpty() ? null : page.get(page.size() - 1).getId())
                .build();
    }

    /**
     * @throws ModelNotFoundException if the id is neither served nor an alias of a served model
     */
    public ModelInfo get(String modelId) {
        String resolved = aliases.getOrDefault(modelId, modelId);
        if (!modelIds.contains(resolved)) {
            throw new ModelNotFoundException(modelId);
        }
        return info(resolved);
    }

    public List<String> getModelIds() {
        return modelIds;
    }

    private ModelInfo info(String modelId) {
        return ModelInfo.builder()
                .id(modelId)
                .displayName(modelId)
                .createdAt(createdAt)
                .build();
    }
}
