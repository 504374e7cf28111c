package com.agentBridge.agentGateway.gateway.dto;

import com.agentBridge.agentGateway.batch.BatchEntry;
import com.agentBridge.agentGateway.batch.model.EntryResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the batch results JSONL: {@code {"custom_id":..,"result":{"type":..}}}.
 */
public record BatchResultLine(@JsonProperty("custom_id") String customId, @JsonProperty("result") Result result) {

    public static BatchResultLine from(BatchEntry entry) {
        EntryResult entryResult = entry.getResult();
        ErrorResponse error = entryResult.getErrorType() == null
                ? null
                : ErrorResponse.of(entryResult.getErrorType(), entryResult.getErrorMessage());
        return new BatchResultLine(entry.getCustomId(),
                new Result(entryResult.getType().getValue(), entryResult.getMessage(), error));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(@JsonProperty("type") String type,
                         @JsonProperty("message") MessagesResponse message,
                         @JsonProperty("error") ErrorResponse error) {
    }
}
