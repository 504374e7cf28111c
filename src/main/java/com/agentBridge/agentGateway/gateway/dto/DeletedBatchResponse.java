package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeletedBatchResponse(@JsonProperty("id") String id, @JsonProperty("type") String type) {

    public static DeletedBatchResponse of(String id) {
        return new DeletedBatchResponse(id, "message_batch_deleted");
    }
}
