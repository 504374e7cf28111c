package com.agentBridge.agentGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchListResponse {

    @JsonProperty("data")
    private List<MessageBatchResponse> data;

    @JsonProperty("has_more")
    private boolean hasMore;

    @JsonProperty("first_id")
    private String firstId;

    @JsonProperty("last_id")
    private String lastId;
}
