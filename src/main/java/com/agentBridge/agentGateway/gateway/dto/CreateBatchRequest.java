package com.agentBridge.agentGateway.gateway.dto;

import com.agentBridge.agentGateway.batch.model.BatchRequestItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of {@code POST /v1/messages/batches}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateBatchRequest {

    @NotEmpty(message = "requests cannot be empty")
    @Valid
    @JsonProperty("requests")
    private List<BatchRequestItem> requests;
}
