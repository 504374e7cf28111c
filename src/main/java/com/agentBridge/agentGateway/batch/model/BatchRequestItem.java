package com.agentBridge.agentGateway.batch.model;

import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One request of a batch submission: a caller-chosen id plus the Messages params.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRequestItem {

    @NotBlank(message = "custom_id cannot be blank")
    @Size(max = 64, message = "custom_id must be at most 64 characters")
    @JsonProperty("custom_id")
    private String customId;

    @NotNull(message = "params is required")
    @Valid
    @JsonProperty("params")
    private MessagesRequest params;
}
