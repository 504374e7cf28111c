package com.agentBridge.agentGateway.gateway.dto;

import com.agentBridge.agentGateway.batch.BatchJob;
import com.agentBridge.agentGateway.batch.model.BatchStatus;
import com.agentBridge.agentGateway.batch.model.RequestCounts;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire view of a batch job.
 *
 * {@code processing_status} follows the Messages Batches API: a canceled job
 * whose running entries have not finished yet reports {@code canceling}, every
 * other terminal job reports {@code ended}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageBatchResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    @Builder.Default
    private String type = "message_batch";

    @JsonProperty("processing_status")
    private String processingStatus;

    @JsonProperty("request_counts")
    private RequestCounts requestCounts;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("expires_at")
    private String expiresAt;

    @JsonProperty("ended_at")
    private String endedAt;

    @JsonProperty("cancel_initiated_at")
    private String cancelInitiatedAt;

    @JsonProperty("archived_at")
    private String archivedAt;

    @JsonProperty("results_url")
    private String resultsUrl;

    public static MessageBatchResponse from(BatchJob job) {
        return MessageBatchResponse.builder()
                .id(job.getId())
                .processingStatus(processingStatus(job))
                .requestCounts(job.requestCounts())
                .createdAt(format(job.getCreatedAt()))
                .expiresAt(format(job.getExpiresAt()))
                .endedAt(format(job.getEndedAt()))
                .cancelInitiatedAt(format(job.getCancelInitiatedAt()))
                .resultsUrl(job.isFinished() ? "/v1/messages/batches/" + job.getId() + "/results" : null)
                .build();
    }

    static String processingStatus(BatchJob job) {
        if (job.getStatus() == BatchStatus.IN_PROGRESS) {
            return "in_progress";
        }
        return job.isFinished() ? "ended" : "canceling";
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
