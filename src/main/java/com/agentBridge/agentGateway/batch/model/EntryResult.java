package com.agentBridge.agentGateway.batch.model;

import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal (or pending) outcome of one batch entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntryResult {

    private static final EntryResult PENDING = new EntryResult(EntryResultType.PENDING, null, null, null);
    private static final EntryResult CANCELED = new EntryResult(EntryResultType.CANCELED, null, null, null);

    private EntryResultType type;

    /**
     * Set when {@link #type} is SUCCEEDED.
     */
    private MessagesResponse message;

    /**
     * Error type (e.g. {@code api_error}) when {@link #type} is ERRORED.
     */
    private String errorType;

    private String errorMessage;

    public static EntryResult pending() {
        return PENDING;
    }

    public static EntryResult canceled() {
        return CANCELED;
    }

    public static EntryResult succeeded(MessagesResponse message) {
        return new EntryResult(EntryResultType.SUCCEEDED, message, null, null);
    }

    public static EntryResult errored(String errorType, String errorMessage) {
        return new EntryResult(EntryResultType.ERRORED, null, errorType, errorMessage);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
