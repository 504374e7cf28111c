package com.agentBridge.agentGateway.backend.model;

import com.agentBridge.agentGateway.backend.EventStream;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final result of a backend invocation, obtained by draining its event stream.
 * Used by the non-streaming message path and by batch entries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackendResult {

    /**
     * Non-terminal events in arrival order (text, thinking, tool use, tool result).
     */
    @Builder.Default
    private List<BackendEvent> blocks = new ArrayList<>();

    private long inputTokens;

    private long outputTokens;

    private String stopReason;

    /**
     * Drains the stream until its terminal event, checking the token between pulls.
     * The stream is always closed.
     *
     * @throws BackendUnavailableException if the stream ends without a terminal event
     */
    public static BackendResult collect(EventStream events, CancellationToken cancellation) {
        BackendResult result = new BackendResult();
        long countedOutput = 0;
        try (events) {
            while (true) {
                cancellation.throwIfCancelled();
                if (!events.hasNext()) {
                    throw new BackendUnavailableException("Backend stream ended without a stop event");
                }
                BackendEvent event = events.next();
                switch (event.getType()) {
                    case USAGE -> {
                        result.inputTokens = Math.max(result.inputTokens, event.getInputTokens());
                        result.outputTokens = Math.max(result.outputTokens, event.getOutputTokens());
                    }
                    case STOP -> {
                        result.stopReason = event.getStopReason();
                        result.outputTokens = Math.max(result.outputTokens, countedOutput);
                        return result;
                    }
                    default -> {
                        countedOutput += event.getOutputTokens();
                        result.blocks.add(event);
                    }
                }
            }
        }
    }

    /**
     * @return concatenation of all TEXT blocks
     */
    public String text() {
        StringBuilder text = new StringBuilder();
        for (BackendEvent block : blocks) {
            if (block.getType() == BackendEventType.TEXT && block.getText() != null) {
                text.append(block.getText());
            }
        }
        return text.toString();
    }
}
