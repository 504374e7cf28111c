package com.agentBridge.agentGateway.backend.model;

import com.agentBridge.agentGateway.cancellation.CancellationToken;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call options for a backend invocation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvocationOptions {

    /**
     * Whether the caller will consume the result incrementally.
     */
    private boolean stream;

    /**
     * Cancellation signal carrying the per-call deadline.
     */
    @Builder.Default
    private CancellationToken cancellation = CancellationToken.create();
}
