package com.agentBridge.agentGateway.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Session pool sizing and timing.
 *
 * Released sessions are always cleared; there is no setting for it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionPoolSettings {

    /**
     * Maximum number of pooled sessions, active and idle together.
     */
    @Builder.Default
    private int maxSessions = 100;

    /**
     * Idle time after which an inactive session is evicted.
     */
    @Builder.Default
    private Duration ttl = Duration.ofHours(1);

    /**
     * Interval of the background reaper.
     */
    @Builder.Default
    private Duration cleanupInterval = Duration.ofSeconds(60);

    /**
     * How long an acquire may wait for a busy session or a free slot before failing.
     */
    @Builder.Default
    private Duration acquireTimeout = Duration.ofSeconds(30);
}
