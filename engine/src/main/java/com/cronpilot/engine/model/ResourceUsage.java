package com.cronpilot.engine.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** Post-hoc resource accounting of one run. Stored inline in the runs table. */
@Embeddable
public record ResourceUsage(
        @Column(name = "steps_used", nullable = false)      int  steps,
        @Column(name = "tokens_used", nullable = false)     long tokens,
        @Column(name = "duration_ms", nullable = false)     long durationMs,
        @Column(name = "bandwidth_bytes", nullable = false) long bandwidthBytes
) {
    public static ResourceUsage empty() {
        return new ResourceUsage(0, 0L, 0L, 0L);
    }

    public static ResourceUsage ofDuration(long durationMs) {
        return new ResourceUsage(0, 0L, durationMs, 0L);
    }
}
