package com.flightboard.board.health;

import java.time.Duration;
import java.util.Optional;

/**
 * One independent health check. Implementations may block and may throw; the aggregator
 * bounds them by {@link #timeout()} and turns any exception into an ERROR result.
 */
public interface HealthProbe {

    String name();

    /**
     * Probe-specific timeout; empty means the configured default.
     */
    default Optional<Duration> timeout() {
        return Optional.empty();
    }

    ProbeResult check() throws Exception;
}
