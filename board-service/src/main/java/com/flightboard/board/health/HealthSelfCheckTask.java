package com.flightboard.board.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes the composite report so the memoized copy stays warm, and logs
 * every change of the overall status.
 */
@Component
@Slf4j
public class HealthSelfCheckTask {

    private final HealthAggregator aggregator;
    private final boolean enabled;

    private volatile HealthStatus lastStatus;

    public HealthSelfCheckTask(
            HealthAggregator aggregator,
            @Value("${board.health.self-check.enabled:true}") boolean enabled) {
        this.aggregator = aggregator;
        this.enabled = enabled;
    }

    @Scheduled(initialDelayString = "${board.health.self-check.interval-ms:60000}",
            fixedDelayString = "${board.health.self-check.interval-ms:60000}")
    public void selfCheck() {
        if (!enabled) {
            log.debug("Health self-check disabled, skipping scheduled run");
            return;
        }

        HealthStatus current = aggregator.refresh().getOverallStatus();
        HealthStatus previous = lastStatus;
        lastStatus = current;

        if (previous == null || previous == current) {
            log.debug("Health self-check: status={}", current);
        } else if (current.getSeverity() > previous.getSeverity()) {
            log.warn("Health status changed: {} -> {}", previous, current);
        } else {
            log.info("Health status changed: {} -> {}", previous, current);
        }
    }

    HealthStatus getLastStatus() {
        return lastStatus;
    }
}
