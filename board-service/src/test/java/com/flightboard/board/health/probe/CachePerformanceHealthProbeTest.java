package com.flightboard.board.health.probe;

import com.flightboard.board.cache.tier.CacheTierType;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CachePerformanceHealthProbe")
class CachePerformanceHealthProbeTest {

    private CacheStatisticsTracker tracker;
    private CachePerformanceHealthProbe probe;

    @BeforeEach
    void setUp() {
        tracker = new CacheStatisticsTracker();
        probe = new CachePerformanceHealthProbe(tracker);
    }

    private void record(int hits, int misses) {
        for (int i = 0; i < hits; i++) {
            tracker.recordHit(CacheTierType.MEMORY, 0.1, 10);
        }
        for (int i = 0; i < misses; i++) {
            tracker.recordMiss(CacheTierType.MEMORY, 0.1);
        }
    }

    @Test
    @DisplayName("is healthy before any request")
    void healthyWhenIdle() {
        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("is healthy without warnings at a high hit rate")
    void healthyHighHitRate() {
        record(8, 2);

        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getMetadata()).containsEntry("hitRatePercent", 80.0);
    }

    @Test
    @DisplayName("warns but stays healthy between 50% and 70%")
    void warnsBelowTuningThreshold() {
        record(6, 4);

        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.getWarnings()).singleElement().asString().startsWith("Low cache hit rate");
        assertThat(result.getRecommendations()).containsExactly(CachePerformanceHealthProbe.TTL_RECOMMENDATION);
    }

    @Test
    @DisplayName("is degraded below 50%")
    void degradedBelowHalf() {
        record(4, 6);

        assertThat(probe.check().getStatus()).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    @DisplayName("is unhealthy below 25%")
    void unhealthyBelowQuarter() {
        record(2, 8);

        assertThat(probe.check().getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }
}
