package com.flightboard.board.health.probe;

import com.flightboard.board.constants.HealthConstants;
import com.flightboard.board.health.HealthProbe;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import com.flightboard.board.statistics.StatisticsSnapshot;
import com.flightboard.board.statistics.TierStatistics;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Component
@Order(3)
@RequiredArgsConstructor
public class CachePerformanceHealthProbe implements HealthProbe {

    static final String TTL_RECOMMENDATION = "Consider cache TTL optimization";

    private final CacheStatisticsTracker statisticsTracker;

    @Override
    public String name() {
        return HealthConstants.CACHE_PERFORMANCE_PROBE;
    }

    @Override
    public ProbeResult check() {
        long start = System.nanoTime();
        StatisticsSnapshot snapshot = statisticsTracker.getSnapshot();
        TierStatistics combined = snapshot.getCombined();
        double hitRate = combined.getHitRatePercent();

        ProbeResult.ProbeResultBuilder result = ProbeResult.builder()
                .name(name())
                .metadata(metadata(snapshot));

        // an idle cache is not a failing cache
        if (combined.getTotalRequests() == 0) {
            return result.status(HealthStatus.HEALTHY)
                    .responseTimeMs(elapsedMs(start))
                    .message("No cache requests recorded yet")
                    .build();
        }

        HealthStatus status;
        if (hitRate < HealthConstants.HIT_RATE_UNHEALTHY_BELOW) {
            status = HealthStatus.UNHEALTHY;
        } else if (hitRate < HealthConstants.HIT_RATE_DEGRADED_BELOW) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        if (hitRate < HealthConstants.HIT_RATE_TUNING_BELOW) {
            result.warning(String.format("Low cache hit rate: %.2f%%", hitRate))
                    .recommendation(TTL_RECOMMENDATION);
        }

        return result.status(status)
                .responseTimeMs(elapsedMs(start))
                .message(String.format("Cache hit rate %.2f%% over %d requests", hitRate, combined.getTotalRequests()))
                .build();
    }

    private static Map<String, Object> metadata(StatisticsSnapshot snapshot) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("hitRatePercent", snapshot.getCombined().getHitRatePercent());
        metadata.put("totalRequests", snapshot.getCombined().getTotalRequests());
        metadata.put("memoryHitRatePercent", snapshot.getMemory().getHitRatePercent());
        metadata.put("memoryKeys", snapshot.getMemory().getCurrentKeyCount());
        metadata.put("memoryAverageLatencyMs", snapshot.getMemory().getAverageLatencyMs());
        metadata.put("distributedHitRatePercent", snapshot.getDistributed().getHitRatePercent());
        metadata.put("distributedKeys", snapshot.getDistributed().getCurrentKeyCount());
        metadata.put("distributedAverageLatencyMs", snapshot.getDistributed().getAverageLatencyMs());
        metadata.put("distributedFailures", snapshot.getDistributed().getFailures());
        metadata.put("totalBytesStored", snapshot.getCombined().getTotalBytesStored());
        metadata.put("uptimeSeconds", snapshot.getUptime().toSeconds());
        if (snapshot.getExtra() != null) {
            metadata.putAll(snapshot.getExtra());
        }
        return metadata;
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
