package com.flightboard.board.statistics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Point-in-time statistics of one cache tier, or the derived combination of both.
 */
@Value
@Builder
public class TierStatistics {

    long hits;
    long misses;
    long sets;
    long removes;
    long failures;
    long totalRequests;
    double hitRatePercent;
    double totalLatencyMs;
    long sampleCount;
    double averageLatencyMs;
    double minLatencyMs;
    double maxLatencyMs;
    long currentKeyCount;
    long totalBytesStored;
    long totalBytesRead;

    /**
     * Element-wise sum of two tiers. Latency becomes the sample-weighted average.
     */
    public static TierStatistics combine(TierStatistics a, TierStatistics b) {
        long hits = a.hits + b.hits;
        long misses = a.misses + b.misses;
        long samples = a.sampleCount + b.sampleCount;
        double latency = a.totalLatencyMs + b.totalLatencyMs;

        return TierStatistics.builder()
                .hits(hits)
                .misses(misses)
                .sets(a.sets + b.sets)
                .removes(a.removes + b.removes)
                .failures(a.failures + b.failures)
                .totalRequests(hits + misses)
                .hitRatePercent(hitRate(hits, misses))
                .totalLatencyMs(latency)
                .sampleCount(samples)
                .averageLatencyMs(round(samples > 0 ? latency / samples : 0.0, 2))
                .minLatencyMs(combinedMin(a, b))
                .maxLatencyMs(Math.max(a.maxLatencyMs, b.maxLatencyMs))
                .currentKeyCount(a.currentKeyCount + b.currentKeyCount)
                .totalBytesStored(a.totalBytesStored + b.totalBytesStored)
                .totalBytesRead(a.totalBytesRead + b.totalBytesRead)
                .build();
    }

    /**
     * hits / (hits + misses) * 100, rounded half-up to two decimals; 0 without requests.
     */
    public static double hitRate(long hits, long misses) {
        long total = hits + misses;
        if (total <= 0) {
            return 0.0;
        }
        return round(hits * 100.0 / total, 2);
    }

    static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static double combinedMin(TierStatistics a, TierStatistics b) {
        if (a.sampleCount == 0) {
            return b.minLatencyMs;
        }
        if (b.sampleCount == 0) {
            return a.minLatencyMs;
        }
        return Math.min(a.minLatencyMs, b.minLatencyMs);
    }
}
