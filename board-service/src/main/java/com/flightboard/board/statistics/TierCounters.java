package com.flightboard.board.statistics;

import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Mutable counters of one tier. Only {@link CacheStatisticsTracker} touches these.
 */
class TierCounters {

    final LongAdder hits = new LongAdder();
    final LongAdder misses = new LongAdder();
    final LongAdder sets = new LongAdder();
    final LongAdder removes = new LongAdder();
    final LongAdder failures = new LongAdder();
    final LongAdder samples = new LongAdder();
    final DoubleAdder totalLatencyMs = new DoubleAdder();
    final DoubleAccumulator minLatencyMs = new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);
    final DoubleAccumulator maxLatencyMs = new DoubleAccumulator(Math::max, 0.0);
    final LongAdder bytesStored = new LongAdder();
    final LongAdder bytesRead = new LongAdder();

    void addLatency(double latencyMs) {
        double sample = Math.max(0.0, latencyMs);
        samples.increment();
        totalLatencyMs.add(sample);
        minLatencyMs.accumulate(sample);
        maxLatencyMs.accumulate(sample);
    }

    void reset() {
        hits.reset();
        misses.reset();
        sets.reset();
        removes.reset();
        failures.reset();
        samples.reset();
        totalLatencyMs.reset();
        minLatencyMs.reset();
        maxLatencyMs.reset();
        bytesStored.reset();
        bytesRead.reset();
    }

    TierStatistics toStatistics(long keyCount) {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long sampleCount = samples.sum();
        double latencySum = totalLatencyMs.sum();

        return TierStatistics.builder()
                .hits(hitCount)
                .misses(missCount)
                .sets(sets.sum())
                .removes(removes.sum())
                .failures(failures.sum())
                .totalRequests(hitCount + missCount)
                .hitRatePercent(TierStatistics.hitRate(hitCount, missCount))
                .totalLatencyMs(latencySum)
                .sampleCount(sampleCount)
                .averageLatencyMs(TierStatistics.round(sampleCount > 0 ? latencySum / sampleCount : 0.0, 2))
                .minLatencyMs(sampleCount > 0 ? minLatencyMs.get() : 0.0)
                .maxLatencyMs(sampleCount > 0 ? maxLatencyMs.get() : 0.0)
                .currentKeyCount(keyCount)
                .totalBytesStored(bytesStored.sum())
                .totalBytesRead(bytesRead.sum())
                .build();
    }
}
