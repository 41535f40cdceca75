package com.flightboard.board.statistics;

import com.flightboard.board.cache.CachePattern;
import com.flightboard.board.cache.tier.CacheTierType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Process-wide cache statistics, one instance shared by every gateway and probe.
 *
 * Recorders hold the shared side of the lock and update adders, so they never block each
 * other. {@link #getSnapshot()} and {@link #reset()} hold the exclusive side, which makes a
 * snapshot a single observation of both tiers and keeps reset bounded.
 *
 * None of the methods throw: a broken tracker degrades observability, never caching.
 */
@Component
@Slf4j
public class CacheStatisticsTracker {

    private final Map<CacheTierType, TierCounters> counters;
    private final Map<CacheTierType, LongSupplier> keyCounts = new ConcurrentHashMap<>();
    private final ReadWriteLock lock;
    private final Clock clock;

    private volatile Instant startTime;

    public CacheStatisticsTracker() {
        this(Clock.systemUTC());
    }

    CacheStatisticsTracker(Clock clock) {
        Map<CacheTierType, TierCounters> tiers = new EnumMap<>(CacheTierType.class);
        for (CacheTierType tier : CacheTierType.values()) {
            tiers.put(tier, new TierCounters());
        }
        this.counters = Collections.unmodifiableMap(tiers);
        this.lock = new ReentrantReadWriteLock();
        this.clock = clock;
        this.startTime = clock.instant();
    }

    // ========== Recording ==========

    public void recordHit(CacheTierType tier, double latencyMs, long bytes) {
        record(tier, "hit", c -> {
            c.hits.increment();
            c.addLatency(latencyMs);
            c.bytesRead.add(Math.max(0, bytes));
        });
    }

    public void recordMiss(CacheTierType tier, double latencyMs) {
        record(tier, "miss", c -> {
            c.misses.increment();
            c.addLatency(latencyMs);
        });
    }

    public void recordSet(CacheTierType tier, String key, double latencyMs, long bytes) {
        record(tier, "set", c -> {
            c.sets.increment();
            c.addLatency(latencyMs);
            c.bytesStored.add(Math.max(0, bytes));
        });
        log.trace("Cache set tracked: tier={}, key={}", tier, key);
    }

    public void recordRemove(CacheTierType tier, String key, double latencyMs) {
        record(tier, "remove", c -> {
            c.removes.increment();
            c.addLatency(latencyMs);
        });
        log.trace("Cache remove tracked: tier={}, key={}", tier, key);
    }

    public void recordPatternRemoval(CacheTierType tier, CachePattern pattern, long keysAffected, double latencyMs) {
        record(tier, "pattern-remove", c -> {
            c.removes.add(Math.max(0, keysAffected));
            c.addLatency(latencyMs);
        });
        log.info("Pattern removal tracked: tier={}, pattern={}, keys={}, latency={}ms",
                tier, pattern, keysAffected, latencyMs);
    }

    public void recordFailure(CacheTierType tier) {
        record(tier, "failure", c -> c.failures.increment());
    }

    /**
     * Sets where snapshots read the live key count of {@code tier}. Expiry and eviction
     * happen inside the tier, so the count is taken from it rather than from recorded sets.
     */
    public void bindKeyCount(CacheTierType tier, LongSupplier source) {
        keyCounts.put(tier, source);
    }

    // ========== Reading ==========

    public StatisticsSnapshot getSnapshot() {
        Lock exclusive = lock.writeLock();
        exclusive.lock();
        try {
            Instant now = clock.instant();
            Duration uptime = Duration.between(startTime, now);
            TierStatistics memory = counters.get(CacheTierType.MEMORY).toStatistics(keyCount(CacheTierType.MEMORY));
            TierStatistics distributed = counters.get(CacheTierType.DISTRIBUTED)
                    .toStatistics(keyCount(CacheTierType.DISTRIBUTED));

            return StatisticsSnapshot.builder()
                    .startTime(startTime)
                    .uptime(uptime)
                    .memory(memory)
                    .distributed(distributed)
                    .combined(TierStatistics.combine(memory, distributed))
                    .extra(buildExtra(memory, distributed, uptime))
                    .build();
        } finally {
            exclusive.unlock();
        }
    }

    public void reset() {
        Lock exclusive = lock.writeLock();
        exclusive.lock();
        try {
            counters.values().forEach(TierCounters::reset);
            startTime = clock.instant();
        } finally {
            exclusive.unlock();
        }
        log.info("Cache statistics reset");
    }

    // ========== Private ==========

    private void record(CacheTierType tier, String operation, Consumer<TierCounters> update) {
        if (tier == null) {
            return;
        }
        Lock shared = lock.readLock();
        shared.lock();
        try {
            update.accept(counters.get(tier));
        } catch (RuntimeException e) {
            log.debug("Failed to record cache {} for tier {}: {}", operation, tier, e.getMessage());
        } finally {
            shared.unlock();
        }
    }

    private long keyCount(CacheTierType tier) {
        LongSupplier source = keyCounts.get(tier);
        if (source == null) {
            return 0;
        }
        try {
            return Math.max(0, source.getAsLong());
        } catch (RuntimeException e) {
            log.debug("Failed to read key count for tier {}: {}", tier, e.getMessage());
            return 0;
        }
    }

    private Map<String, Object> buildExtra(TierStatistics memory, TierStatistics distributed, Duration uptime) {
        double memoryEfficiency = efficiency(memory, 10.0);
        double distributedEfficiency = efficiency(distributed, 50.0);

        long totalSets = memory.getSets() + distributed.getSets();
        long totalBytes = memory.getTotalBytesStored() + distributed.getTotalBytesStored();
        long totalOps = memory.getTotalRequests() + memory.getSets() + memory.getRemoves()
                + distributed.getTotalRequests() + distributed.getSets() + distributed.getRemoves();
        double seconds = uptime.toMillis() / 1000.0;

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("memoryEfficiency", memoryEfficiency);
        extra.put("distributedEfficiency", distributedEfficiency);
        extra.put("overallEfficiency", TierStatistics.round((memoryEfficiency + distributedEfficiency) / 2, 1));
        extra.put("averageValueSize", TierStatistics.round(totalSets > 0 ? (double) totalBytes / totalSets : 0.0, 1));
        extra.put("operationsPerSecond", TierStatistics.round(seconds > 0 ? totalOps / seconds : 0.0, 2));
        extra.put("tierPreference", tierPreference(memory.getTotalRequests(), distributed.getTotalRequests()));
        return extra;
    }

    // hit rate weighs 70%, speed 30%; speedDivisor ms of average latency costs one point
    private static double efficiency(TierStatistics tier, double speedDivisor) {
        double speedScore = Math.max(0.0, 100.0 - tier.getAverageLatencyMs() / speedDivisor);
        return TierStatistics.round(tier.getHitRatePercent() * 0.7 + speedScore * 0.3, 1);
    }

    private static String tierPreference(long memoryRequests, long distributedRequests) {
        if (memoryRequests > distributedRequests * 2) {
            return "Memory-Heavy";
        }
        if (distributedRequests > memoryRequests * 2) {
            return "Redis-Heavy";
        }
        return "Balanced";
    }
}
