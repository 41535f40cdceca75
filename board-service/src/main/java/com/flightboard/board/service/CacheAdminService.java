package com.flightboard.board.service;

import com.flightboard.board.cache.CacheGateway;
import com.flightboard.board.dto.CacheStatisticsResponse;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import com.flightboard.board.tracking.PerformanceTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Operator actions on the cache: analytics, statistics reset and bulk invalidation.
 */
@Service
@Slf4j
public class CacheAdminService {

    private final CacheGateway cacheGateway;
    private final CacheStatisticsTracker statisticsTracker;
    private final PerformanceTracker performanceTracker;
    private final String keyPrefix;

    public CacheAdminService(
            CacheGateway cacheGateway,
            CacheStatisticsTracker statisticsTracker,
            PerformanceTracker performanceTracker,
            @Value("${board.cache.distributed.key-prefix:flightboard:}") String keyPrefix) {
        this.cacheGateway = cacheGateway;
        this.statisticsTracker = statisticsTracker;
        this.performanceTracker = performanceTracker;
        this.keyPrefix = keyPrefix;
    }

    public CacheStatisticsResponse getStatistics() {
        return CacheStatisticsResponse.builder()
                .mode(cacheGateway.mode())
                .keyPrefix(keyPrefix)
                .statistics(statisticsTracker.getSnapshot())
                .build();
    }

    public void resetStatistics() {
        statisticsTracker.reset();
        performanceTracker.trackEvent("cache.statistics.reset");
    }

    public void clearAll() {
        log.warn("Clearing all cache entries: mode={}", cacheGateway.mode());
        cacheGateway.clearAll();
        performanceTracker.trackEvent("cache.cleared");
    }

    /**
     * @return number of keys removed
     */
    public long clearByPattern(String pattern) {
        long removed = cacheGateway.removeByPattern(pattern);
        log.info("Cleared cache by pattern: pattern={}, removed={}", pattern, removed);
        performanceTracker.trackEvent("cache.pattern.cleared");
        return removed;
    }
}
