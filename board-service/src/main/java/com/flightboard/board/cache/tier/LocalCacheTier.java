package com.flightboard.board.cache.tier;

import com.flightboard.board.cache.CachePattern;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process tier backed by Caffeine. Every entry carries its own TTL, capped by
 * {@code maxTtl} so the local copy never outlives the distributed one by much.
 */
@Slf4j
public class LocalCacheTier implements CacheTier {

    private final Cache<String, CacheEntry> cache;
    private final Duration maxTtl;

    public LocalCacheTier(long maximumSize, Duration maxTtl) {
        this(maximumSize, maxTtl, Ticker.systemTicker());
    }

    LocalCacheTier(long maximumSize, Duration maxTtl, Ticker ticker) {
        this.maxTtl = maxTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
        log.info("Local cache tier initialized: maximumSize={}, maxTtl={}", maximumSize, maxTtl);
    }

    @Override
    public CacheTierType type() {
        return CacheTierType.MEMORY;
    }

    @Override
    public TierResult get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        return entry != null ? TierResult.hit(entry.getValue()) : TierResult.miss();
    }

    @Override
    public TierResult set(String key, String value, Duration ttl) {
        cache.put(key, new CacheEntry(key, value, cap(ttl), CacheTierType.MEMORY));
        return TierResult.done(1);
    }

    @Override
    public TierResult delete(String key) {
        return TierResult.done(cache.asMap().remove(key) != null ? 1 : 0);
    }

    @Override
    public TierResult deleteByPattern(CachePattern pattern) {
        ConcurrentMap<String, CacheEntry> entries = cache.asMap();
        long removed = 0;
        for (String key : entries.keySet()) {
            if (pattern.matches(key) && entries.remove(key) != null) {
                removed++;
            }
        }
        return TierResult.done(removed);
    }

    @Override
    public TierResult clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        return TierResult.done(size);
    }

    @Override
    public TierResult ping() {
        return TierResult.done(0);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    Duration cap(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative() || ttl.compareTo(maxTtl) > 0) {
            return maxTtl;
        }
        return ttl;
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
