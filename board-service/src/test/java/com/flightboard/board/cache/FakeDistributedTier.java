package com.flightboard.board.cache;

import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.cache.tier.CacheTierType;
import com.flightboard.board.cache.tier.TierResult;
import com.flightboard.board.exception.TransientDependencyException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed stand-in for Redis whose availability can be toggled.
 */
class FakeDistributedTier implements CacheTier {

    final Map<String, String> entries = new ConcurrentHashMap<>();
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean down;

    @Override
    public CacheTierType type() {
        return CacheTierType.DISTRIBUTED;
    }

    @Override
    public TierResult get(String key) {
        if (unavailable()) {
            return failure();
        }
        String value = entries.get(key);
        return value != null ? TierResult.hit(value) : TierResult.miss();
    }

    @Override
    public TierResult set(String key, String value, Duration ttl) {
        if (unavailable()) {
            return failure();
        }
        entries.put(key, value);
        return TierResult.done(1);
    }

    @Override
    public TierResult delete(String key) {
        if (unavailable()) {
            return failure();
        }
        return TierResult.done(entries.remove(key) != null ? 1 : 0);
    }

    @Override
    public TierResult deleteByPattern(CachePattern pattern) {
        if (unavailable()) {
            return failure();
        }
        long before = entries.size();
        entries.keySet().removeIf(pattern::matches);
        return TierResult.done(before - entries.size());
    }

    @Override
    public TierResult clear() {
        if (unavailable()) {
            return failure();
        }
        long size = entries.size();
        entries.clear();
        return TierResult.done(size);
    }

    @Override
    public TierResult ping() {
        return unavailable() ? failure() : TierResult.done(0);
    }

    private boolean unavailable() {
        calls.incrementAndGet();
        return down;
    }

    private static TierResult failure() {
        return TierResult.failed(new TransientDependencyException("redis", "connection refused", null));
    }
}
