package com.flightboard.board.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.cache.tier.TierResult;
import com.flightboard.board.constants.CacheConstants;
import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.exception.FlightBoardValidationException;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import com.flightboard.board.validator.MetricValidator;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Validation, serialization, single-flight loading and local-tier bookkeeping shared by
 * both gateway strategies. Subclasses decide which tiers a call reaches.
 */
@Slf4j
public abstract class AbstractCacheGateway implements CacheGateway {

    protected final CacheTier localTier;
    protected final CacheStatisticsTracker tracker;
    private final CacheValueCodec codec;
    private final ConcurrentMap<String, ReentrantLock> loadLocks = new ConcurrentHashMap<>();

    protected AbstractCacheGateway(CacheTier localTier, CacheStatisticsTracker tracker, CacheValueCodec codec) {
        this.localTier = localTier;
        this.tracker = tracker;
        this.codec = codec;
        tracker.bindKeyCount(localTier.type(), localTier::size);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, codec.typeOf(type));
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, codec.typeOf(type));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        MetricValidator.validateCacheKey(key);
        if (value == null) {
            throw new FlightBoardValidationException(ValidationMessages.CACHE_VALUE_REQUIRED);
        }
        Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : CacheConstants.DEFAULT_TTL;
        codec.encode(key, value).ifPresent(json -> write(key, json, effectiveTtl));
    }

    @Override
    public void remove(String key) {
        MetricValidator.validateCacheKey(key);
        delete(key);
    }

    @Override
    public long removeByPattern(String pattern) {
        CachePattern compiled = CachePattern.of(pattern);
        long removed = deleteMatching(compiled);
        log.info("Removed {} cache entries matching pattern {}", removed, compiled);
        return removed;
    }

    @Override
    public void clearAll() {
        deleteAll();
        log.info("Cleared all cache entries: mode={}", mode());
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        return getOrSet(key, codec.typeOf(type), ttl, loader);
    }

    @Override
    public <T> T getOrSet(String key, TypeReference<T> type, Duration ttl, Supplier<T> loader) {
        return getOrSet(key, codec.typeOf(type), ttl, loader);
    }

    // ========== Strategy ==========

    protected abstract Optional<String> read(String key);

    protected abstract void write(String key, String json, Duration ttl);

    protected abstract void delete(String key);

    protected abstract long deleteMatching(CachePattern pattern);

    protected abstract void deleteAll();

    // ========== Local Tier ==========

    protected Optional<String> readLocal(String key) {
        long start = System.nanoTime();
        TierResult result = localTier.get(key);
        double latencyMs = elapsedMs(start);
        if (result.getOutcome() == TierResult.Outcome.HIT) {
            tracker.recordHit(localTier.type(), latencyMs, sizeOf(result.getValue()));
            log.debug("Local cache hit: key={}", key);
            return Optional.of(result.getValue());
        }
        tracker.recordMiss(localTier.type(), latencyMs);
        log.debug("Local cache miss: key={}", key);
        return Optional.empty();
    }

    protected void writeLocal(String key, String json, Duration ttl) {
        long start = System.nanoTime();
        localTier.set(key, json, ttl);
        tracker.recordSet(localTier.type(), key, elapsedMs(start), sizeOf(json));
    }

    protected void deleteLocal(String key) {
        long start = System.nanoTime();
        localTier.delete(key);
        tracker.recordRemove(localTier.type(), key, elapsedMs(start));
    }

    protected long deleteLocalMatching(CachePattern pattern) {
        long start = System.nanoTime();
        long removed = localTier.deleteByPattern(pattern).getAffected();
        tracker.recordPatternRemoval(localTier.type(), pattern, removed, elapsedMs(start));
        return removed;
    }

    protected void clearLocal() {
        localTier.clear();
    }

    protected static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    protected static long sizeOf(String json) {
        return json == null ? 0 : json.getBytes(StandardCharsets.UTF_8).length;
    }

    // ========== Private ==========

    private <T> Optional<T> get(String key, JavaType type) {
        MetricValidator.validateCacheKey(key);
        return read(key).flatMap(json -> codec.decode(key, json, type));
    }

    private <T> T getOrSet(String key, JavaType type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }

        ReentrantLock keyLock = loadLocks.computeIfAbsent(key, k -> new ReentrantLock());
        keyLock.lock();
        try {
            // another caller may have loaded it while we waited
            cached = get(key, type);
            if (cached.isPresent()) {
                return cached.get();
            }
            T loaded = loader.get();
            if (loaded != null) {
                set(key, loaded, ttl);
            }
            return loaded;
        } finally {
            keyLock.unlock();
            if (!keyLock.hasQueuedThreads()) {
                loadLocks.remove(key, keyLock);
            }
        }
    }
}
