package com.flightboard.board.cache;

import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.cache.tier.TierResult;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads the distributed tier first and back-fills the local tier on a hit. Writes always
 * land locally; a failed distributed call is recorded as a tier failure and the call
 * carries on with the local tier alone.
 */
@Slf4j
public class DualTierCacheGateway extends AbstractCacheGateway {

    private final CacheTier distributedTier;

    public DualTierCacheGateway(CacheTier localTier, CacheTier distributedTier,
                                CacheStatisticsTracker tracker, CacheValueCodec codec) {
        super(localTier, tracker, codec);
        this.distributedTier = distributedTier;
    }

    @Override
    public GatewayMode mode() {
        return GatewayMode.DUAL_TIER;
    }

    @Override
    public Optional<CacheTier> distributedTier() {
        return Optional.of(distributedTier);
    }

    @Override
    protected Optional<String> read(String key) {
        long start = System.nanoTime();
        TierResult result = distributedTier.get(key);
        double latencyMs = elapsedMs(start);

        switch (result.getOutcome()) {
            case HIT -> {
                tracker.recordHit(distributedTier.type(), latencyMs, sizeOf(result.getValue()));
                // write-back; the local tier caps the TTL itself
                localTier.set(key, result.getValue(), null);
                log.debug("Distributed cache hit: key={}", key);
                return Optional.of(result.getValue());
            }
            case MISS -> tracker.recordMiss(distributedTier.type(), latencyMs);
            default -> fallback("get", key, result);
        }
        return readLocal(key);
    }

    @Override
    protected void write(String key, String json, Duration ttl) {
        writeLocal(key, json, ttl);

        long start = System.nanoTime();
        TierResult result = distributedTier.set(key, json, ttl);
        if (result.isFailed()) {
            fallback("set", key, result);
        } else {
            tracker.recordSet(distributedTier.type(), key, elapsedMs(start), sizeOf(json));
        }
    }

    @Override
    protected void delete(String key) {
        deleteLocal(key);

        long start = System.nanoTime();
        TierResult result = distributedTier.delete(key);
        if (result.isFailed()) {
            fallback("remove", key, result);
        } else {
            tracker.recordRemove(distributedTier.type(), key, elapsedMs(start));
        }
    }

    @Override
    protected long deleteMatching(CachePattern pattern) {
        long removedLocally = deleteLocalMatching(pattern);

        long start = System.nanoTime();
        TierResult result = distributedTier.deleteByPattern(pattern);
        if (result.isFailed()) {
            fallback("removeByPattern", pattern.glob(), result);
            return removedLocally;
        }
        tracker.recordPatternRemoval(distributedTier.type(), pattern, result.getAffected(), elapsedMs(start));
        return Math.max(removedLocally, result.getAffected());
    }

    @Override
    protected void deleteAll() {
        clearLocal();

        TierResult result = distributedTier.clear();
        if (result.isFailed()) {
            fallback("clearAll", "*", result);
        }
    }

    private void fallback(String operation, String key, TierResult result) {
        tracker.recordFailure(distributedTier.type());
        log.warn("Distributed cache {} failed for {}, using local cache: {}",
                operation, key, result.getFailure() != null ? result.getFailure().getMessage() : "unknown");
    }
}
