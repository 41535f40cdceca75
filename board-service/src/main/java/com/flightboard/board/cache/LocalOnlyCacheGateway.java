package com.flightboard.board.cache;

import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.statistics.CacheStatisticsTracker;

import java.time.Duration;
import java.util.Optional;

/**
 * Fallback strategy used when no distributed tier is configured or reachable at startup.
 */
public class LocalOnlyCacheGateway extends AbstractCacheGateway {

    public LocalOnlyCacheGateway(CacheTier localTier, CacheStatisticsTracker tracker, CacheValueCodec codec) {
        super(localTier, tracker, codec);
    }

    @Override
    public GatewayMode mode() {
        return GatewayMode.LOCAL_ONLY;
    }

    @Override
    public Optional<CacheTier> distributedTier() {
        return Optional.empty();
    }

    @Override
    protected Optional<String> read(String key) {
        return readLocal(key);
    }

    @Override
    protected void write(String key, String json, Duration ttl) {
        writeLocal(key, json, ttl);
    }

    @Override
    protected void delete(String key) {
        deleteLocal(key);
    }

    @Override
    protected long deleteMatching(CachePattern pattern) {
        return deleteLocalMatching(pattern);
    }

    @Override
    protected void deleteAll() {
        clearLocal();
    }
}
