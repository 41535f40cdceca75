package com.flightboard.board.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flightboard.board.cache.tier.CacheTier;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for all cached reads and writes. Distributed-tier failures are contained
 * inside the gateway; only validation errors reach the caller.
 */
public interface CacheGateway {

    <T> Optional<T> get(String key, Class<T> type);

    <T> Optional<T> get(String key, TypeReference<T> type);

    void set(String key, Object value, Duration ttl);

    void remove(String key);

    /**
     * Deletes every key matching the glob in both tiers.
     *
     * @return number of keys removed from the tier that removed the most
     * @throws com.flightboard.board.exception.FlightBoardValidationException for an unsafe pattern
     */
    long removeByPattern(String pattern);

    void clearAll();

    /**
     * Returns the cached value or loads, caches and returns it. Concurrent callers for the
     * same key wait for a single load.
     */
    <T> T getOrSet(String key, Class<T> type, Duration ttl, Supplier<T> loader);

    <T> T getOrSet(String key, TypeReference<T> type, Duration ttl, Supplier<T> loader);

    GatewayMode mode();

    /**
     * The distributed tier this gateway writes through, empty in local-only mode.
     */
    Optional<CacheTier> distributedTier();
}
