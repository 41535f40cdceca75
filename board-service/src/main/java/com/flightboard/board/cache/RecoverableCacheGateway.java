package com.flightboard.board.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flightboard.board.cache.tier.CacheTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the strategy chosen at startup and lets a later re-probe swap a local-only
 * strategy for a dual-tier one. The swap only ever goes that way.
 */
@Slf4j
public class RecoverableCacheGateway implements CacheGateway {

    private final AtomicReference<CacheGateway> active;

    public RecoverableCacheGateway(CacheGateway initial) {
        this.active = new AtomicReference<>(initial);
        log.info("Cache gateway started in {} mode", initial.mode());
    }

    /**
     * @return true when the gateway was local-only and now uses {@code dualTier}
     */
    public boolean upgrade(CacheGateway dualTier) {
        if (dualTier.mode() != GatewayMode.DUAL_TIER) {
            return false;
        }
        CacheGateway current = active.get();
        if (current.mode() != GatewayMode.LOCAL_ONLY || !active.compareAndSet(current, dualTier)) {
            return false;
        }
        log.info("Cache gateway upgraded from {} to {} mode", current.mode(), dualTier.mode());
        return true;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return active.get().get(key, type);
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return active.get().get(key, type);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        active.get().set(key, value, ttl);
    }

    @Override
    public void remove(String key) {
        active.get().remove(key);
    }

    @Override
    public long removeByPattern(String pattern) {
        return active.get().removeByPattern(pattern);
    }

    @Override
    public void clearAll() {
        active.get().clearAll();
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        return active.get().getOrSet(key, type, ttl, loader);
    }

    @Override
    public <T> T getOrSet(String key, TypeReference<T> type, Duration ttl, Supplier<T> loader) {
        return active.get().getOrSet(key, type, ttl, loader);
    }

    @Override
    public GatewayMode mode() {
        return active.get().mode();
    }

    @Override
    public Optional<CacheTier> distributedTier() {
        return active.get().distributedTier();
    }
}
