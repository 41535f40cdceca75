package com.flightboard.board.cache.tier;

import com.flightboard.board.cache.CachePattern;

import java.time.Duration;

/**
 * One cache backend. Values are already serialized; keys are already validated.
 * Implementations report failures through {@link TierResult#failed} and never throw.
 */
public interface CacheTier {

    CacheTierType type();

    TierResult get(String key);

    TierResult set(String key, String value, Duration ttl);

    /**
     * @return DONE with affected 1 when the key existed, 0 otherwise
     */
    TierResult delete(String key);

    TierResult deleteByPattern(CachePattern pattern);

    TierResult clear();

    TierResult ping();

    /**
     * Live entry count where the backend can report it cheaply, 0 otherwise.
     */
    default long size() {
        return 0;
    }
}
