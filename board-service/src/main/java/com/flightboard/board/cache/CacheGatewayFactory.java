package com.flightboard.board.cache;

import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.cache.tier.RedisCacheTier;
import com.flightboard.board.cache.tier.TierResult;
import com.flightboard.board.exception.CacheConfigurationException;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Chooses the gateway strategy. The decision is made once per call to {@link #create()};
 * callers hold the returned strategy and never re-check availability.
 */
@Component
@Slf4j
public class CacheGatewayFactory {

    private static final String GLOB_CHARACTERS = "*?[]";

    private final CacheTier localTier;
    private final CacheStatisticsTracker tracker;
    private final CacheValueCodec codec;
    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final boolean distributedEnabled;
    private final String keyPrefix;

    public CacheGatewayFactory(
            @Qualifier("localCacheTier") CacheTier localTier,
            CacheStatisticsTracker tracker,
            CacheValueCodec codec,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            @Value("${board.cache.distributed.enabled:true}") boolean distributedEnabled,
            @Value("${board.cache.distributed.key-prefix:flightboard:}") String keyPrefix) {
        this.localTier = localTier;
        this.tracker = tracker;
        this.codec = codec;
        this.redisTemplateProvider = redisTemplateProvider;
        this.distributedEnabled = distributedEnabled;
        this.keyPrefix = keyPrefix;
    }

    public CacheGateway create() {
        try {
            return createDualTier();
        } catch (CacheConfigurationException e) {
            log.warn("Distributed cache unavailable, using local cache only: {}", e.getMessage());
            return createLocalOnly();
        }
    }

    /**
     * @throws CacheConfigurationException when the distributed tier cannot be used
     */
    public DualTierCacheGateway createDualTier() {
        return new DualTierCacheGateway(localTier, connectDistributedTier(), tracker, codec);
    }

    public LocalOnlyCacheGateway createLocalOnly() {
        return new LocalOnlyCacheGateway(localTier, tracker, codec);
    }

    public boolean isDistributedEnabled() {
        return distributedEnabled;
    }

    private RedisCacheTier connectDistributedTier() {
        if (!distributedEnabled) {
            throw new CacheConfigurationException("distributed cache disabled by configuration");
        }
        validateKeyPrefix();

        StringRedisTemplate redisTemplate;
        try {
            redisTemplate = redisTemplateProvider.getIfAvailable();
        } catch (BeansException e) {
            throw new CacheConfigurationException("invalid Redis settings", e);
        }
        if (redisTemplate == null) {
            throw new CacheConfigurationException("no Redis connection configured");
        }

        RedisCacheTier tier = new RedisCacheTier(redisTemplate, keyPrefix);
        TierResult ping = tier.ping();
        if (ping.isFailed()) {
            throw new CacheConfigurationException("Redis did not answer PING", ping.getFailure());
        }
        log.info("Distributed cache connected: keyPrefix={}", keyPrefix);
        return tier;
    }

    private void validateKeyPrefix() {
        if (!StringUtils.hasText(keyPrefix) || StringUtils.containsWhitespace(keyPrefix)) {
            throw new CacheConfigurationException("key prefix must be non-blank without whitespace");
        }
        for (char c : GLOB_CHARACTERS.toCharArray()) {
            if (keyPrefix.indexOf(c) >= 0) {
                throw new CacheConfigurationException("key prefix must not contain glob characters: " + keyPrefix);
            }
        }
    }
}
