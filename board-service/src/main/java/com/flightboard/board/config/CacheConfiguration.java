package com.flightboard.board.config;

import com.flightboard.board.cache.CacheGatewayFactory;
import com.flightboard.board.cache.RecoverableCacheGateway;
import com.flightboard.board.cache.tier.LocalCacheTier;
import com.flightboard.board.constants.CacheConstants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfiguration {

    @Value("${board.cache.local.maximum-size:" + CacheConstants.DEFAULT_LOCAL_MAXIMUM_SIZE + "}")
    private long localMaximumSize;

    @Value("${board.cache.local.max-ttl:PT5M}")
    private Duration localMaxTtl;

    @Bean
    public LocalCacheTier localCacheTier() {
        return new LocalCacheTier(localMaximumSize, localMaxTtl);
    }

    @Bean
    public RecoverableCacheGateway cacheGateway(CacheGatewayFactory factory) {
        return new RecoverableCacheGateway(factory.create());
    }
}
