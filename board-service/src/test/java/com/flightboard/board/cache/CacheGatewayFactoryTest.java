package com.flightboard.board.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightboard.board.cache.tier.LocalCacheTier;
import com.flightboard.board.exception.CacheConfigurationException;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CacheGatewayFactory")
class CacheGatewayFactoryTest {

    @Mock
    private ObjectProvider<StringRedisTemplate> redisTemplateProvider;

    @Mock
    private StringRedisTemplate redisTemplate;

    private CacheGatewayFactory factory(boolean enabled, String keyPrefix) {
        return new CacheGatewayFactory(
                new LocalCacheTier(100, Duration.ofMinutes(5)),
                new CacheStatisticsTracker(),
                new CacheValueCodec(new ObjectMapper()),
                redisTemplateProvider,
                enabled,
                keyPrefix);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("chooses dual-tier when Redis answers PING")
        @SuppressWarnings("unchecked")
        void dualTierWhenReachable() {
            when(redisTemplateProvider.getIfAvailable()).thenReturn(redisTemplate);
            when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

            CacheGateway gateway = factory(true, "flightboard:").create();

            assertThat(gateway.mode()).isEqualTo(GatewayMode.DUAL_TIER);
            assertThat(gateway.distributedTier()).isPresent();
        }

        @Test
        @DisplayName("falls back to local-only when Redis is unreachable")
        @SuppressWarnings("unchecked")
        void localOnlyWhenUnreachable() {
            when(redisTemplateProvider.getIfAvailable()).thenReturn(redisTemplate);
            when(redisTemplate.execute(any(RedisCallback.class)))
                    .thenThrow(new RedisConnectionFailureException("connection refused"));

            assertThat(factory(true, "flightboard:").create().mode()).isEqualTo(GatewayMode.LOCAL_ONLY);
        }

        @Test
        @DisplayName("falls back to local-only when no Redis connection is configured")
        void localOnlyWithoutTemplate() {
            when(redisTemplateProvider.getIfAvailable()).thenReturn(null);

            assertThat(factory(true, "flightboard:").create().mode()).isEqualTo(GatewayMode.LOCAL_ONLY);
        }

        @Test
        @DisplayName("falls back to local-only when Redis settings are invalid")
        void localOnlyWithInvalidSettings() {
            when(redisTemplateProvider.getIfAvailable()).thenThrow(new BeanCreationException("redisConnectionFactory"));

            assertThat(factory(true, "flightboard:").create().mode()).isEqualTo(GatewayMode.LOCAL_ONLY);
        }

        @Test
        @DisplayName("does not contact Redis when disabled")
        void disabledSkipsRedis() {
            assertThat(factory(false, "flightboard:").create().mode()).isEqualTo(GatewayMode.LOCAL_ONLY);
            verify(redisTemplateProvider, never()).getIfAvailable();
        }
    }

    @Nested
    @DisplayName("createDualTier")
    class CreateDualTier {

        @Test
        @DisplayName("rejects key prefixes with glob characters")
        void rejectsGlobPrefix() {
            assertThatThrownBy(() -> factory(true, "flight*").createDualTier())
                    .isInstanceOf(CacheConfigurationException.class)
                    .hasMessageContaining("glob");
        }

        @Test
        @DisplayName("rejects blank key prefixes")
        void rejectsBlankPrefix() {
            assertThatThrownBy(() -> factory(true, " ").createDualTier())
                    .isInstanceOf(CacheConfigurationException.class);
        }

        @Test
        @DisplayName("throws when disabled")
        void throwsWhenDisabled() {
            assertThatThrownBy(() -> factory(false, "flightboard:").createDualTier())
                    .isInstanceOf(CacheConfigurationException.class)
                    .hasMessageContaining("disabled");
        }
    }
}
