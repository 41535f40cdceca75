package com.flightboard.board.cache.tier;

import com.flightboard.board.cache.CachePattern;
import com.flightboard.board.constants.CacheConstants;
import com.flightboard.board.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;

/**
 * Distributed tier on Redis. All keys live under a fixed prefix so bulk deletes never
 * touch foreign data. Pattern deletes run server side as one SCAN/DEL script.
 */
@Slf4j
public class RedisCacheTier implements CacheTier {

    static final String DEPENDENCY = "redis";

    private static final String SCAN_DELETE_SCRIPT =
            "local cursor = '0' " +
            "local deleted = 0 " +
            "repeat " +
            "  local page = redis.call('SCAN', cursor, 'MATCH', ARGV[1], 'COUNT', ARGV[2]) " +
            "  cursor = page[1] " +
            "  local keys = page[2] " +
            "  for i = 1, #keys, 100 do " +
            "    deleted = deleted + redis.call('DEL', unpack(keys, i, math.min(i + 99, #keys))) " +
            "  end " +
            "until cursor == '0' " +
            "return deleted";

    private static final RedisScript<Long> SCAN_DELETE = new DefaultRedisScript<>(SCAN_DELETE_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCacheTier(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public CacheTierType type() {
        return CacheTierType.DISTRIBUTED;
    }

    @Override
    public TierResult get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(prefixed(key));
            return value != null ? TierResult.hit(value) : TierResult.miss();
        } catch (Exception e) {
            return failed("GET " + key, e);
        }
    }

    @Override
    public TierResult set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(prefixed(key), value, ttl);
            return TierResult.done(1);
        } catch (Exception e) {
            return failed("SET " + key, e);
        }
    }

    @Override
    public TierResult delete(String key) {
        try {
            Boolean deleted = redisTemplate.delete(prefixed(key));
            return TierResult.done(Boolean.TRUE.equals(deleted) ? 1 : 0);
        } catch (Exception e) {
            return failed("DEL " + key, e);
        }
    }

    @Override
    public TierResult deleteByPattern(CachePattern pattern) {
        return scanDelete(keyPrefix + pattern.glob());
    }

    @Override
    public TierResult clear() {
        return scanDelete(keyPrefix + "*");
    }

    @Override
    public TierResult ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            if (!"PONG".equalsIgnoreCase(reply)) {
                return TierResult.failed(new TransientDependencyException(DEPENDENCY,
                        "unexpected PING reply: " + reply, null));
            }
            return TierResult.done(0);
        } catch (Exception e) {
            return failed("PING", e);
        }
    }

    private TierResult scanDelete(String match) {
        try {
            Long deleted = redisTemplate.execute(SCAN_DELETE, Collections.emptyList(),
                    match, String.valueOf(CacheConstants.SCAN_BATCH_SIZE));
            log.debug("Scan-delete completed: match={}, deleted={}", match, deleted);
            return TierResult.done(deleted != null ? deleted : 0);
        } catch (Exception e) {
            return failed("SCAN/DEL " + match, e);
        }
    }

    private String prefixed(String key) {
        return keyPrefix + key;
    }

    private static TierResult failed(String operation, Exception e) {
        return TierResult.failed(new TransientDependencyException(DEPENDENCY, operation + " failed", e));
    }
}
