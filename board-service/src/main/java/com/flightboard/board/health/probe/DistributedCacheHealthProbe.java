package com.flightboard.board.health.probe;

import com.flightboard.board.cache.CacheGateway;
import com.flightboard.board.cache.CacheGatewayFactory;
import com.flightboard.board.cache.tier.CacheTier;
import com.flightboard.board.cache.tier.TierResult;
import com.flightboard.board.constants.HealthConstants;
import com.flightboard.board.health.HealthProbe;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Distributed tier reachability. A missing or unreachable tier only degrades the service,
 * since the gateway keeps serving from the local tier.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class DistributedCacheHealthProbe implements HealthProbe {

    static final String NOT_CONNECTED = "Distributed cache not connected - using local cache only";

    private final CacheGateway cacheGateway;
    private final CacheGatewayFactory gatewayFactory;

    @Override
    public String name() {
        return HealthConstants.DISTRIBUTED_CACHE_PROBE;
    }

    @Override
    public ProbeResult check() {
        long start = System.nanoTime();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("configured", gatewayFactory.isDistributedEnabled());
        metadata.put("mode", cacheGateway.mode().name());

        Optional<CacheTier> tier = cacheGateway.distributedTier();
        if (tier.isEmpty()) {
            metadata.put("connected", false);
            return degraded(start, metadata, null);
        }

        long pingStart = System.nanoTime();
        TierResult ping = tier.get().ping();
        long pingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - pingStart);
        metadata.put("pingMs", pingMs);

        if (ping.isFailed()) {
            metadata.put("connected", false);
            return degraded(start, metadata, ping.getFailure() != null ? ping.getFailure().getMessage() : null);
        }

        metadata.put("connected", true);
        return ProbeResult.builder()
                .name(name())
                .status(HealthStatus.HEALTHY)
                .responseTimeMs(elapsedMs(start))
                .metadata(metadata)
                .message("Distributed cache is reachable")
                .build();
    }

    private ProbeResult degraded(long start, Map<String, Object> metadata, String error) {
        return ProbeResult.builder()
                .name(name())
                .status(HealthStatus.DEGRADED)
                .responseTimeMs(elapsedMs(start))
                .metadata(metadata)
                .error(error)
                .message("Running on local cache only")
                .warning(NOT_CONNECTED)
                .build();
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
