package com.flightboard.board.cache;

import com.flightboard.board.exception.CacheConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-probes the distributed tier while the gateway runs local-only and switches to
 * dual-tier once Redis answers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DistributedTierRecoveryTask {

    private final RecoverableCacheGateway gateway;
    private final CacheGatewayFactory factory;

    @Scheduled(initialDelayString = "${board.cache.distributed.recovery-interval-ms:300000}",
            fixedDelayString = "${board.cache.distributed.recovery-interval-ms:300000}")
    public void attemptRecovery() {
        if (gateway.mode() == GatewayMode.DUAL_TIER || !factory.isDistributedEnabled()) {
            return;
        }

        try {
            if (gateway.upgrade(factory.createDualTier())) {
                log.info("Distributed cache recovered");
            }
        } catch (CacheConfigurationException e) {
            log.debug("Distributed cache still unavailable: {}", e.getMessage());
        }
    }
}
