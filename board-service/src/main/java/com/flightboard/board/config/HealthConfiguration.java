package com.flightboard.board.config;

import com.flightboard.board.health.HealthProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class HealthConfiguration {

    @Value("${board.health.executor-threads:4}")
    private int executorThreads;

    /**
     * Dedicated pool for probe dispatch, never smaller than the probe count so one slow
     * probe cannot queue the others behind it.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthProbeExecutor(List<HealthProbe> probes) {
        int threads = Math.max(executorThreads, probes.size());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "health-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Health probe executor initialized: threads={}, probes={}", threads, probes.size());
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
