package com.flightboard.board.constants;

import java.time.Duration;

public final class HealthConstants {

    private HealthConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Probe Names ==========

    public static final String STORE_PROBE = "database";
    public static final String DISTRIBUTED_CACHE_PROBE = "redis";
    public static final String CACHE_PERFORMANCE_PROBE = "cache-performance";
    public static final String SYSTEM_RESOURCE_PROBE = "system-resources";

    // ========== Timing ==========

    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REPORT_TTL = Duration.ofSeconds(30);
    public static final Duration CPU_SAMPLE_WINDOW = Duration.ofMillis(500);

    // ========== Store ==========

    public static final long SLOW_QUERY_THRESHOLD_MS = 1000;
    public static final int CONNECTION_VALIDATION_TIMEOUT_SECONDS = 2;

    // ========== Cache Performance ==========

    public static final double HIT_RATE_DEGRADED_BELOW = 50.0;
    public static final double HIT_RATE_UNHEALTHY_BELOW = 25.0;
    public static final double HIT_RATE_TUNING_BELOW = 70.0;

    // ========== System Resources ==========

    public static final double CPU_CRITICAL_PERCENT = 90.0;
    public static final double CPU_DEGRADED_PERCENT = 75.0;
    public static final long MEMORY_CRITICAL_BYTES = 2_000_000_000L;
    public static final long MEMORY_DEGRADED_BYTES = 1_500_000_000L;
    public static final double DISK_CRITICAL_PERCENT = 95.0;
    public static final double DISK_DEGRADED_PERCENT = 85.0;
}
