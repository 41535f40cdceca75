package com.flightboard.board.constants;

import java.time.Duration;

public final class CacheConstants {

    private CacheConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Key Templates ==========

    public static final String FLIGHT_KEY = "flight:%d";
    public static final String FLIGHTS_BY_STATUS_KEY = "flights:status:%s";
    public static final String FLIGHTS_BY_DEPARTURE_KEY = "flights:departure:%s";
    public static final String FLIGHTS_BY_ARRIVAL_KEY = "flights:arrival:%s";
    public static final String FLIGHT_LISTS_PATTERN = "flights:*";

    // ========== TTLs ==========

    public static final Duration FLIGHT_TTL = Duration.ofMinutes(15);
    public static final Duration FLIGHT_LIST_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_LOCAL_MAX_TTL = Duration.ofMinutes(5);

    // ========== Limits ==========

    public static final int MAX_KEY_LENGTH = 250;
    public static final int MAX_PATTERN_LENGTH = 200;
    public static final long DEFAULT_LOCAL_MAXIMUM_SIZE = 10_000;
    public static final int SCAN_BATCH_SIZE = 500;
}
