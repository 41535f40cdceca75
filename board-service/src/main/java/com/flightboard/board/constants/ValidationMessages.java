package com.flightboard.board.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Metric / Event Names ==========

    public static final String METRIC_NAME_REQUIRED = "Metric name is required";
    public static final String METRIC_NAME_TOO_LONG = "Metric name must not exceed 100 characters";
    public static final String METRIC_NAME_INVALID = "Metric name may only contain letters, digits, '_', '.' and '-'";
    public static final String METRIC_VALUE_INVALID = "Metric value must be a finite number";
    public static final String EVENT_NAME_REQUIRED = "Event name is required";
    public static final String EVENT_NAME_TOO_LONG = "Event name must not exceed 100 characters";
    public static final String EVENT_NAME_INVALID = "Event name may only contain letters, digits, '_', '.' and '-'";

    // ========== Tags ==========

    public static final String TOO_MANY_TAGS = "At most 20 tags are allowed";
    public static final String TAG_KEY_REQUIRED = "Tag key is required";
    public static final String TAG_KEY_TOO_LONG = "Tag key must not exceed 50 characters";
    public static final String TAG_VALUE_TOO_LONG = "Tag value must not exceed 200 characters";

    // ========== Cache Keys / Patterns ==========

    public static final String PATTERN_REQUIRED = "Cache pattern is required";
    public static final String PATTERN_TOO_LONG = "Cache pattern must not exceed 200 characters";
    public static final String PATTERN_INVALID = "Cache pattern contains unsupported characters";
    public static final String PATTERN_TOO_BROAD = "Cache pattern must not be a bare wildcard";
    public static final String PATTERN_UNBALANCED = "Cache pattern has an unbalanced character class";
    public static final String PATTERN_BAD_RANGE = "Cache pattern has a character range in descending order";
    public static final String CACHE_KEY_REQUIRED = "Cache key is required";
    public static final String CACHE_KEY_TOO_LONG = "Cache key must not exceed 250 characters";
    public static final String CACHE_KEY_INVALID = "Cache key must not contain whitespace or control characters";
    public static final String CACHE_VALUE_REQUIRED = "Cache value is required";

    // ========== Flights ==========

    public static final String FLIGHT_DATA_REQUIRED = "Flight data is required";
    public static final String FLIGHT_ID_REQUIRED = "Flight ID is required";
    public static final String FLIGHT_NUMBER_REQUIRED = "Flight number is required";
    public static final String AIRLINE_REQUIRED = "Airline is required";
    public static final String ORIGIN_REQUIRED = "Origin is required";
    public static final String DESTINATION_REQUIRED = "Destination is required";
    public static final String ORIGIN_DESTINATION_SAME = "Origin and destination cannot be the same";
    public static final String DEPARTURE_TIME_REQUIRED = "Scheduled departure is required";
    public static final String ARRIVAL_TIME_REQUIRED = "Scheduled arrival is required";
    public static final String ARRIVAL_AFTER_DEPARTURE = "Arrival must be after departure";
    public static final String DELAY_NON_NEGATIVE = "Delay minutes must be non-negative";
    public static final String DATE_REQUIRED = "Date is required";
    public static final String STATUS_REQUIRED = "Status is required";
    public static final String STATUS_INVALID = "Unknown flight status";
}
