package com.flightboard.board.tracking;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class PerformanceSummary {

    Instant startTime;
    Duration uptime;
    Map<String, Double> metrics;
    Map<String, Long> events;
    Map<String, OperationStats> operations;
    long totalOperations;
    double overallAverageMs;
    /**
     * 0-100; each operation scores on average latency and on its min/max spread.
     */
    double performanceHealthScore;
}
