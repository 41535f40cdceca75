package com.flightboard.board.statistics;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class StatisticsSnapshot {

    Instant startTime;
    Duration uptime;
    TierStatistics memory;
    TierStatistics distributed;
    TierStatistics combined;
    Map<String, Object> extra;
}
