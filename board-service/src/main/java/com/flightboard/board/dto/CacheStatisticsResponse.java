package com.flightboard.board.dto;

import com.flightboard.board.cache.GatewayMode;
import com.flightboard.board.statistics.StatisticsSnapshot;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStatisticsResponse {

    GatewayMode mode;
    String keyPrefix;
    StatisticsSnapshot statistics;
}
