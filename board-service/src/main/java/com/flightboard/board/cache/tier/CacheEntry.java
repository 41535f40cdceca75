package com.flightboard.board.cache.tier;

import lombok.Value;

import java.time.Duration;

@Value
public class CacheEntry {
    String key;
    String value;
    Duration ttl;
    CacheTierType tier;
}
