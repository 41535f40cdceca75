package com.flightboard.board.cache;

public enum GatewayMode {
    DUAL_TIER,
    LOCAL_ONLY
}
