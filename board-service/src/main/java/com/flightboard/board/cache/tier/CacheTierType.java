package com.flightboard.board.cache.tier;

public enum CacheTierType {

    MEMORY("Memory"),
    DISTRIBUTED("Redis");

    private final String label;

    CacheTierType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
