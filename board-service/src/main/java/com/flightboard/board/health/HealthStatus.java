package com.flightboard.board.health;

import java.util.Collection;

public enum HealthStatus {

    HEALTHY(0),
    DEGRADED(1),
    UNHEALTHY(2),
    CRITICAL(3),
    ERROR(3);

    private final int severity;

    HealthStatus(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Still serving traffic, possibly with reduced quality.
     */
    public boolean isOperational() {
        return this == HEALTHY || this == DEGRADED;
    }

    /**
     * Most severe status present; HEALTHY for an empty collection. ERROR and CRITICAL share
     * the top severity, and ERROR wins the tie.
     */
    public static HealthStatus worst(Collection<HealthStatus> statuses) {
        HealthStatus worst = HEALTHY;
        for (HealthStatus status : statuses) {
            if (status.severity > worst.severity || (status.severity == worst.severity && status == ERROR)) {
                worst = status;
            }
        }
        return worst;
    }
}
