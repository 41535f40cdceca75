package com.flightboard.board.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder
public class CompositeHealthReport {

    HealthStatus overallStatus;
    Instant timestamp;
    long checkDurationMs;
    List<ProbeResult> probes;
    HealthSummary summary;

    public Optional<ProbeResult> probe(String name) {
        return probes.stream().filter(p -> p.getName().equals(name)).findFirst();
    }
}
