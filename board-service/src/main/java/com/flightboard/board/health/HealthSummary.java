package com.flightboard.board.health;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HealthSummary {

    @Singular
    List<String> issues;
    @Singular
    List<String> warnings;
    @Singular
    List<String> recommendations;
}
