package com.flightboard.board.tracking;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OperationStats {

    long count;
    long failures;
    double averageMs;
    double minMs;
    double maxMs;
}
