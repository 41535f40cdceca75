package com.flightboard.board.health;

import com.flightboard.board.exception.FlightBoardException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ProbeResult {

    String name;
    HealthStatus status;
    long responseTimeMs;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
    String error;
    String errorCode;
    String message;
    @Singular
    List<String> warnings;
    @Singular
    List<String> recommendations;

    public static ProbeResult error(String name, long responseTimeMs, String error) {
        return ProbeResult.builder()
                .name(name)
                .status(HealthStatus.ERROR)
                .responseTimeMs(responseTimeMs)
                .error(error)
                .build();
    }

    /**
     * ERROR result that also carries the code and message of {@code cause}.
     */
    public static ProbeResult error(String name, long responseTimeMs, String error, FlightBoardException cause) {
        return error(name, responseTimeMs, error).toBuilder()
                .errorCode(cause.getErrorCode())
                .message(cause.getMessage())
                .build();
    }
}
