package com.flightboard.board.enums;

import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.exception.FlightBoardValidationException;
import org.springframework.util.StringUtils;

import java.util.Locale;

public enum FlightStatus {
    SCHEDULED,
    BOARDING,
    DEPARTED,
    IN_FLIGHT,
    LANDED,
    ARRIVED,
    DELAYED,
    CANCELLED,
    DIVERTED;

    /**
     * Case-insensitive lookup; "in-flight", "In_Flight" and "IN_FLIGHT" are the same status.
     */
    public static FlightStatus parse(String value) {
        if (!StringUtils.hasText(value)) {
            throw new FlightBoardValidationException(ValidationMessages.STATUS_REQUIRED);
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (FlightStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new FlightBoardValidationException(ValidationMessages.STATUS_INVALID + ": " + value);
    }

    public String cacheSegment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
