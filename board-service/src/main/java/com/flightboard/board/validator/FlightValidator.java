package com.flightboard.board.validator;

import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.exception.FlightBoardValidationException;
import com.flightboard.board.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

public final class FlightValidator {

    private FlightValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlightEntry(FlightEntry entry) {
        if (entry == null) {
            throw new FlightBoardValidationException(ValidationMessages.FLIGHT_DATA_REQUIRED);
        }

        validateOriginDestinationNotSame(entry.getOrigin(), entry.getDestination());

        validateArrivalAfterDeparture(entry.getScheduledDeparture(), entry.getScheduledArrival());

        if (entry.getDelayMinutes() != null && entry.getDelayMinutes() < 0) {
            throw new FlightBoardValidationException(ValidationMessages.DELAY_NON_NEGATIVE);
        }
    }

    public static void validateOriginDestinationNotSame(String origin, String destination) {
        if (origin == null || destination == null) {
            return; // Jakarta @NotBlank handles null checks
        }

        String normalizedOrigin = StringUtils.normalizeCode(origin);
        if (normalizedOrigin != null && normalizedOrigin.equals(StringUtils.normalizeCode(destination))) {
            throw new FlightBoardValidationException(ValidationMessages.ORIGIN_DESTINATION_SAME);
        }
    }

    public static void validateArrivalAfterDeparture(LocalDateTime departure, LocalDateTime arrival) {
        if (departure == null || arrival == null) {
            return; // Jakarta @NotNull handles null checks
        }

        if (!arrival.isAfter(departure)) {
            throw new FlightBoardValidationException(ValidationMessages.ARRIVAL_AFTER_DEPARTURE);
        }
    }

    public static void validateFlightId(Long id) {
        if (id == null) {
            throw new FlightBoardValidationException(ValidationMessages.FLIGHT_ID_REQUIRED);
        }
    }

    public static void validateDate(LocalDate date) {
        if (date == null) {
            throw new FlightBoardValidationException(ValidationMessages.DATE_REQUIRED);
        }
    }
}
