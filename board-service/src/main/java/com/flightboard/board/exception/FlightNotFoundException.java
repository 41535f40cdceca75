package com.flightboard.board.exception;

/**
 * Thrown when a requested flight does not exist.
 */
public class FlightNotFoundException extends FlightBoardException {

    private static final String ERROR_CODE = "FLIGHT_NOT_FOUND";

    public FlightNotFoundException(Long id) {
        super(ERROR_CODE, "Flight not found: " + id);
    }
}
