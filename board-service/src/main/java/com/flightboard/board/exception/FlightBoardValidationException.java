package com.flightboard.board.exception;


public class FlightBoardValidationException extends FlightBoardException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public FlightBoardValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
