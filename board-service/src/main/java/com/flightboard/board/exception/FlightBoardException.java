package com.flightboard.board.exception;

import lombok.Getter;


@Getter
public class FlightBoardException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public FlightBoardException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public FlightBoardException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public FlightBoardException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, false, cause);
    }

    public FlightBoardException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
