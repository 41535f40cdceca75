package com.flightboard.board.exception;

import java.time.Duration;

/**
 * A health probe did not complete within its timeout.
 */
public class ProbeTimeoutException extends FlightBoardException {

    private static final String ERROR_CODE = "PROBE_TIMEOUT";

    public ProbeTimeoutException(String probeName, Duration timeout) {
        super(ERROR_CODE, "Probe " + probeName + " timed out after " + timeout.toMillis() + "ms", true);
    }
}
