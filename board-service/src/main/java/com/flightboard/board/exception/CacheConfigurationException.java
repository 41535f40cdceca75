package com.flightboard.board.exception;

/**
 * Distributed cache settings are missing or malformed. Only ever raised during startup
 * strategy selection, where it resolves to local-only mode.
 */
public class CacheConfigurationException extends FlightBoardException {

    private static final String ERROR_CODE = "CACHE_CONFIGURATION";

    public CacheConfigurationException(String message) {
        super(ERROR_CODE, message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
