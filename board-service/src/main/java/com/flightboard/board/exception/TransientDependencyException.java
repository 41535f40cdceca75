package com.flightboard.board.exception;

/**
 * Raised at a dependency boundary (distributed cache, persistent store) when the
 * dependency cannot be reached. Recovered by the caller, never surfaced to clients.
 */
public class TransientDependencyException extends FlightBoardException {

    private static final String ERROR_CODE = "DEPENDENCY_UNAVAILABLE";

    private final String dependency;

    public TransientDependencyException(String dependency, String message, Throwable cause) {
        super(ERROR_CODE, dependency + ": " + message, true, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
