package com.whereq.arbiter.exception;

/**
 * Exception thrown when the fleet status feed cannot be queried
 */
public class AvailabilityProbeException extends RuntimeException {
    public AvailabilityProbeException(String message) {
        super(message);
    }

    public AvailabilityProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
