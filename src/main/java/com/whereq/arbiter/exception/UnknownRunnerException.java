package com.whereq.arbiter.exception;

/**
 * Exception thrown when an outcome is reported for a runner the ontology does not know
 */
public class UnknownRunnerException extends RuntimeException {
    public UnknownRunnerException(String message) {
        super(message);
    }

    public UnknownRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
