package com.whereq.arbiter.exception;

/**
 * Exception thrown when a runner key is not registered in the capability ontology
 */
public class RunnerNotFoundException extends RuntimeException {
    public RunnerNotFoundException(String message) {
        super(message);
    }

    public RunnerNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
