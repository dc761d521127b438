package com.whereq.arbiter.exception;

/**
 * Exception thrown when the bandit state backend cannot be read or written
 */
public class StatePersistenceException extends RuntimeException {
    public StatePersistenceException(String message) {
        super(message);
    }

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
