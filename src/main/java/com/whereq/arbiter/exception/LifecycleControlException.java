package com.whereq.arbiter.exception;

/**
 * Exception thrown when a start or stop command against the compute control plane fails
 */
public class LifecycleControlException extends RuntimeException {
    public LifecycleControlException(String message) {
        super(message);
    }

    public LifecycleControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
