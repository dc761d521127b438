package com.whereq.arbiter.lifecycle;

/**
 * Result of {@link LifecycleController#ensureCapacity()}
 */
public enum CapacityOutcome {
    /**
     * This controller started the capacity
     */
    STARTED,

    /**
     * A previous call already started it or is starting it, nothing issued
     */
    ALREADY_STARTED,

    /**
     * Capacity was running without us, left alone and not adopted
     */
    ALREADY_RUNNING,

    FAILED,

    /**
     * Lifecycle control switched off in configuration
     */
    DISABLED
}
