package com.whereq.arbiter.model;

/**
 * How a runner executes jobs
 */
public enum ExecutorClass {
    /**
     * Jobs run in containers (docker executor)
     */
    CONTAINER,

    /**
     * Jobs run directly on a virtual or physical machine (shell executor)
     */
    VM,

    /**
     * Jobs run as pods scheduled by a cluster orchestrator (kubernetes executor)
     */
    ORCHESTRATOR
}
