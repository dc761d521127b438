package com.whereq.arbiter.lifecycle;

/**
 * What a start or stop command actually did to the instance
 */
public enum PowerTransition {
    /**
     * Start issued, instance was stopped
     */
    STARTED,

    /**
     * Instance was already running, nothing issued
     */
    ALREADY_RUNNING,

    /**
     * Stop issued, instance was running
     */
    STOPPED,

    /**
     * Instance was already stopped, nothing issued
     */
    ALREADY_STOPPED
}
