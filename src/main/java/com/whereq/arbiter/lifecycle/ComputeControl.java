package com.whereq.arbiter.lifecycle;

import reactor.core.publisher.Mono;

/**
 * Start/stop primitives of the control plane hosting the on-demand runner capacity
 */
public interface ComputeControl {

    /**
     * Start the capacity unless it already runs
     *
     * @return Mono with {@link PowerTransition#STARTED} or {@link PowerTransition#ALREADY_RUNNING},
     *         or a {@link com.whereq.arbiter.exception.LifecycleControlException}
     */
    Mono<PowerTransition> start();

    /**
     * Stop the capacity unless it is already stopped
     *
     * @return Mono with {@link PowerTransition#STOPPED} or {@link PowerTransition#ALREADY_STOPPED}
     */
    Mono<PowerTransition> stop();

    /**
     * Raw instance status as reported by the control plane
     */
    Mono<String> status();
}
