package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Power state of the on-demand capacity as seen by the lifecycle controller.
 * {@code autoStarted == false} means the controller never issues a stop.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleState {

    /**
     * True only when this controller itself started the capacity
     */
    private boolean autoStarted;

    /**
     * A start command is in flight
     */
    private boolean starting;

    private Instant startedAt;

    /**
     * When the idle shutdown fires, null when no shutdown is pending
     */
    private Instant shutdownDeadline;

    public static LifecycleState initial() {
        return new LifecycleState(false, false, null, null);
    }

    public boolean isShutdownPending() {
        return shutdownDeadline != null;
    }
}
