package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One job outcome on one runner. Never stored on its own, only folded into {@link ArmStatistics}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Observation {
    private String runnerKey;
    private boolean success;
    private double durationSeconds;
    private double costPerMinute;
    private Instant timestamp;
}
