package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only diagnostic view of one arm
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunnerStats {
    private long pulls;
    private double meanReward;
    private double successRate;
    private double avgDuration;

    public static RunnerStats of(ArmStatistics stats) {
        return RunnerStats.builder()
            .pulls(stats.getPulls())
            .meanReward(round(stats.meanReward(), 4))
            .successRate(round(stats.successRate(), 4))
            .avgDuration(round(stats.avgDuration(), 2))
            .build();
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
