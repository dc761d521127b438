package com.whereq.arbiter.bandit;

/**
 * Converts a job outcome into a bandit reward.
 *
 * A failed job earns nothing. A successful job earns the inverse of its duration in minutes
 * plus its cost ({@code costPerMinute * durationMinutes}), so faster and cheaper runs score higher.
 */
public final class RewardFunction {

    /**
     * Keeps the reward finite for zero-length jobs
     */
    static final double SMOOTHING = 0.1;

    private RewardFunction() {
    }

    public static double reward(boolean success, double durationSeconds, double costPerMinute) {
        if (!success) {
            return 0.0;
        }
        double durationMinutes = Math.max(0.0, durationSeconds) / 60.0;
        double costPenalty = Math.max(0.0, costPerMinute) * durationMinutes;
        return 1.0 / (durationMinutes + costPenalty + SMOOTHING);
    }
}
