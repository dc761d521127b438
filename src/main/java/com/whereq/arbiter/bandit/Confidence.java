package com.whereq.arbiter.bandit;

/**
 * Confidence derived from the margin between the best and second-best score
 */
final class Confidence {

    private Confidence() {
    }

    static double fromMargin(double best, double second, int candidates) {
        if (candidates <= 1 || Double.isInfinite(second)) {
            return 1.0;
        }
        if (best <= 0 || Double.isNaN(best)) {
            return 0.0;
        }
        return clamp((best - second) / best);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
