package com.whereq.arbiter.bandit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a bandit selection over a feasible set
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BanditDecision {

    private String runnerKey;

    private double score;

    /**
     * Mean reward of the selected arm at decision time
     */
    private double meanReward;

    private long pulls;

    private double confidence;

    private boolean exploration;

    private String reasoning;
}
