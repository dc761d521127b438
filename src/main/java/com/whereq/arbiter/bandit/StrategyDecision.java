package com.whereq.arbiter.bandit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a {@link SelectionStrategy} picked and how sure it is
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDecision {

    private String runnerKey;

    /**
     * Strategy-specific score of the pick (UCB value, posterior sample, mean reward)
     */
    private double score;

    private double confidence;

    /**
     * True when the pick was made to gather information rather than exploit
     */
    private boolean exploration;

    private String reasoning;
}
