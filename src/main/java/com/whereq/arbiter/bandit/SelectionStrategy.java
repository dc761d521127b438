package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.BanditState;

import java.util.List;

/**
 * Chooses one runner among feasible candidates using accumulated arm statistics
 */
public interface SelectionStrategy {

    /**
     * Pick a runner
     *
     * @param candidates feasible runner keys, never empty
     * @param state current arm statistics, arms may be missing for new runners
     * @param totalPulls total pulls over all registered arms
     * @return the decision
     */
    StrategyDecision select(List<String> candidates, BanditState state, long totalPulls);

    BanditAlgorithm algorithm();
}
