package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.ArmStatistics;
import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.TreeSet;

/**
 * Upper Confidence Bound (UCB1).
 *
 * Arms with no pulls are tried first, lowest runner key wins. Otherwise the arm maximising
 * {@code mean + c * sqrt(ln(t) / pulls)} is picked; ties go to the lowest runner key.
 */
@Slf4j
public class Ucb1Strategy implements SelectionStrategy {

    public static final double DEFAULT_EXPLORATION_CONSTANT = 2.0;

    private final double explorationConstant;

    public Ucb1Strategy() {
        this(DEFAULT_EXPLORATION_CONSTANT);
    }

    public Ucb1Strategy(double explorationConstant) {
        if (explorationConstant < 0) {
            throw new IllegalArgumentException("Exploration constant must be >= 0: " + explorationConstant);
        }
        this.explorationConstant = explorationConstant;
    }

    @Override
    public StrategyDecision select(List<String> candidates, BanditState state, long totalPulls) {
        TreeSet<String> ordered = new TreeSet<>(candidates);

        for (String key : ordered) {
            if (state.pulls(key) == 0) {
                return StrategyDecision.builder()
                    .runnerKey(key)
                    .score(Double.POSITIVE_INFINITY)
                    .confidence(0.5)
                    .exploration(true)
                    .reasoning("Exploring " + key + " (no observations yet)")
                    .build();
            }
        }

        double logT = Math.log(Math.max(1L, totalPulls));
        // a corrupted (NaN) score never wins, the first key stands in when every score is NaN
        String bestKey = ordered.first();
        double best = Double.NEGATIVE_INFINITY;
        double second = Double.NEGATIVE_INFINITY;

        for (String key : ordered) {
            ArmStatistics arm = state.armOrCreate(key);
            double bonus = explorationConstant * Math.sqrt(logT / arm.getPulls());
            double ucb = arm.meanReward() + bonus;
            log.debug("UCB1 {}: mean={} bonus={} ucb={}", key, arm.meanReward(), bonus, ucb);

            // strict comparison keeps the lowest key on ties
            if (ucb > best) {
                second = best;
                best = ucb;
                bestKey = key;
            } else if (ucb > second) {
                second = ucb;
            }
        }

        ArmStatistics chosen = state.armOrCreate(bestKey);
        return StrategyDecision.builder()
            .runnerKey(bestKey)
            .score(best)
            .confidence(Confidence.fromMargin(best, second, ordered.size()))
            .exploration(false)
            .reasoning(String.format("UCB1 selected %s: mean reward %.4f over %d pulls, UCB %.4f (t=%d, c=%.2f)",
                bestKey, chosen.meanReward(), chosen.getPulls(), best, totalPulls, explorationConstant))
            .build();
    }

    @Override
    public BanditAlgorithm algorithm() {
        return BanditAlgorithm.UCB1;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }
}
