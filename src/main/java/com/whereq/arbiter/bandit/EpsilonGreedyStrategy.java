package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.ArmStatistics;
import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Epsilon-greedy: with probability epsilon a uniformly random candidate, otherwise the best mean reward.
 * In the greedy branch an unobserved arm always beats an observed one.
 */
@Slf4j
public class EpsilonGreedyStrategy implements SelectionStrategy {

    public static final double DEFAULT_EPSILON = 0.1;

    private final double epsilon;
    private final RandomGenerator random;

    public EpsilonGreedyStrategy() {
        this(DEFAULT_EPSILON, new Well19937c());
    }

    public EpsilonGreedyStrategy(double epsilon, RandomGenerator random) {
        if (epsilon < 0 || epsilon > 1) {
            throw new IllegalArgumentException("Epsilon must be within [0, 1]: " + epsilon);
        }
        this.epsilon = epsilon;
        this.random = random;
    }

    @Override
    public synchronized StrategyDecision select(List<String> candidates, BanditState state, long totalPulls) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(candidates));

        if (random.nextDouble() < epsilon) {
            String key = ordered.get(random.nextInt(ordered.size()));
            log.debug("Epsilon-greedy exploring {} among {}", key, ordered);
            return StrategyDecision.builder()
                .runnerKey(key)
                .score(state.arm(key).map(ArmStatistics::meanReward).orElse(0.0))
                .confidence(1.0 / ordered.size())
                .exploration(true)
                .reasoning(String.format("Random exploration (epsilon=%.2f) picked %s", epsilon, key))
                .build();
        }

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

        // a corrupted (NaN) score never wins, the first key stands in when every score is NaN
        String bestKey = ordered.get(0);
        double best = Double.NEGATIVE_INFINITY;
        double second = Double.NEGATIVE_INFINITY;
        for (String key : ordered) {
            double mean = state.armOrCreate(key).meanReward();
            if (mean > best) {
                second = best;
                best = mean;
                bestKey = key;
            } else if (mean > second) {
                second = mean;
            }
        }

        return StrategyDecision.builder()
            .runnerKey(bestKey)
            .score(best)
            .confidence(Confidence.fromMargin(best, second, ordered.size()))
            .exploration(false)
            .reasoning(String.format("Greedy pick %s with mean reward %.4f over %d pulls",
                bestKey, best, state.pulls(bestKey)))
            .build();
    }

    @Override
    public BanditAlgorithm algorithm() {
        return BanditAlgorithm.EPSILON_GREEDY;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
