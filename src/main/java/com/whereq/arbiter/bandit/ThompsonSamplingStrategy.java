package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.ArmStatistics;
import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.List;
import java.util.TreeSet;

/**
 * Thompson Sampling over job success with a Beta(1, 1) prior.
 *
 * Each arm draws from Beta(1 + successes, 1 + failures) and the highest draw wins.
 * An unobserved arm draws from the uniform prior like any other.
 */
@Slf4j
public class ThompsonSamplingStrategy implements SelectionStrategy {

    private final RandomGenerator random;

    public ThompsonSamplingStrategy() {
        this(new Well19937c());
    }

    public ThompsonSamplingStrategy(long seed) {
        this(new Well19937c(seed));
    }

    public ThompsonSamplingStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public synchronized StrategyDecision select(List<String> candidates, BanditState state, long totalPulls) {
        TreeSet<String> ordered = new TreeSet<>(candidates);

        String bestKey = ordered.first();
        double best = Double.NEGATIVE_INFINITY;
        double second = Double.NEGATIVE_INFINITY;

        for (String key : ordered) {
            ArmStatistics arm = state.armOrCreate(key);
            BetaDistribution posterior = new BetaDistribution(random,
                1.0 + arm.getSuccesses(), 1.0 + arm.getFailures());
            double sample = posterior.sample();
            log.debug("Thompson {}: alpha={} beta={} sample={}",
                key, 1 + arm.getSuccesses(), 1 + arm.getFailures(), sample);

            if (sample > best) {
                second = best;
                best = sample;
                bestKey = key;
            } else if (sample > second) {
                second = sample;
            }
        }

        ArmStatistics chosen = state.armOrCreate(bestKey);
        return StrategyDecision.builder()
            .runnerKey(bestKey)
            .score(best)
            .confidence(Confidence.fromMargin(best, second, ordered.size()))
            .exploration(chosen.getPulls() == 0)
            .reasoning(String.format("Thompson sampling selected %s: sample %.4f, success rate %.2f over %d pulls",
                bestKey, best, chosen.successRate(), chosen.getPulls()))
            .build();
    }

    @Override
    public BanditAlgorithm algorithm() {
        return BanditAlgorithm.THOMPSON;
    }
}
