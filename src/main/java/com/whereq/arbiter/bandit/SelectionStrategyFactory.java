package com.whereq.arbiter.bandit;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.model.BanditAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

/**
 * Factory for the configured arm selection strategy
 */
@Slf4j
@Service
public class SelectionStrategyFactory {

    private final ArbiterProperties.BanditConfig config;

    public SelectionStrategyFactory(ArbiterProperties properties) {
        this.config = properties.getBandit();
    }

    /**
     * Build the strategy named in {@code arbiter.bandit.algorithm}
     */
    public SelectionStrategy create() {
        return create(config.getAlgorithm());
    }

    /**
     * Build a strategy for the given algorithm, seeded when {@code arbiter.bandit.seed} is set
     *
     * @param algorithm requested algorithm, null falls back to UCB1
     * @return a new strategy instance
     */
    public SelectionStrategy create(BanditAlgorithm algorithm) {
        BanditAlgorithm selected = algorithm != null ? algorithm : BanditAlgorithm.UCB1;

        SelectionStrategy strategy = switch (selected) {
            case UCB1 -> new Ucb1Strategy(config.getExplorationConstant());
            case THOMPSON -> new ThompsonSamplingStrategy(random());
            case EPSILON_GREEDY -> new EpsilonGreedyStrategy(config.getEpsilon(), random());
        };

        log.info("Using {} arm selection (exploration constant={}, epsilon={}, seed={})",
            selected, config.getExplorationConstant(), config.getEpsilon(), config.getSeed());
        return strategy;
    }

    private RandomGenerator random() {
        return config.getSeed() != null ? new Well19937c(config.getSeed()) : new Well19937c();
    }
}
