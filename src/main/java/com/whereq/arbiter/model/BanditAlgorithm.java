package com.whereq.arbiter.model;

/**
 * Arm selection algorithm used by the bandit engine
 */
public enum BanditAlgorithm {
    /**
     * Upper confidence bound, deterministic (default)
     */
    UCB1,

    /**
     * Beta-Bernoulli Thompson sampling over success/failure counts
     */
    THOMPSON,

    /**
     * Random arm with probability epsilon, best mean reward otherwise
     */
    EPSILON_GREEDY
}
