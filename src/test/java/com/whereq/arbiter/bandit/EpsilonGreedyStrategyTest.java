package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.BanditState;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EpsilonGreedyStrategyTest {

    private final BanditState state = new BanditState(Map.of(
        "a", Ucb1StrategyTest.arm(4, 1.0),
        "b", Ucb1StrategyTest.arm(4, 6.0),
        "c", Ucb1StrategyTest.arm(4, 2.0)));

    @Test
    void greedyPicksBestMean() {
        EpsilonGreedyStrategy strategy = new EpsilonGreedyStrategy(0.0, new Well19937c(1L));

        StrategyDecision decision = strategy.select(List.of("a", "b", "c"), state, 12);

        assertEquals("b", decision.getRunnerKey());
        assertFalse(decision.isExploration());
        assertEquals(1.5, decision.getScore(), 1e-9);
        // (1.5 - 0.5) / 1.5
        assertEquals(2.0 / 3.0, decision.getConfidence(), 1e-9);
    }

    @Test
    void greedyStillTriesUnobservedArm() {
        EpsilonGreedyStrategy strategy = new EpsilonGreedyStrategy(0.0, new Well19937c(1L));

        assertEquals("d", strategy.select(List.of("a", "b", "d"), state, 12).getRunnerKey());
    }

    @Test
    void alwaysExploresWithEpsilonOne() {
        EpsilonGreedyStrategy strategy = new EpsilonGreedyStrategy(1.0, new Well19937c(3L));

        for (int i = 0; i < 20; i++) {
            StrategyDecision decision = strategy.select(List.of("a", "c"), state, 12);
            assertTrue(List.of("a", "c").contains(decision.getRunnerKey()));
            assertTrue(decision.isExploration());
            assertEquals(0.5, decision.getConfidence());
        }
    }

    @Test
    void rejectsEpsilonOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EpsilonGreedyStrategy(1.5, new Well19937c()));
    }
}
