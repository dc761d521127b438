package com.whereq.arbiter.bandit;

import com.whereq.arbiter.model.ArmStatistics;
import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.BanditState;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ThompsonSamplingStrategyTest {

    @Test
    void unobservedArmIsNotForcedFirst() {
        ThompsonSamplingStrategy strategy = new ThompsonSamplingStrategy(7L);
        BanditState state = new BanditState(Map.of(
            "a", ArmStatistics.builder().pulls(100).successes(100).totalReward(90).build()));

        int picksOfA = 0;
        for (int i = 0; i < 20; i++) {
            StrategyDecision decision = strategy.select(List.of("a", "b"), state, 100);
            if ("a".equals(decision.getRunnerKey())) {
                picksOfA++;
                assertFalse(decision.isExploration());
            } else {
                assertTrue(decision.isExploration());
            }
        }
        assertTrue(picksOfA > 0);
    }

    @Test
    void unobservedArmsShareTheUniformPrior() {
        ThompsonSamplingStrategy strategy = new ThompsonSamplingStrategy(11L);
        BanditState state = new BanditState();

        Set<String> picked = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            StrategyDecision decision = strategy.select(List.of("a", "b"), state, 0);
            assertTrue(decision.getScore() >= 0 && decision.getScore() <= 1);
            picked.add(decision.getRunnerKey());
        }
        assertEquals(Set.of("a", "b"), picked);
    }

    @Test
    void favoursReliableRunner() {
        ThompsonSamplingStrategy strategy = new ThompsonSamplingStrategy(42L);
        BanditState state = new BanditState(Map.of(
            "reliable", ArmStatistics.builder().pulls(50).successes(50).totalReward(40).build(),
            "flaky", ArmStatistics.builder().pulls(50).failures(50).build()));

        for (int i = 0; i < 20; i++) {
            StrategyDecision decision = strategy.select(List.of("flaky", "reliable"), state, 100);
            assertEquals("reliable", decision.getRunnerKey());
            assertTrue(decision.getScore() > 0 && decision.getScore() < 1);
        }
    }

    @Test
    void sameSeedSameChoices() {
        BanditState state = new BanditState(Map.of(
            "a", ArmStatistics.builder().pulls(4).successes(2).failures(2).build(),
            "b", ArmStatistics.builder().pulls(4).successes(2).failures(2).build()));

        ThompsonSamplingStrategy first = new ThompsonSamplingStrategy(99L);
        ThompsonSamplingStrategy second = new ThompsonSamplingStrategy(99L);

        for (int i = 0; i < 10; i++) {
            assertEquals(first.select(List.of("a", "b"), state, 8).getRunnerKey(),
                second.select(List.of("a", "b"), state, 8).getRunnerKey());
        }
        assertEquals(BanditAlgorithm.THOMPSON, first.algorithm());
    }
}
