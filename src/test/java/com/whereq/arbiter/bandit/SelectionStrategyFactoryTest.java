package com.whereq.arbiter.bandit;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.model.BanditAlgorithm;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectionStrategyFactoryTest {

    @Test
    void defaultsToUcb1WithConfiguredConstant() {
        ArbiterProperties properties = new ArbiterProperties();
        properties.getBandit().setExplorationConstant(1.5);

        SelectionStrategy strategy = new SelectionStrategyFactory(properties).create();

        assertInstanceOf(Ucb1Strategy.class, strategy);
        assertEquals(1.5, ((Ucb1Strategy) strategy).getExplorationConstant());
    }

    @Test
    void buildsConfiguredAlgorithm() {
        ArbiterProperties properties = new ArbiterProperties();
        properties.getBandit().setEpsilon(0.2);
        properties.getBandit().setSeed(5L);
        SelectionStrategyFactory factory = new SelectionStrategyFactory(properties);

        assertEquals(BanditAlgorithm.THOMPSON, factory.create(BanditAlgorithm.THOMPSON).algorithm());
        SelectionStrategy greedy = factory.create(BanditAlgorithm.EPSILON_GREEDY);
        assertEquals(0.2, ((EpsilonGreedyStrategy) greedy).getEpsilon());
        assertEquals(BanditAlgorithm.UCB1, factory.create(null).algorithm());
    }
}
