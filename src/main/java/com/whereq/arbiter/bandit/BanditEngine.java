package com.whereq.arbiter.bandit;

import com.whereq.arbiter.exception.UnknownRunnerException;
import com.whereq.arbiter.model.ArmStatistics;
import com.whereq.arbiter.model.BanditState;
import com.whereq.arbiter.model.Observation;
import com.whereq.arbiter.model.RunnerStats;
import com.whereq.arbiter.ontology.CapabilityOntology;
import com.whereq.arbiter.state.StateBackend;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learns which feasible runner performs best from observed job outcomes.
 *
 * Every public operation loads the state document, works on it and (for updates) saves it back;
 * nothing is cached between calls. Backend failures degrade: a failed load acts as an empty state,
 * a failed save loses that observation.
 */
@Slf4j
@Service
public class BanditEngine {

    private final StateBackend stateBackend;
    private final CapabilityOntology ontology;
    private final SelectionStrategy strategy;
    private final MeterRegistry meterRegistry;

    private Counter updateCounter;
    private Counter rejectedUpdateCounter;
    private Counter degradedCounter;

    @Autowired
    public BanditEngine(StateBackend stateBackend,
                        CapabilityOntology ontology,
                        SelectionStrategyFactory strategyFactory,
                        MeterRegistry meterRegistry) {
        this(stateBackend, ontology, strategyFactory.create(), meterRegistry);
    }

    public BanditEngine(StateBackend stateBackend,
                        CapabilityOntology ontology,
                        SelectionStrategy strategy,
                        MeterRegistry meterRegistry) {
        this.stateBackend = stateBackend;
        this.ontology = ontology;
        this.strategy = strategy;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initialize() {
        updateCounter = Counter.builder("arbiter.bandit.updates")
            .description("Number of job outcomes folded into arm statistics")
            .register(meterRegistry);

        rejectedUpdateCounter = Counter.builder("arbiter.bandit.updates.rejected")
            .description("Number of outcomes rejected for unknown runners")
            .register(meterRegistry);

        degradedCounter = Counter.builder("arbiter.bandit.state.degraded")
            .description("Number of state backend failures absorbed")
            .register(meterRegistry);

        log.info("BanditEngine initialized: strategy={}, backend={}", strategy.algorithm(), stateBackend.name());
    }

    /**
     * Pick one runner among the feasible set
     *
     * @param feasibleRunnerKeys keys that passed constraint solving
     * @return Mono with the decision, empty when the feasible set is empty
     */
    public Mono<BanditDecision> select(List<String> feasibleRunnerKeys) {
        if (feasibleRunnerKeys == null || feasibleRunnerKeys.isEmpty()) {
            return Mono.empty();
        }

        return loadState().map(state -> {
            long totalPulls = state.totalPulls(ontology.runnerKeys());
            StrategyDecision decision = strategy.select(feasibleRunnerKeys, state, totalPulls);
            ArmStatistics arm = state.arm(decision.getRunnerKey()).orElseGet(ArmStatistics::new);

            log.info("Bandit selected {} among {} (confidence {}, exploration={})",
                decision.getRunnerKey(), feasibleRunnerKeys,
                String.format("%.2f", decision.getConfidence()), decision.isExploration());

            return BanditDecision.builder()
                .runnerKey(decision.getRunnerKey())
                .score(decision.getScore())
                .meanReward(arm.meanReward())
                .pulls(arm.getPulls())
                .confidence(decision.getConfidence())
                .exploration(decision.isExploration())
                .reasoning(decision.getReasoning())
                .build();
        });
    }

    /**
     * Record a job outcome
     *
     * @return Mono with the reward credited to the runner
     */
    public Mono<Double> update(String runnerKey, boolean success, double durationSeconds, double costPerMinute) {
        return update(Observation.builder()
            .runnerKey(runnerKey)
            .success(success)
            .durationSeconds(durationSeconds)
            .costPerMinute(costPerMinute)
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Record a job outcome
     *
     * @param observation the outcome; its runner must be registered
     * @return Mono with the reward credited to the runner, or an {@link UnknownRunnerException}
     */
    public Mono<Double> update(Observation observation) {
        String runnerKey = observation.getRunnerKey();
        if (runnerKey == null || !ontology.contains(runnerKey)) {
            rejectedUpdateCounter.increment();
            log.warn("Rejected outcome for unknown runner '{}'", runnerKey);
            return Mono.error(new UnknownRunnerException("Runner not registered: " + runnerKey));
        }
        if (!Double.isFinite(observation.getDurationSeconds()) || observation.getDurationSeconds() < 0) {
            return Mono.error(new IllegalArgumentException(
                "Duration must be a finite number >= 0: " + observation.getDurationSeconds()));
        }
        if (!Double.isFinite(observation.getCostPerMinute()) || observation.getCostPerMinute() < 0) {
            return Mono.error(new IllegalArgumentException(
                "Cost per minute must be a finite number >= 0: " + observation.getCostPerMinute()));
        }

        double reward = RewardFunction.reward(
            observation.isSuccess(), observation.getDurationSeconds(), observation.getCostPerMinute());

        return loadState()
            .flatMap(state -> {
                ArmStatistics arm = state.armOrCreate(runnerKey);
                arm.record(reward, observation.isSuccess(), observation.getDurationSeconds());
                updateCounter.increment();
                log.info("Outcome for {}: success={}, duration={}s, reward={} (pulls={}, mean={})",
                    runnerKey, observation.isSuccess(), observation.getDurationSeconds(),
                    String.format("%.4f", reward), arm.getPulls(), String.format("%.4f", arm.meanReward()));
                return saveState(state);
            })
            .thenReturn(reward);
    }

    /**
     * Diagnostic snapshot of all arms, keyed by runner
     */
    public Mono<Map<String, RunnerStats>> stats() {
        return loadState().map(state -> {
            Map<String, RunnerStats> stats = new LinkedHashMap<>();
            state.getArms().forEach((key, arm) -> stats.put(key, RunnerStats.of(arm)));
            return stats;
        });
    }

    /**
     * Forget every observation
     */
    public Mono<Void> reset() {
        log.info("Resetting bandit statistics");
        return saveState(BanditState.empty());
    }

    public SelectionStrategy getStrategy() {
        return strategy;
    }

    public String getStateBackendName() {
        return stateBackend.name();
    }

    private Mono<BanditState> loadState() {
        return stateBackend.load()
            .defaultIfEmpty(BanditState.empty())
            .onErrorResume(e -> {
                degradedCounter.increment();
                log.warn("Bandit state unavailable from {} backend, continuing without prior knowledge: {}",
                    stateBackend.name(), e.getMessage());
                return Mono.just(BanditState.empty());
            });
    }

    private Mono<Void> saveState(BanditState state) {
        return stateBackend.save(state)
            .onErrorResume(e -> {
                degradedCounter.increment();
                log.warn("Failed to persist bandit state to {} backend, observation lost: {}",
                    stateBackend.name(), e.getMessage());
                return Mono.empty();
            });
    }
}
