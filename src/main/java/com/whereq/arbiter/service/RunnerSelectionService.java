package com.whereq.arbiter.service;

import com.whereq.arbiter.availability.AvailabilityProber;
import com.whereq.arbiter.bandit.BanditDecision;
import com.whereq.arbiter.bandit.BanditEngine;
import com.whereq.arbiter.dto.GitLabBuildEvent;
import com.whereq.arbiter.dto.JobDeclaration;
import com.whereq.arbiter.dto.OutcomeResponse;
import com.whereq.arbiter.dto.StatsResponse;
import com.whereq.arbiter.exception.UnknownRunnerException;
import com.whereq.arbiter.lifecycle.CapacityOutcome;
import com.whereq.arbiter.lifecycle.LifecycleController;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.Explanation;
import com.whereq.arbiter.model.FeasibilityResult;
import com.whereq.arbiter.model.JobRequirement;
import com.whereq.arbiter.model.RankedRunner;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.model.RunnerStats;
import com.whereq.arbiter.model.SelectionResult;
import com.whereq.arbiter.ontology.CapabilityOntology;
import com.whereq.arbiter.parser.RequirementParser;
import com.whereq.arbiter.solver.ConstraintSolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for runner selection: parse, solve, check availability, then let the bandit choose.
 *
 * Misuse (unknown runner, malformed input) propagates as an error. Environmental failures
 * (state backend, status feed, compute control) never fail a selection; they end up as notes
 * in the {@link Explanation}.
 */
@Slf4j
@Service
public class RunnerSelectionService {

    static final String BUILD_EVENT = "build";

    private final RequirementParser parser;
    private final ConstraintSolver solver;
    private final CapabilityOntology ontology;
    private final AvailabilityProber prober;
    private final BanditEngine bandit;
    private final LifecycleController lifecycle;
    private final MeterRegistry meterRegistry;

    private Counter selectedCounter;
    private Counter infeasibleCounter;
    private Counter capacityPendingCounter;

    public RunnerSelectionService(RequirementParser parser,
                                  ConstraintSolver solver,
                                  CapabilityOntology ontology,
                                  AvailabilityProber prober,
                                  BanditEngine bandit,
                                  LifecycleController lifecycle,
                                  MeterRegistry meterRegistry) {
        this.parser = parser;
        this.solver = solver;
        this.ontology = ontology;
        this.prober = prober;
        this.bandit = bandit;
        this.lifecycle = lifecycle;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initialize() {
        selectedCounter = Counter.builder("arbiter.selection.selected")
            .description("Number of selections that returned a runner")
            .register(meterRegistry);

        infeasibleCounter = Counter.builder("arbiter.selection.infeasible")
            .description("Number of jobs no registered runner can run")
            .register(meterRegistry);

        capacityPendingCounter = Counter.builder("arbiter.selection.capacity-pending")
            .description("Number of selections made while no feasible runner was online")
            .register(meterRegistry);
    }

    /**
     * Select a runner for a job
     *
     * @param declaration the job as declared by the CI system
     * @return Mono with the selection; runner key is null when the job is infeasible
     */
    public Mono<SelectionResult> selectRunner(JobDeclaration declaration) {
        return Mono.fromCallable(() -> {
                long start = System.nanoTime();
                JobRequirement requirement = parser.parse(declaration);
                return new Solve(requirement, solver.solve(requirement), start);
            })
            .flatMap(solve -> solve.result.isFeasible()
                ? selectAmongFeasible(solve)
                : Mono.just(infeasible(solve)))
            .doOnSuccess(result -> lifecycle.armIdleShutdown());
    }

    private SelectionResult infeasible(Solve solve) {
        infeasibleCounter.increment();
        log.info("Job '{}' is infeasible: requires {}",
            solve.requirement.getJobName(), solve.requirement.getRequiredCapabilities());

        Explanation explanation = Explanation.builder()
            .feasibleRunners(new ArrayList<>())
            .confidence(0.0)
            .symbolicReasoning(solve.result.getSummary())
            .statisticalReasoning("Bandit not consulted: no feasible runner")
            .solveTimeMs(solve.elapsedMs())
            .build();
        return SelectionResult.builder().explanation(explanation).build();
    }

    private Mono<SelectionResult> selectAmongFeasible(Solve solve) {
        List<String> feasible = solve.result.feasibleRunnerKeys();

        return prober.probe().flatMap(snapshot -> {
            List<String> notes = new ArrayList<>();
            List<String> candidates;

            if (snapshot.isUnknown()) {
                notes.add("Availability probe unavailable (" + snapshot.getReason() + "), assuming fleet available");
                candidates = feasible;
            } else {
                candidates = feasible.stream()
                    .filter(snapshot.getOnlineRunners()::contains)
                    .toList();
            }

            if (candidates.isEmpty()) {
                return capacityPending(solve, snapshot, notes);
            }

            return bandit.select(candidates)
                .map(decision -> selected(solve, snapshot, decision, notes));
        });
    }

    private SelectionResult selected(Solve solve, AvailabilitySnapshot snapshot, BanditDecision decision, List<String> notes) {
        selectedCounter.increment();

        String statistical = String.format("%s%nSelected %s: mean reward %.4f over %d pulls, score %s",
            decision.getReasoning(), decision.getRunnerKey(), decision.getMeanReward(), decision.getPulls(),
            Double.isInfinite(decision.getScore()) ? "unexplored" : String.format("%.4f", decision.getScore()));

        Explanation explanation = Explanation.builder()
            .feasibleRunners(new ArrayList<>(solve.result.feasibleRunnerKeys()))
            .selectedRunner(decision.getRunnerKey())
            .confidence(decision.getConfidence())
            .symbolicReasoning(solve.result.getSummary())
            .statisticalReasoning(statistical)
            .solveTimeMs(solve.elapsedMs())
            .notes(notes)
            .build();

        log.info("Selected runner {} for job '{}' (confidence {})",
            decision.getRunnerKey(), solve.requirement.getJobName(), String.format("%.2f", decision.getConfidence()));

        return SelectionResult.builder()
            .runnerKey(decision.getRunnerKey())
            .explanation(explanation)
            .availability(snapshot.getStatus())
            .build();
    }

    private Mono<SelectionResult> capacityPending(Solve solve, AvailabilitySnapshot snapshot, List<String> notes) {
        capacityPendingCounter.increment();
        RankedRunner top = solve.result.getRanked().get(0);
        log.warn("No feasible runner online for job '{}', requesting on-demand capacity", solve.requirement.getJobName());

        return lifecycle.ensureCapacity().map(outcome -> {
            notes.add("No feasible runner online; on-demand capacity: " + describe(outcome));

            Explanation explanation = Explanation.builder()
                .feasibleRunners(new ArrayList<>(solve.result.feasibleRunnerKeys()))
                .selectedRunner(top.getRunnerKey())
                .confidence(0.0)
                .symbolicReasoning(solve.result.getSummary())
                .statisticalReasoning("Bandit not consulted: returning top-ranked runner " + top.getRunnerKey()
                    + " while capacity comes online")
                .solveTimeMs(solve.elapsedMs())
                .notes(notes)
                .build();

            return SelectionResult.builder()
                .runnerKey(top.getRunnerKey())
                .explanation(explanation)
                .availability(snapshot.getStatus())
                .capacity(outcome)
                .build();
        });
    }

    private static String describe(CapacityOutcome outcome) {
        return switch (outcome) {
            case STARTED -> "start issued, the job may queue until the runner registers";
            case ALREADY_STARTED -> "start already in progress";
            case ALREADY_RUNNING -> "instance already running outside our control";
            case FAILED -> "start failed, the job may queue until capacity appears";
            case DISABLED -> "lifecycle control disabled";
        };
    }

    /**
     * Fold a job outcome into the statistics
     *
     * @param costPerMinute null to use the runner's registered cost
     * @return Mono with the credited reward, or an {@link UnknownRunnerException}
     */
    public Mono<Double> reportOutcome(String runnerKey, boolean success, double durationSeconds, Double costPerMinute) {
        if (runnerKey == null || !ontology.contains(runnerKey)) {
            return Mono.error(new UnknownRunnerException("Runner not registered: " + runnerKey));
        }
        double cost = costPerMinute != null ? costPerMinute : ontology.profile(runnerKey).getCostPerMinute();
        return bandit.update(runnerKey, success, durationSeconds, cost)
            .doOnSuccess(reward -> lifecycle.armIdleShutdown());
    }

    /**
     * Learn from a GitLab job event. Only finished jobs on known runners are used.
     */
    public Mono<OutcomeResponse> recordCompletionEvent(GitLabBuildEvent event) {
        if (!BUILD_EVENT.equals(event.getObjectKind())) {
            return Mono.just(OutcomeResponse.ignored("Unhandled event: " + event.getObjectKind()));
        }
        String status = event.getBuildStatus();
        if (!"success".equals(status) && !"failed".equals(status)) {
            return Mono.just(OutcomeResponse.ignored("Status: " + status));
        }
        if (event.getRunner() == null) {
            return Mono.just(OutcomeResponse.ignored("No runner info"));
        }

        Optional<RunnerProfile> runner = resolveRunner(event.getRunner());
        if (runner.isEmpty()) {
            return Mono.just(OutcomeResponse.ignored("Unknown runner: " + event.getRunner().getDescription()));
        }

        String runnerKey = runner.get().getRunnerKey();
        double duration = event.getBuildDuration() != null ? event.getBuildDuration() : 0.0;
        log.info("Completion event: job '{}' on {} {} after {}s", event.getBuildName(), runnerKey, status, duration);

        return reportOutcome(runnerKey, "success".equals(status), duration, null)
            .map(reward -> OutcomeResponse.updated(runnerKey, reward));
    }

    private Optional<RunnerProfile> resolveRunner(GitLabBuildEvent.Runner runner) {
        List<RunnerProfile> profiles = ontology.profiles();
        if (runner.getId() != null) {
            Optional<RunnerProfile> byId = profiles.stream()
                .filter(p -> runner.getId().equals(p.getGitlabRunnerId()))
                .findFirst();
            if (byId.isPresent()) {
                return byId;
            }
        }
        String description = runner.getDescription();
        if (description == null) {
            return Optional.empty();
        }
        return profiles.stream()
            .filter(p -> description.equals(p.getDisplayName()) || description.equals(p.getRunnerKey()))
            .findFirst();
    }

    public Mono<StatsResponse> getStats() {
        return bandit.stats().map(stats -> StatsResponse.builder()
            .algorithm(bandit.getStrategy().algorithm())
            .backend(bandit.getStateBackendName())
            .totalObservations(stats.values().stream().mapToLong(RunnerStats::getPulls).sum())
            .runners(stats)
            .ranking(stats.entrySet().stream()
                .sorted(Map.Entry.<String, RunnerStats>comparingByValue(
                    Comparator.comparingDouble(RunnerStats::getMeanReward)).reversed()
                    .thenComparing(Map.Entry.<String, RunnerStats>comparingByKey()))
                .map(Map.Entry::getKey)
                .toList())
            .build());
    }

    public Mono<Void> reset() {
        return bandit.reset();
    }

    /**
     * Symbolic feasibility for every job of a pipeline file, bandit and availability not consulted
     *
     * @param pipelineYaml content of a .gitlab-ci.yml
     * @return feasibility per job name, in file order
     */
    public Map<String, FeasibilityResult> planPipeline(String pipelineYaml) {
        Map<String, JobRequirement> jobs = parser.parsePipeline(pipelineYaml);
        Map<String, FeasibilityResult> plan = new LinkedHashMap<>();
        jobs.forEach((name, requirement) -> plan.put(name, solver.solve(requirement)));

        long infeasible = plan.values().stream().filter(r -> !r.isFeasible()).count();
        log.info("Planned pipeline with {} jobs, {} infeasible", plan.size(), infeasible);
        return plan;
    }

    private static final class Solve {
        private final JobRequirement requirement;
        private final FeasibilityResult result;
        private final long startNanos;

        private Solve(JobRequirement requirement, FeasibilityResult result, long startNanos) {
            this.requirement = requirement;
            this.result = result;
            this.startNanos = startNanos;
        }

        private double elapsedMs() {
            return (System.nanoTime() - startNanos) / 1_000_000.0;
        }
    }
}
