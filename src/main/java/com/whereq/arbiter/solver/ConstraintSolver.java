package com.whereq.arbiter.solver;

import com.whereq.arbiter.model.FeasibilityResult;
import com.whereq.arbiter.model.JobRequirement;
import com.whereq.arbiter.model.RankedRunner;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.ontology.CapabilityOntology;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the runners able to run a job and ranks them.
 *
 * A runner is feasible when its closed capability set contains every required capability.
 * Feasible runners are ordered by preference score (desc), cost per minute (asc) and runner key,
 * so identical inputs always give identical output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConstraintSolver {

    static final Comparator<RankedRunner> RANKING = Comparator
        .comparingDouble(RankedRunner::getPreferenceScore).reversed()
        .thenComparingDouble(RankedRunner::getCostPerMinute)
        .thenComparing(RankedRunner::getRunnerKey);

    private static final int SUMMARY_TOP = 3;

    private final CapabilityOntology ontology;

    /**
     * Solve against every registered runner
     */
    public FeasibilityResult solve(JobRequirement requirement) {
        return solve(requirement, ontology.profiles());
    }

    /**
     * Solve the runner selection problem for one job
     *
     * @param requirement parsed job requirement
     * @param runners candidate runners; each must be registered in the ontology
     * @return ranked feasible runners, possibly empty
     */
    public FeasibilityResult solve(JobRequirement requirement, Collection<RunnerProfile> runners) {
        long start = System.nanoTime();

        List<RankedRunner> ranked = new ArrayList<>();
        Map<String, String> pruned = new LinkedHashMap<>();

        List<RunnerProfile> ordered = new ArrayList<>(runners);
        ordered.sort(Comparator.comparing(RunnerProfile::getRunnerKey));

        for (RunnerProfile runner : ordered) {
            Set<String> capabilities = ontology.capabilitiesOf(runner.getRunnerKey());

            List<String> missing = requirement.getRequiredCapabilities().stream()
                .filter(cap -> !capabilities.contains(cap))
                .toList();
            if (!missing.isEmpty()) {
                pruned.put(runner.getRunnerKey(), "missing: " + String.join(", ", missing));
                continue;
            }

            ranked.add(new RankedRunner(
                runner.getRunnerKey(),
                requirement.preferenceScore(capabilities),
                runner.getCostPerMinute()));
        }

        ranked.sort(RANKING);

        double solveTimeMs = (System.nanoTime() - start) / 1_000_000.0;

        FeasibilityResult result = FeasibilityResult.builder()
            .requirement(requirement)
            .ranked(ranked)
            .pruned(pruned)
            .solveTimeMs(solveTimeMs)
            .build();
        result.setSummary(ranked.isEmpty() ? infeasibleSummary(requirement, pruned) : summary(requirement, ranked, pruned));

        log.debug("Solved {}: {} feasible, {} pruned in {}ms",
            requirement.getRequiredCapabilities(), ranked.size(), pruned.size(), String.format("%.3f", solveTimeMs));

        return result;
    }

    private String summary(JobRequirement requirement, List<RankedRunner> ranked, Map<String, String> pruned) {
        List<String> lines = new ArrayList<>();
        lines.add("Job requires: " + joinOrNone(requirement.getRequiredCapabilities()));
        if (!requirement.getPreferredCapabilities().isEmpty()) {
            lines.add("Prefers: " + String.join(", ", requirement.getPreferredCapabilities()));
        }
        lines.add(String.format("Feasible runners: %d (best score %.2f)", ranked.size(), ranked.get(0).getPreferenceScore()));
        ranked.stream().limit(SUMMARY_TOP).forEach(r -> lines.add(String.format(
            "  - %s (score: %.2f, cost: %.3f/min)", r.getRunnerKey(), r.getPreferenceScore(), r.getCostPerMinute())));
        if (!pruned.isEmpty()) {
            lines.add("Pruned: " + pruned.size() + " runners");
        }
        return String.join("\n", lines);
    }

    private String infeasibleSummary(JobRequirement requirement, Map<String, String> pruned) {
        List<String> lines = new ArrayList<>();
        lines.add("No feasible runner found");
        lines.add("Job requires: " + joinOrNone(requirement.getRequiredCapabilities()));
        lines.add("Feasible runners: 0");
        if (pruned.isEmpty()) {
            lines.add("No runners registered");
        } else {
            lines.add(pruned.entrySet().stream()
                .map(e -> "  - " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n")));
        }
        return String.join("\n", lines);
    }

    private static String joinOrNone(Collection<String> values) {
        return values.isEmpty() ? "none" : String.join(", ", values);
    }
}
