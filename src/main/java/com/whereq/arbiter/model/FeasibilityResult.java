package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of constraint solving: feasible runners in rank order.
 * An empty ranking is a valid result meaning no runner can run the job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeasibilityResult {

    private JobRequirement requirement;

    /**
     * Feasible runners ordered by score desc, cost asc, key asc
     */
    @Builder.Default
    private List<RankedRunner> ranked = List.of();

    /**
     * Runners that were eliminated, with the reason
     */
    @Builder.Default
    private Map<String, String> pruned = new LinkedHashMap<>();

    /**
     * Short natural language summary of the solve
     */
    private String summary;

    private double solveTimeMs;

    public boolean isFeasible() {
        return !ranked.isEmpty();
    }

    public List<String> feasibleRunnerKeys() {
        return ranked.stream().map(RankedRunner::getRunnerKey).toList();
    }

    public Optional<RankedRunner> best() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }
}
