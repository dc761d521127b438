package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Why a runner was (or was not) selected, combining the constraint solve and the bandit choice
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Explanation {

    /**
     * Runners that passed constraint solving, in rank order
     */
    @Builder.Default
    private List<String> feasibleRunners = new ArrayList<>();

    private String selectedRunner;

    /**
     * Confidence in the selection, 0 to 1
     */
    private double confidence;

    private String symbolicReasoning;

    private String statisticalReasoning;

    private double solveTimeMs;

    /**
     * Degraded-path notes (probe unavailable, capacity start failed, ...)
     */
    @Builder.Default
    private List<String> notes = new ArrayList<>();

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Runner Selection ===\n");
        sb.append("Constraints:\n").append(symbolicReasoning).append('\n');
        sb.append("Statistics:\n").append(statisticalReasoning).append('\n');
        for (String note : notes) {
            sb.append("Note: ").append(note).append('\n');
        }
        sb.append(String.format("Selected: %s%n", selectedRunner != null ? selectedRunner : "none"));
        sb.append(String.format("Confidence: %.1f%%%n", confidence * 100));
        sb.append(String.format("Decision time: %.2fms", solveTimeMs));
        return sb.toString();
    }
}
