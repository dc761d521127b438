package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capabilities a job needs (hard) and would like (soft), derived from its declaration
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRequirement {

    private String jobName;

    /**
     * Every member must be present on a runner for it to be feasible
     */
    @Builder.Default
    private Set<String> requiredCapabilities = new LinkedHashSet<>();

    /**
     * Only used for ranking feasible runners, never for excluding one
     */
    @Builder.Default
    private Set<String> preferredCapabilities = new LinkedHashSet<>();

    /**
     * Tags exactly as declared on the job
     */
    @Builder.Default
    private List<String> tags = List.of();

    /**
     * Resource hints taken from job variables (memory, cpu)
     */
    @Builder.Default
    private Map<String, String> resourceHints = new LinkedHashMap<>();

    /**
     * Declared job timeout in seconds, if any
     */
    private Integer timeoutSeconds;

    public static JobRequirement requiring(String... capabilities) {
        return JobRequirement.builder()
            .requiredCapabilities(new LinkedHashSet<>(List.of(capabilities)))
            .build();
    }

    /**
     * Fraction of preferred capabilities the given capability set covers, 1.0 when nothing is preferred
     */
    public double preferenceScore(Set<String> runnerCapabilities) {
        if (preferredCapabilities.isEmpty()) {
            return 1.0;
        }
        long matched = preferredCapabilities.stream()
            .filter(runnerCapabilities::contains)
            .count();
        return (double) matched / Math.max(1, preferredCapabilities.size());
    }
}
