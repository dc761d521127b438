package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A registered runner and what it can do
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunnerProfile implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Stable identifier, used as the bandit arm key
     */
    private String runnerKey;

    /**
     * Human readable name (e.g. the runner description in GitLab)
     */
    private String displayName;

    /**
     * Tags as declared on the runner
     */
    @Builder.Default
    private List<String> tags = List.of();

    /**
     * Capabilities as declared at registration, before implication closure
     */
    @Builder.Default
    private Set<String> declaredCapabilities = new LinkedHashSet<>();

    /**
     * Declared capabilities closed under the ontology's implication rules
     */
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    /**
     * Cost of one minute of runner time, in the operator's currency
     */
    private double costPerMinute;

    /**
     * Executor type of the runner
     */
    @Builder.Default
    private ExecutorClass executorClass = ExecutorClass.CONTAINER;

    /**
     * Runner id in the orchestrating CI system, used by the availability probe
     */
    private Long gitlabRunnerId;

    /**
     * Whether this runner lives on capacity the lifecycle controller can power on
     */
    private boolean onDemand;
}
