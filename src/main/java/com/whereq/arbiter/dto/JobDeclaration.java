package com.whereq.arbiter.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A CI job as declared by the orchestrating system.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDeclaration implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Job name, informational.
     */
    private String jobName;

    /**
     * Free-form job tags (e.g. "docker-any", "gpu", "nordic").
     * Known tags become required capabilities, unknown tags are ignored.
     */
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Container image, e.g. "python:3.11" or "nvidia/cuda:12.2-runtime".
     * Only ever adds preferred capabilities.
     */
    private String image;

    /**
     * Service containers, e.g. "postgres:16" or "docker:dind".
     */
    @Builder.Default
    private List<String> services = new ArrayList<>();

    /**
     * Job variables. CI_RUNNER_MEMORY and CI_RUNNER_CPU are read as resource hints.
     */
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();

    /**
     * Timeout hint such as "1h 30m", "45 minutes" or "3600".
     */
    private String timeout;
}
