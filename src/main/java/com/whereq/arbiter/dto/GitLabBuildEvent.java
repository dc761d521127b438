package com.whereq.arbiter.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The subset of a GitLab webhook payload needed to learn from finished jobs.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitLabBuildEvent {

    @JsonProperty("object_kind")
    private String objectKind;

    @JsonProperty("build_name")
    private String buildName;

    @JsonProperty("build_status")
    private String buildStatus;

    /**
     * Seconds, may be null for jobs that never started
     */
    @JsonProperty("build_duration")
    private Double buildDuration;

    private Runner runner;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Runner {
        private Long id;
        private String description;
    }
}
