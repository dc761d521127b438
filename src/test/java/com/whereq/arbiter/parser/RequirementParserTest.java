package com.whereq.arbiter.parser;

import com.whereq.arbiter.dto.JobDeclaration;
import com.whereq.arbiter.model.JobRequirement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RequirementParserTest {

    private final RequirementParser parser = new RequirementParser();

    @Test
    @DisplayName("Known tags become required capabilities, unknown tags are ignored")
    void tagsBecomeRequired() {
        JobRequirement requirement = parser.parse(JobDeclaration.builder()
            .jobName("build")
            .tags(List.of("docker-any", "Nordic", "some-team-label"))
            .build());

        assertEquals(Set.of("docker", "nordic", "gcp"), requirement.getRequiredCapabilities());
        assertEquals(List.of("docker-any", "Nordic", "some-team-label"), requirement.getTags());
        assertEquals("build", requirement.getJobName());
    }

    @Test
    @DisplayName("Image and services only add preferred capabilities")
    void imageAndServicesArePreferred() {
        JobRequirement requirement = parser.parse(JobDeclaration.builder()
            .image("nvidia/cuda:12.2-runtime-ubuntu22.04")
            .services(List.of("postgres:16", "docker:dind"))
            .build());

        assertTrue(requirement.getRequiredCapabilities().isEmpty());
        assertEquals(Set.of("docker", "gpu", "linux"), requirement.getPreferredCapabilities());
    }

    @Test
    @DisplayName("A job without tags or image has no requirements")
    void emptyDeclaration() {
        JobRequirement requirement = parser.parse(new JobDeclaration());

        assertTrue(requirement.getRequiredCapabilities().isEmpty());
        assertTrue(requirement.getPreferredCapabilities().isEmpty());
        assertNull(requirement.getTimeoutSeconds());
    }

    @Test
    @DisplayName("Resource hints and timeout are read from the declaration")
    void hintsAndTimeout() {
        JobRequirement requirement = parser.parse(JobDeclaration.builder()
            .variables(Map.of("CI_RUNNER_MEMORY", "4Gi", "CI_RUNNER_CPU", "2", "OTHER", "x"))
            .timeout("1h 30m")
            .build());

        assertEquals(Map.of("memory", "4Gi", "cpu", "2"), requirement.getResourceHints());
        assertEquals(5400, requirement.getTimeoutSeconds());
    }

    @Test
    @DisplayName("Timeout hints in several formats")
    void parseTimeout() {
        assertEquals(3600, parser.parseTimeout("3600"));
        assertEquals(5400, parser.parseTimeout("90m"));
        assertEquals(2700, parser.parseTimeout("45 minutes"));
        assertEquals(7230, parser.parseTimeout("2h 30s"));
        assertEquals(3600, parser.parseTimeout("whenever"));
    }

    @Test
    @DisplayName("Oversized timeouts are capped at a month instead of failing")
    void oversizedTimeout() {
        int month = 30 * 24 * 3600;
        assertEquals(month, parser.parseTimeout("999999h"));
        assertEquals(month, parser.parseTimeout("99999999999h"));
        assertEquals(month, parser.parseTimeout("99999999999999999999"));
        assertEquals(month, parser.parseTimeout("2147483647m 5s"));
        assertEquals(3600, parser.parseTimeout("0"));

        JobRequirement requirement = parser.parse(JobDeclaration.builder().timeout("99999999999h").build());
        assertEquals(month, requirement.getTimeoutSeconds());
    }

    @Test
    @DisplayName("Configured tag mappings extend the default table")
    void extraTagMappings() {
        RequirementParser custom = new RequirementParser(Map.of("mac-docker", List.of("docker", "macos")));

        JobRequirement requirement = custom.parse(JobDeclaration.builder().tags(List.of("mac-docker")).build());

        assertEquals(Set.of("docker", "macos"), requirement.getRequiredCapabilities());
        assertTrue(custom.tagMappings().containsKey("docker-any"));
    }

    @Test
    @DisplayName("Pipeline parsing skips hidden and reserved keys and applies defaults")
    void parsePipeline() {
        String yaml = """
            stages: [build, test]
            default:
              tags: [docker-any]
              image: python:3.11-alpine
            variables:
              FOO: bar
            .template:
              tags: [gpu]
            build:
              stage: build
              script: [make]
            train:
              stage: test
              tags: [gpu]
              image:
                name: nvidia/cuda:12.2
              services:
                - name: redis:7
              timeout: 2h
            """;

        Map<String, JobRequirement> jobs = parser.parsePipeline(yaml);

        assertEquals(List.of("build", "train"), List.copyOf(jobs.keySet()));

        JobRequirement build = jobs.get("build");
        assertEquals(Set.of("docker"), build.getRequiredCapabilities());
        assertEquals(Set.of("docker", "linux"), build.getPreferredCapabilities());

        JobRequirement train = jobs.get("train");
        assertEquals(Set.of("gpu"), train.getRequiredCapabilities());
        assertEquals(Set.of("docker", "gpu", "linux"), train.getPreferredCapabilities());
        assertEquals(7200, train.getTimeoutSeconds());
    }

    @Test
    @DisplayName("Malformed pipeline YAML is rejected")
    void invalidPipeline() {
        assertThrows(IllegalArgumentException.class, () -> parser.parsePipeline("build: [unclosed"));
    }
}
