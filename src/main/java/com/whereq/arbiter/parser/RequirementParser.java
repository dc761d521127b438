package com.whereq.arbiter.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.dto.JobDeclaration;
import com.whereq.arbiter.model.JobRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a job declaration into required and preferred capabilities.
 *
 * Tags are looked up in a fixed tag table and become required capabilities; tags missing from
 * the table are ignored. Image and service names only ever add preferred capabilities.
 * Parsing is a pure function of the declaration.
 */
@Slf4j
@Component
public class RequirementParser {

    public static final Map<String, List<String>> DEFAULT_TAG_MAPPINGS = Map.ofEntries(
        Map.entry("docker-any", List.of("docker")),
        Map.entry("docker", List.of("docker")),
        Map.entry("shell", List.of("shell")),
        Map.entry("kubernetes", List.of("kubernetes")),
        Map.entry("k8s", List.of("kubernetes")),
        Map.entry("gcp", List.of("gcp")),
        Map.entry("aws", List.of("aws")),
        Map.entry("azure", List.of("azure")),
        Map.entry("gpu", List.of("gpu")),
        Map.entry("nordic", List.of("nordic", "gcp")),
        Map.entry("macos", List.of("macos", "shell")),
        Map.entry("windows", List.of("windows")),
        Map.entry("linux", List.of("linux")),
        Map.entry("arm64", List.of("arm64")),
        Map.entry("local", List.of("local"))
    );

    private static final List<PatternRule> IMAGE_RULES = List.of(
        new PatternRule(Pattern.compile("nvidia|cuda", Pattern.CASE_INSENSITIVE), List.of("gpu")),
        new PatternRule(Pattern.compile("arm64|aarch64", Pattern.CASE_INSENSITIVE), List.of("arm64")),
        new PatternRule(Pattern.compile("windows", Pattern.CASE_INSENSITIVE), List.of("windows")),
        new PatternRule(Pattern.compile("alpine|ubuntu|debian|centos", Pattern.CASE_INSENSITIVE), List.of("linux"))
    );

    private static final Map<String, List<String>> SERVICE_CAPABILITIES = Map.of(
        "docker:dind", List.of("docker"),
        "postgres", List.of("linux"),
        "mysql", List.of("linux"),
        "redis", List.of("linux"),
        "mongo", List.of("linux")
    );

    private static final Set<String> RESERVED_PIPELINE_KEYS = Set.of(
        "default", "include", "variables", "stages", "workflow", "image", "services",
        "before_script", "after_script", "cache"
    );

    private static final Pattern HOURS = Pattern.compile("(\\d+)\\s*h", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*m", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECONDS = Pattern.compile("(\\d+)\\s*s", Pattern.CASE_INSENSITIVE);

    private static final Pattern PLAIN_SECONDS = Pattern.compile("\\d+");

    private static final int DEFAULT_TIMEOUT_SECONDS = 3600;

    /**
     * Longest timeout GitLab accepts for a job (one month)
     */
    static final int MAX_TIMEOUT_SECONDS = 30 * 24 * 3600;

    private final Map<String, List<String>> tagMappings;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public RequirementParser() {
        this(Map.of());
    }

    public RequirementParser(Map<String, List<String>> extraTagMappings) {
        Map<String, List<String>> mappings = new LinkedHashMap<>(DEFAULT_TAG_MAPPINGS);
        if (extraTagMappings != null) {
            extraTagMappings.forEach((tag, caps) -> mappings.put(tag.toLowerCase(Locale.ROOT), List.copyOf(caps)));
        }
        this.tagMappings = Map.copyOf(mappings);
    }

    @Autowired
    public RequirementParser(ArbiterProperties properties) {
        this(properties.getFleet().getTagMappings());
    }

    /**
     * Parse a job declaration into requirements
     *
     * @param declaration the job as declared
     * @return required and preferred capabilities plus hints
     */
    public JobRequirement parse(JobDeclaration declaration) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> preferred = new LinkedHashSet<>();
        List<String> tags = declaration.getTags() != null ? List.copyOf(declaration.getTags()) : List.of();

        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            List<String> caps = tagMappings.get(tag.trim().toLowerCase(Locale.ROOT));
            if (caps != null) {
                required.addAll(caps);
            } else {
                log.debug("Ignoring unrecognized tag '{}'", tag);
            }
        }

        String image = declaration.getImage();
        if (image != null && !image.isBlank()) {
            preferred.add("docker");
            for (PatternRule rule : IMAGE_RULES) {
                if (rule.pattern.matcher(image).find()) {
                    preferred.addAll(rule.capabilities);
                }
            }
        }

        if (declaration.getServices() != null) {
            for (String service : declaration.getServices()) {
                if (service == null) {
                    continue;
                }
                SERVICE_CAPABILITIES.forEach((name, caps) -> {
                    if (service.contains(name)) {
                        preferred.addAll(caps);
                    }
                });
            }
        }

        Map<String, String> hints = new LinkedHashMap<>();
        Map<String, String> variables = declaration.getVariables();
        if (variables != null) {
            if (variables.containsKey("CI_RUNNER_MEMORY")) {
                hints.put("memory", variables.get("CI_RUNNER_MEMORY"));
            }
            if (variables.containsKey("CI_RUNNER_CPU")) {
                hints.put("cpu", variables.get("CI_RUNNER_CPU"));
            }
        }

        String timeout = declaration.getTimeout();

        return JobRequirement.builder()
            .jobName(declaration.getJobName())
            .requiredCapabilities(required)
            .preferredCapabilities(preferred)
            .tags(tags)
            .resourceHints(hints)
            .timeoutSeconds(timeout != null && !timeout.isBlank() ? parseTimeout(timeout) : null)
            .build();
    }

    /**
     * Parse every job of a .gitlab-ci.yml document.
     * Hidden jobs (".name") and reserved keys are skipped; jobs without tags or image inherit
     * {@code default.tags} and {@code default.image} (or the top-level image).
     *
     * @param yaml pipeline file content
     * @return requirements per job name, in file order
     */
    public Map<String, JobRequirement> parsePipeline(String yaml) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid pipeline YAML: " + e.getMessage(), e);
        }

        Map<String, JobRequirement> jobs = new LinkedHashMap<>();
        if (root == null || !root.isObject()) {
            return jobs;
        }

        JsonNode defaults = root.path("default");
        List<String> defaultTags = stringList(defaults.path("tags"));
        String defaultImage = imageName(defaults.path("image"));
        if (defaultImage == null) {
            defaultImage = imageName(root.path("image"));
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode job = field.getValue();
            if (name.startsWith(".") || RESERVED_PIPELINE_KEYS.contains(name) || !job.isObject()) {
                continue;
            }

            List<String> tags = job.has("tags") ? stringList(job.path("tags")) : defaultTags;
            String image = job.has("image") ? imageName(job.path("image")) : defaultImage;

            List<String> services = new ArrayList<>();
            for (JsonNode service : job.path("services")) {
                String serviceName = imageName(service);
                if (serviceName != null) {
                    services.add(serviceName);
                }
            }

            Map<String, String> variables = new LinkedHashMap<>();
            job.path("variables").fields().forEachRemaining(v -> variables.put(v.getKey(), v.getValue().asText()));

            JobDeclaration declaration = JobDeclaration.builder()
                .jobName(name)
                .tags(tags)
                .image(image)
                .services(services)
                .variables(variables)
                .timeout(job.has("timeout") ? job.path("timeout").asText() : null)
                .build();

            jobs.put(name, parse(declaration));
        }

        log.debug("Parsed {} jobs from pipeline", jobs.size());
        return jobs;
    }

    /**
     * Parse a timeout hint to seconds: plain integers are seconds, otherwise h/m/s components
     * are summed; anything unparseable falls back to one hour and anything longer than
     * a month is capped at a month.
     */
    public int parseTimeout(String timeout) {
        String value = timeout.trim();
        long total;
        if (PLAIN_SECONDS.matcher(value).matches()) {
            total = cappedNumber(value);
        } else {
            total = component(HOURS, value, 3600) + component(MINUTES, value, 60) + component(SECONDS, value, 1);
        }
        if (total <= 0) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        return (int) Math.min(total, MAX_TIMEOUT_SECONDS);
    }

    public Map<String, List<String>> tagMappings() {
        return tagMappings;
    }

    private static long component(Pattern pattern, String value, long multiplier) {
        Matcher matcher = pattern.matcher(value);
        return matcher.find() ? cappedNumber(matcher.group(1)) * multiplier : 0;
    }

    private static long cappedNumber(String digits) {
        try {
            return Math.min(Long.parseLong(digits), MAX_TIMEOUT_SECONDS);
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return MAX_TIMEOUT_SECONDS;
        }
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(n -> values.add(n.asText()));
            return values;
        }
        return List.of(node.asText());
    }

    private static String imageName(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return node.has("name") ? node.path("name").asText() : null;
        }
        return node.asText();
    }

    private static final class PatternRule {
        private final Pattern pattern;
        private final Collection<String> capabilities;

        private PatternRule(Pattern pattern, Collection<String> capabilities) {
            this.pattern = pattern;
            this.capabilities = capabilities;
        }
    }
}
