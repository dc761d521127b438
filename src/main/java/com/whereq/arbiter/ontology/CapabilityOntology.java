package com.whereq.arbiter.ontology;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.RunnerNotFoundException;
import com.whereq.arbiter.model.RunnerProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Knowledge about the fleet: which runners exist, what each one can do, and which
 * capabilities imply others (a docker runner is a linux runner, a gcp runner is a cloud runner).
 *
 * Runner capabilities are kept closed under the implication rules.
 */
@Slf4j
@Component
public class CapabilityOntology {

    /**
     * Built-in implication rules, configured rules are merged over them
     */
    public static final Map<String, List<String>> DEFAULT_IMPLICATIONS = Map.of(
        "docker", List.of("linux"),
        "gcp", List.of("cloud"),
        "aws", List.of("cloud"),
        "azure", List.of("cloud"),
        "nordic", List.of("eu-west", "gcp")
    );

    private final Map<String, Set<String>> implications;

    private final ConcurrentHashMap<String, RunnerProfile> runners = new ConcurrentHashMap<>();

    public CapabilityOntology() {
        this(Map.of());
    }

    public CapabilityOntology(Map<String, ? extends Collection<String>> extraImplications) {
        Map<String, Set<String>> rules = new LinkedHashMap<>();
        DEFAULT_IMPLICATIONS.forEach((cap, implied) -> rules.put(normalize(cap), normalizeAll(implied)));
        if (extraImplications != null) {
            extraImplications.forEach((cap, implied) -> rules.put(normalize(cap), normalizeAll(implied)));
        }
        this.implications = Collections.unmodifiableMap(rules);
    }

    @Autowired
    public CapabilityOntology(ArbiterProperties properties) {
        this(properties.getFleet().getImplications());

        for (ArbiterProperties.RunnerConfig runner : properties.getFleet().getRunners()) {
            register(RunnerProfile.builder()
                .runnerKey(runner.getKey())
                .displayName(runner.getName() != null ? runner.getName() : runner.getKey())
                .tags(List.copyOf(runner.getTags()))
                .declaredCapabilities(new LinkedHashSet<>(runner.getCapabilities()))
                .costPerMinute(runner.getCostPerMinute())
                .executorClass(runner.getExecutorClass())
                .gitlabRunnerId(runner.getGitlabRunnerId())
                .onDemand(runner.isOnDemand())
                .build());
        }

        log.info("CapabilityOntology initialized: {} runners, {} implication rules",
            runners.size(), implications.size());
    }

    /**
     * Register a runner, or replace a known runner's declared capabilities.
     * Other runners are not touched.
     *
     * @param profile runner profile; its declared capabilities are closed under the implication rules
     * @return the stored profile
     */
    public RunnerProfile register(RunnerProfile profile) {
        if (profile.getRunnerKey() == null || profile.getRunnerKey().isBlank()) {
            throw new IllegalArgumentException("Runner key must not be blank");
        }
        if (profile.getCostPerMinute() < 0) {
            throw new IllegalArgumentException("Cost per minute must not be negative: " + profile.getCostPerMinute());
        }

        Set<String> declared = normalizeAll(profile.getDeclaredCapabilities());
        RunnerProfile stored = profile.toBuilder()
            .displayName(profile.getDisplayName() != null ? profile.getDisplayName() : profile.getRunnerKey())
            .declaredCapabilities(declared)
            .capabilities(close(declared))
            .build();

        RunnerProfile previous = runners.put(stored.getRunnerKey(), stored);
        if (previous == null) {
            log.info("Registered runner {} with capabilities {}", stored.getRunnerKey(), stored.getCapabilities());
        } else {
            log.info("Re-registered runner {}: {} -> {}",
                stored.getRunnerKey(), previous.getCapabilities(), stored.getCapabilities());
        }
        return detached(stored);
    }

    public RunnerProfile register(String runnerKey, Collection<String> declaredCapabilities) {
        RunnerProfile existing = runners.get(runnerKey);
        RunnerProfile.RunnerProfileBuilder builder = existing != null
            ? existing.toBuilder()
            : RunnerProfile.builder().runnerKey(runnerKey);
        return register(builder.declaredCapabilities(new LinkedHashSet<>(declaredCapabilities)).build());
    }

    /**
     * Closed capability set of a registered runner
     *
     * @throws RunnerNotFoundException if the runner is not registered
     */
    public Set<String> capabilitiesOf(String runnerKey) {
        return Collections.unmodifiableSet(registered(runnerKey).getCapabilities());
    }

    /**
     * Copy of a registered runner's profile; changing it does not affect the ontology
     *
     * @throws RunnerNotFoundException if the runner is not registered
     */
    public RunnerProfile profile(String runnerKey) {
        return detached(registered(runnerKey));
    }

    public boolean contains(String runnerKey) {
        return runnerKey != null && runners.containsKey(runnerKey);
    }

    /**
     * All registered runners ordered by runner key
     */
    public List<RunnerProfile> profiles() {
        List<RunnerProfile> all = new ArrayList<>();
        for (RunnerProfile profile : runners.values()) {
            all.add(detached(profile));
        }
        all.sort(Comparator.comparing(RunnerProfile::getRunnerKey));
        return all;
    }

    public Set<String> runnerKeys() {
        return new TreeSet<>(runners.keySet());
    }

    public List<RunnerProfile> runnersWithCapability(String capability) {
        String cap = normalize(capability);
        return profiles().stream()
            .filter(p -> p.getCapabilities().contains(cap))
            .toList();
    }

    private RunnerProfile registered(String runnerKey) {
        RunnerProfile profile = runnerKey != null ? runners.get(runnerKey) : null;
        if (profile == null) {
            throw new RunnerNotFoundException("Runner not registered: " + runnerKey);
        }
        return profile;
    }

    private static RunnerProfile detached(RunnerProfile profile) {
        return profile.toBuilder()
            .tags(profile.getTags() != null ? new ArrayList<>(profile.getTags()) : new ArrayList<>())
            .declaredCapabilities(new LinkedHashSet<>(profile.getDeclaredCapabilities()))
            .capabilities(new TreeSet<>(profile.getCapabilities()))
            .build();
    }

    public Map<String, Set<String>> implications() {
        return implications;
    }

    /**
     * Union in implied capabilities until a pass adds nothing. Cyclic rules terminate
     * because the set of reachable capabilities is finite.
     */
    Set<String> close(Set<String> declared) {
        Set<String> closed = new TreeSet<>(declared);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String capability : List.copyOf(closed)) {
                Set<String> implied = implications.get(capability);
                if (implied != null && closed.addAll(implied)) {
                    changed = true;
                }
            }
        }
        return closed;
    }

    static String normalize(String capability) {
        return capability.trim().toLowerCase(Locale.ROOT);
    }

    static Set<String> normalizeAll(Collection<String> capabilities) {
        Set<String> out = new LinkedHashSet<>();
        if (capabilities != null) {
            for (String capability : capabilities) {
                if (capability != null && !capability.isBlank()) {
                    out.add(normalize(capability));
                }
            }
        }
        return out;
    }
}
