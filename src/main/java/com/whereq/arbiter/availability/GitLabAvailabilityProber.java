package com.whereq.arbiter.availability;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.AvailabilityProbeException;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.ontology.CapabilityOntology;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads runner status from the GitLab REST API ({@code GET /runners/:id}).
 *
 * Runners registered without a GitLab runner id cannot be probed and count as online.
 * Without an API token, or when any status call fails, the whole probe is UNKNOWN.
 */
@Slf4j
@Component
public class GitLabAvailabilityProber implements AvailabilityProber {

    static final String TOKEN_HEADER = "PRIVATE-TOKEN";
    static final String ONLINE = "online";

    private final WebClient webClient;
    private final CapabilityOntology ontology;
    private final String token;
    private final Duration timeout;

    public GitLabAvailabilityProber(WebClient.Builder webClientBuilder,
                                    CapabilityOntology ontology,
                                    ArbiterProperties properties) {
        ArbiterProperties.AvailabilityConfig config = properties.getAvailability();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getGitlabUrl())
            .build();
        this.ontology = ontology;
        this.token = config.getGitlabToken();
        this.timeout = config.getTimeout();
    }

    @Override
    public Mono<AvailabilitySnapshot> probe() {
        if (!StringUtils.hasText(token)) {
            log.warn("No GitLab API token configured, runner availability unknown");
            return Mono.just(AvailabilitySnapshot.unknown("GitLab API token not configured"));
        }

        return Mono.defer(() -> {
            List<RunnerProfile> runners = ontology.profiles();
            Set<String> online = new TreeSet<>();
            Set<String> offline = new TreeSet<>();

            return Flux.fromIterable(runners)
                .concatMap(runner -> isOnline(runner)
                    .doOnNext(up -> (up ? online : offline).add(runner.getRunnerKey())))
                .then(Mono.fromSupplier(() -> {
                    log.info("Runner availability: {} online, {} offline", online.size(), offline.size());
                    return AvailabilitySnapshot.known(online, offline);
                }));
        })
        .onErrorResume(e -> {
            log.warn("Runner availability probe failed, treating fleet status as unknown: {}", e.getMessage());
            return Mono.just(AvailabilitySnapshot.unknown(e.getMessage()));
        });
    }

    private Mono<Boolean> isOnline(RunnerProfile runner) {
        if (runner.getGitlabRunnerId() == null) {
            log.debug("Runner {} has no GitLab id, assuming online", runner.getRunnerKey());
            return Mono.just(true);
        }

        return webClient.get()
            .uri("/runners/{id}", runner.getGitlabRunnerId())
            .header(TOKEN_HEADER, token)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(body -> {
                String status = body.path("status").asText("");
                log.debug("Runner {} (GitLab id {}) status: {}", runner.getRunnerKey(), runner.getGitlabRunnerId(), status);
                return ONLINE.equals(status);
            })
            .switchIfEmpty(Mono.error(new AvailabilityProbeException(
                "Empty status response for runner " + runner.getRunnerKey())))
            .onErrorMap(e -> !(e instanceof AvailabilityProbeException),
                e -> new AvailabilityProbeException(
                    "Could not check runner " + runner.getRunnerKey() + ": " + e.getMessage(), e));
    }
}
