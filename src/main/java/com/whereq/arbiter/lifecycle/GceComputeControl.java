package com.whereq.arbiter.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.LifecycleControlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;

/**
 * Controls one Compute Engine VM through the Compute REST API.
 *
 * Commands are fire-and-forget: the returned zone operation is not awaited, a VM takes
 * roughly half a minute to boot and register its runner.
 * The bearer token comes from configuration, or from the instance metadata server when none is configured.
 */
@Slf4j
@Component
public class GceComputeControl implements ComputeControl {

    static final String RUNNING = "RUNNING";
    static final Set<String> STOPPED_STATES = Set.of("TERMINATED", "STOPPED");

    private final WebClient webClient;
    private final WebClient metadataClient;
    private final ArbiterProperties.GceConfig gce;
    private final Duration timeout;

    public GceComputeControl(WebClient.Builder webClientBuilder,
                             ArbiterProperties properties,
                             @Value("${arbiter.lifecycle.gce.metadata-url:http://metadata.google.internal/computeMetadata/v1}")
                             String metadataUrl) {
        this.gce = properties.getLifecycle().getGce();
        this.timeout = properties.getLifecycle().getTimeout();
        this.webClient = webClientBuilder.clone().baseUrl(gce.getBaseUrl()).build();
        this.metadataClient = webClientBuilder.clone().baseUrl(metadataUrl).build();
    }

    @Override
    public Mono<PowerTransition> start() {
        return status().flatMap(status -> {
            if (RUNNING.equals(status)) {
                log.info("VM {} already running", gce.getInstance());
                return Mono.just(PowerTransition.ALREADY_RUNNING);
            }
            if (STOPPED_STATES.contains(status)) {
                log.info("Starting VM {} (was {})", gce.getInstance(), status);
                return command("start").thenReturn(PowerTransition.STARTED);
            }
            return Mono.error(new LifecycleControlException("VM " + gce.getInstance() + " in unexpected state: " + status));
        });
    }

    @Override
    public Mono<PowerTransition> stop() {
        return status().flatMap(status -> {
            if (STOPPED_STATES.contains(status)) {
                log.info("VM {} already stopped", gce.getInstance());
                return Mono.just(PowerTransition.ALREADY_STOPPED);
            }
            if (RUNNING.equals(status)) {
                log.info("Stopping VM {}", gce.getInstance());
                return command("stop").thenReturn(PowerTransition.STOPPED);
            }
            return Mono.error(new LifecycleControlException("VM " + gce.getInstance() + " in unexpected state: " + status));
        });
    }

    @Override
    public Mono<String> status() {
        return requireConfigured()
            .then(accessToken())
            .flatMap(token -> webClient.get()
                .uri(instancePath())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout))
            .map(body -> body.path("status").asText("UNKNOWN"))
            .onErrorMap(e -> !(e instanceof LifecycleControlException),
                e -> new LifecycleControlException("Failed to read VM status: " + e.getMessage(), e));
    }

    private Mono<Void> command(String action) {
        return accessToken()
            .flatMap(token -> webClient.post()
                .uri(instancePath() + "/" + action)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout))
            .doOnNext(operation -> log.debug("VM {} {} operation: {}",
                gce.getInstance(), action, operation.path("name").asText()))
            .then()
            .onErrorMap(e -> !(e instanceof LifecycleControlException),
                e -> new LifecycleControlException("VM " + action + " failed: " + e.getMessage(), e));
    }

    private Mono<String> accessToken() {
        if (StringUtils.hasText(gce.getAccessToken())) {
            return Mono.just(gce.getAccessToken());
        }
        return metadataClient.get()
            .uri("/instance/service-accounts/default/token")
            .header("Metadata-Flavor", "Google")
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(body -> body.path("access_token").asText(""))
            .filter(StringUtils::hasText)
            .switchIfEmpty(Mono.error(new LifecycleControlException("No access token available for Compute API")));
    }

    private Mono<Void> requireConfigured() {
        if (!StringUtils.hasText(gce.getProject()) || !StringUtils.hasText(gce.getZone())
                || !StringUtils.hasText(gce.getInstance())) {
            return Mono.error(new LifecycleControlException(
                "GCE instance not configured (arbiter.lifecycle.gce.project/zone/instance)"));
        }
        return Mono.empty();
    }

    private String instancePath() {
        return "/projects/" + gce.getProject() + "/zones/" + gce.getZone() + "/instances/" + gce.getInstance();
    }
}
