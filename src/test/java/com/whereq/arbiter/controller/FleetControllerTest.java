package com.whereq.arbiter.controller;

import com.whereq.arbiter.availability.AvailabilityProber;
import com.whereq.arbiter.dto.RunnerRegistrationRequest;
import com.whereq.arbiter.exception.LifecycleControlException;
import com.whereq.arbiter.exception.RunnerNotFoundException;
import com.whereq.arbiter.lifecycle.LifecycleController;
import com.whereq.arbiter.lifecycle.PowerTransition;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.LifecycleState;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.ontology.CapabilityOntology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = FleetController.class)
class FleetControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CapabilityOntology ontology;

    @MockBean
    private AvailabilityProber prober;

    @MockBean
    private LifecycleController lifecycle;

    @Test
    @DisplayName("Runners can be filtered by capability")
    void listRunnersWithCapability() {
        when(ontology.runnersWithCapability("macos")).thenReturn(List.of(profile("mac-docker", "docker", "linux", "macos")));

        webTestClient.get().uri("/api/v1/fleet/runners?capability=macos")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].runnerKey").isEqualTo("mac-docker");
    }

    @Test
    @DisplayName("Unknown runner is not found")
    void getUnknownRunner() {
        when(ontology.profile("ghost")).thenThrow(new RunnerNotFoundException("Runner not registered: ghost"));

        webTestClient.get().uri("/api/v1/fleet/runners/ghost")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Registration passes the declared capabilities to the ontology")
    void registerRunner() {
        when(ontology.register(any(RunnerProfile.class)))
            .thenReturn(profile("gpu-box", "gpu", "linux"));

        webTestClient.put().uri("/api/v1/fleet/runners/gpu-box")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RunnerRegistrationRequest.builder()
                .name("GPU Box")
                .capabilities(List.of("gpu", "linux"))
                .costPerMinute(0.05)
                .build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.runnerKey").isEqualTo("gpu-box");

        ArgumentCaptor<RunnerProfile> captor = ArgumentCaptor.forClass(RunnerProfile.class);
        verify(ontology).register(captor.capture());
        assertEquals("gpu-box", captor.getValue().getRunnerKey());
        assertEquals(Set.of("gpu", "linux"), captor.getValue().getDeclaredCapabilities());
        assertEquals(0.05, captor.getValue().getCostPerMinute());
    }

    @Test
    @DisplayName("Negative cost is rejected")
    void registerRunnerNegativeCost() {
        webTestClient.put().uri("/api/v1/fleet/runners/cheap")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RunnerRegistrationRequest.builder().costPerMinute(-1.0).build())
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("Availability exposes the probe result, including UNKNOWN")
    void availability() {
        when(prober.probe()).thenReturn(Mono.just(AvailabilitySnapshot.unknown("No GitLab API token configured")));

        webTestClient.get().uri("/api/v1/fleet/availability")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UNKNOWN")
            .jsonPath("$.reason").isEqualTo("No GitLab API token configured");
    }

    @Test
    @DisplayName("Lifecycle state is reported as is")
    void lifecycleState() {
        LifecycleState state = LifecycleState.initial();
        state.setAutoStarted(true);
        when(lifecycle.state()).thenReturn(state);

        webTestClient.get().uri("/api/v1/fleet/lifecycle")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.autoStarted").isEqualTo(true)
            .jsonPath("$.starting").isEqualTo(false);
    }

    @Test
    @DisplayName("Manual start goes to the control plane without taking ownership")
    void startCapacity() {
        when(lifecycle.manualStart()).thenReturn(Mono.just(PowerTransition.STARTED));

        webTestClient.post().uri("/api/v1/fleet/capacity/start")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.action").isEqualTo("start")
            .jsonPath("$.result").isEqualTo("STARTED");

        verify(lifecycle).manualStart();
        verify(lifecycle, never()).ensureCapacity();
    }

    @Test
    @DisplayName("Control plane failures surface as bad gateway")
    void stopCapacityFailure() {
        when(lifecycle.manualStop()).thenReturn(Mono.error(new LifecycleControlException("VM stop failed: 403")));

        webTestClient.post().uri("/api/v1/fleet/capacity/stop")
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
            .expectBody()
            .jsonPath("$.error").isEqualTo("VM stop failed: 403");
    }

    @Test
    @DisplayName("Capacity status is read from the control plane")
    void capacityStatus() {
        when(lifecycle.capacityStatus()).thenReturn(Mono.just("TERMINATED"));

        webTestClient.get().uri("/api/v1/fleet/capacity/status")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("TERMINATED");
    }

    private static RunnerProfile profile(String key, String... capabilities) {
        return RunnerProfile.builder()
            .runnerKey(key)
            .displayName(key)
            .capabilities(new LinkedHashSet<>(List.of(capabilities)))
            .build();
    }
}
