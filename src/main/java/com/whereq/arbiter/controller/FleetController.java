package com.whereq.arbiter.controller;

import com.whereq.arbiter.availability.AvailabilityProber;
import com.whereq.arbiter.dto.RunnerRegistrationRequest;
import com.whereq.arbiter.exception.LifecycleControlException;
import com.whereq.arbiter.exception.RunnerNotFoundException;
import com.whereq.arbiter.lifecycle.LifecycleController;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.LifecycleState;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.ontology.CapabilityOntology;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the runner fleet: registrations, availability and on-demand capacity state.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/fleet")
@RequiredArgsConstructor
@Slf4j
@Validated
@Tag(name = "Fleet", description = "Runner registrations, availability and on-demand capacity")
public class FleetController {

    private final CapabilityOntology ontology;
    private final AvailabilityProber prober;
    private final LifecycleController lifecycle;

    @GetMapping("/runners")
    @Operation(summary = "List runners", description = "Registered runners with their closed capability sets")
    public Mono<ResponseEntity<List<RunnerProfile>>> listRunners(
            @RequestParam(value = "capability", required = false) String capability) {
        List<RunnerProfile> runners = capability != null
            ? ontology.runnersWithCapability(capability)
            : ontology.profiles();
        return Mono.just(ResponseEntity.ok(runners));
    }

    @GetMapping("/runners/{key}")
    @Operation(summary = "Get runner", description = "One registered runner")
    public Mono<ResponseEntity<RunnerProfile>> getRunner(@PathVariable String key) {
        return Mono.fromCallable(() -> ontology.profile(key))
            .map(ResponseEntity::ok)
            .onErrorResume(RunnerNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    @PutMapping("/runners/{key}")
    @Operation(summary = "Register runner", description = "Register a runner or replace a registered runner's profile")
    public Mono<ResponseEntity<RunnerProfile>> registerRunner(@PathVariable String key,
                                                              @Valid @RequestBody RunnerRegistrationRequest request) {
        log.info("Runner registration: key={}, capabilities={}", key, request.getCapabilities());

        return Mono.fromCallable(() -> ontology.register(RunnerProfile.builder()
                .runnerKey(key)
                .displayName(request.getName())
                .tags(List.copyOf(request.getTags()))
                .declaredCapabilities(new LinkedHashSet<>(request.getCapabilities()))
                .costPerMinute(request.getCostPerMinute())
                .executorClass(request.getExecutorClass())
                .gitlabRunnerId(request.getGitlabRunnerId())
                .onDemand(request.isOnDemand())
                .build()))
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Invalid runner registration for {}: {}", key, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @GetMapping("/availability")
    @Operation(summary = "Probe availability", description = "Which runners the CI system reports online right now")
    public Mono<ResponseEntity<AvailabilitySnapshot>> availability() {
        return prober.probe()
            .map(ResponseEntity::ok);
    }

    @PostMapping("/capacity/start")
    @Operation(summary = "Start capacity", description = "Power on-demand capacity on by hand; it is never stopped by the idle timer")
    public Mono<ResponseEntity<Map<String, String>>> startCapacity() {
        return lifecycle.manualStart()
            .map(transition -> ResponseEntity.ok(Map.of("action", "start", "result", transition.name())))
            .onErrorResume(LifecycleControlException.class, e -> {
                log.error("Manual start failed: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("action", "start", "error", e.getMessage())));
            });
    }

    @PostMapping("/capacity/stop")
    @Operation(summary = "Stop capacity", description = "Power on-demand capacity off by hand")
    public Mono<ResponseEntity<Map<String, String>>> stopCapacity() {
        return lifecycle.manualStop()
            .map(transition -> ResponseEntity.ok(Map.of("action", "stop", "result", transition.name())))
            .onErrorResume(LifecycleControlException.class, e -> {
                log.error("Manual stop failed: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("action", "stop", "error", e.getMessage())));
            });
    }

    @GetMapping("/capacity/status")
    @Operation(summary = "Capacity power status", description = "Power status reported by the compute control plane")
    public Mono<ResponseEntity<Map<String, String>>> capacityStatus() {
        return lifecycle.capacityStatus()
            .map(status -> ResponseEntity.ok(Map.of("status", status)))
            .onErrorResume(LifecycleControlException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()))));
    }

    @GetMapping("/lifecycle")
    @Operation(summary = "Capacity state", description = "Whether on-demand capacity was started here and when it shuts down")
    public Mono<ResponseEntity<LifecycleState>> lifecycle() {
        return Mono.just(ResponseEntity.ok(lifecycle.state()));
    }
}
