package com.whereq.arbiter.controller;

import com.whereq.arbiter.bandit.BanditEngine;
import com.whereq.arbiter.lifecycle.LifecycleController;
import com.whereq.arbiter.ontology.CapabilityOntology;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller reporting fleet size and learning progress.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private BanditEngine banditEngine;

    @Autowired
    private CapabilityOntology ontology;

    @Autowired
    private LifecycleController lifecycle;

    @GetMapping
    @Operation(summary = "Health check", description = "Check that the service is up and can read its statistics")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return banditEngine.stats()
            .map(stats -> {
                Map<String, Object> health = base();
                health.put("observations", stats.values().stream().mapToLong(s -> s.getPulls()).sum());
                return ResponseEntity.ok(health);
            })
            .onErrorResume(e -> {
                Map<String, Object> health = base();
                health.put("observations", "ERROR: " + e.getMessage());
                return Mono.just(ResponseEntity.ok(health));
            });
    }

    private Map<String, Object> base() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "whereq-arbiter");
        health.put("runners", ontology.runnerKeys().size());
        health.put("algorithm", banditEngine.getStrategy().algorithm());
        health.put("stateBackend", banditEngine.getStateBackendName());
        health.put("lifecycleEnabled", lifecycle.isEnabled());
        return health;
    }
}
