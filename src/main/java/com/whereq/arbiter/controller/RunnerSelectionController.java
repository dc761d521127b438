package com.whereq.arbiter.controller;

import com.whereq.arbiter.dto.JobDeclaration;
import com.whereq.arbiter.dto.OutcomeRequest;
import com.whereq.arbiter.dto.OutcomeResponse;
import com.whereq.arbiter.dto.SelectionResponse;
import com.whereq.arbiter.dto.StatsResponse;
import com.whereq.arbiter.exception.RunnerNotFoundException;
import com.whereq.arbiter.exception.UnknownRunnerException;
import com.whereq.arbiter.model.FeasibilityResult;
import com.whereq.arbiter.service.RunnerSelectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for runner selection and outcome feedback.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/runners")
@RequiredArgsConstructor
@Slf4j
@Validated
@Tag(name = "Runner Selection", description = "Select runners for jobs and report job outcomes")
public class RunnerSelectionController {

    private final RunnerSelectionService selectionService;

    @PostMapping("/select")
    @Operation(
        summary = "Select a runner",
        description = "Solve the job's capability constraints, check fleet availability and pick a runner",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = JobDeclaration.class),
                examples = {
                    @ExampleObject(
                        name = "Docker job",
                        value = """
                        {
                          "jobName": "test",
                          "tags": ["docker-any"],
                          "image": "python:3.11-slim",
                          "services": ["postgres:16"],
                          "timeout": "30m"
                        }
                        """
                    )
                }
            )
        )
    )
    public Mono<ResponseEntity<SelectionResponse>> select(@RequestBody JobDeclaration declaration) {
        log.info("Runner selection request: job={}, tags={}, image={}",
            declaration.getJobName(), declaration.getTags(), declaration.getImage());

        return selectionService.selectRunner(declaration)
            .map(result -> ResponseEntity.ok(SelectionResponse.of(result)))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Invalid job declaration: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during runner selection", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @PostMapping("/outcomes")
    @Operation(summary = "Report a job outcome", description = "Fold a finished job into the runner statistics")
    public Mono<ResponseEntity<OutcomeResponse>> reportOutcome(@Valid @RequestBody OutcomeRequest request) {
        log.info("Outcome report: runner={}, success={}, duration={}s, job={}",
            request.getRunnerKey(), request.getSuccess(), request.getDurationSeconds(), request.getJobName());

        return selectionService.reportOutcome(request.getRunnerKey(), request.getSuccess(),
                request.getDurationSeconds(), request.getCostPerMinute())
            .map(reward -> ResponseEntity.ok(OutcomeResponse.updated(request.getRunnerKey(), reward)))
            .onErrorResume(UnknownRunnerException.class, e -> {
                log.warn("Outcome rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(OutcomeResponse.rejected(e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e ->
                Mono.just(ResponseEntity.badRequest().body(OutcomeResponse.rejected(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error recording outcome for {}", request.getRunnerKey(), e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(OutcomeResponse.rejected("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping("/stats")
    @Operation(summary = "Runner statistics", description = "Pulls, mean reward, success rate and average duration per runner")
    public Mono<ResponseEntity<StatsResponse>> stats() {
        return selectionService.getStats()
            .map(ResponseEntity::ok);
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset statistics", description = "Forget every recorded outcome")
    public Mono<ResponseEntity<Map<String, String>>> reset() {
        log.info("Statistics reset requested");
        return selectionService.reset()
            .thenReturn(ResponseEntity.ok(Map.of("status", "reset")));
    }

    @PostMapping(value = "/plan", consumes = {MediaType.TEXT_PLAIN_VALUE, "application/x-yaml", "application/yaml"})
    @Operation(summary = "Plan a pipeline", description = "Constraint feasibility for every job of a .gitlab-ci.yml")
    public Mono<ResponseEntity<Map<String, FeasibilityResult>>> plan(@RequestBody String pipelineYaml) {
        return Mono.fromCallable(() -> selectionService.planPipeline(pipelineYaml))
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Rejected pipeline file: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(RunnerNotFoundException.class, e -> {
                log.error("Fleet changed during planning: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build());
            });
    }
}
