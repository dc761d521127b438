package com.whereq.arbiter.controller;

import com.whereq.arbiter.dto.GitLabBuildEvent;
import com.whereq.arbiter.dto.OutcomeResponse;
import com.whereq.arbiter.service.RunnerSelectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Receives GitLab job events and learns from finished jobs.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@Tag(name = "Webhooks", description = "Job completion events from the CI system")
public class GitLabWebhookController {

    static final String TOKEN_HEADER = "X-Gitlab-Token";

    private final RunnerSelectionService selectionService;
    private final String secret;

    public GitLabWebhookController(RunnerSelectionService selectionService,
                                   @Value("${arbiter.webhook.secret:}") String secret) {
        this.selectionService = selectionService;
        this.secret = secret;
    }

    @PostMapping("/gitlab")
    @Operation(summary = "GitLab webhook", description = "Job events; finished jobs on known runners update the statistics")
    public Mono<ResponseEntity<OutcomeResponse>> handle(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token,
            @RequestBody GitLabBuildEvent event) {

        if (StringUtils.hasText(secret) && !secret.equals(token)) {
            log.warn("Rejected webhook with invalid token");
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(OutcomeResponse.rejected("Invalid webhook token")));
        }

        return selectionService.recordCompletionEvent(event)
            .doOnNext(response -> {
                if (response.getStatus() == OutcomeResponse.OutcomeStatus.IGNORED) {
                    log.debug("Ignored webhook event: {}", response.getReason());
                }
            })
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Failed to process webhook event", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(OutcomeResponse.rejected("Internal server error: " + e.getMessage())));
            });
    }
}
