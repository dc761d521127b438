package com.whereq.arbiter.controller;

import com.whereq.arbiter.dto.GitLabBuildEvent;
import com.whereq.arbiter.dto.OutcomeResponse;
import com.whereq.arbiter.service.RunnerSelectionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = GitLabWebhookController.class, properties = "arbiter.webhook.secret=s3cret")
class GitLabWebhookControllerTest {

    private static final String BUILD_EVENT = """
        {
          "object_kind": "build",
          "build_name": "test",
          "build_status": "success",
          "build_duration": 42.5,
          "project_id": 7,
          "runner": {"id": 51337426, "description": "Linux Docker Runner", "active": true}
        }
        """;

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RunnerSelectionService selectionService;

    @Test
    @DisplayName("Events with the configured token are processed")
    void acceptsValidToken() {
        when(selectionService.recordCompletionEvent(any(GitLabBuildEvent.class)))
            .thenReturn(Mono.just(OutcomeResponse.updated("linux-docker", 0.5)));

        webTestClient.post().uri("/api/v1/webhooks/gitlab")
            .header(GitLabWebhookController.TOKEN_HEADER, "s3cret")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BUILD_EVENT)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UPDATED")
            .jsonPath("$.runnerKey").isEqualTo("linux-docker");
    }

    @Test
    @DisplayName("Events with a wrong or missing token are unauthorized")
    void rejectsInvalidToken() {
        webTestClient.post().uri("/api/v1/webhooks/gitlab")
            .header(GitLabWebhookController.TOKEN_HEADER, "guess")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BUILD_EVENT)
            .exchange()
            .expectStatus().isUnauthorized();

        webTestClient.post().uri("/api/v1/webhooks/gitlab")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BUILD_EVENT)
            .exchange()
            .expectStatus().isUnauthorized();

        verifyNoInteractions(selectionService);
    }

    @Test
    @DisplayName("Ignored events are still acknowledged")
    void acknowledgesIgnoredEvents() {
        when(selectionService.recordCompletionEvent(any(GitLabBuildEvent.class)))
            .thenReturn(Mono.just(OutcomeResponse.ignored("Unhandled event: push")));

        webTestClient.post().uri("/api/v1/webhooks/gitlab")
            .header(GitLabWebhookController.TOKEN_HEADER, "s3cret")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"object_kind\": \"push\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("IGNORED")
            .jsonPath("$.reason").isEqualTo("Unhandled event: push");
    }
}
