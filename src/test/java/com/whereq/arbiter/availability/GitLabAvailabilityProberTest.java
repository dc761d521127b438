package com.whereq.arbiter.availability;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.RunnerProfile;
import com.whereq.arbiter.ontology.CapabilityOntology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class GitLabAvailabilityProberTest {

    private CapabilityOntology ontology;
    private ArbiterProperties properties;
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        ontology = new CapabilityOntology();
        ontology.register(RunnerProfile.builder().runnerKey("nordic").gitlabRunnerId(1L)
            .declaredCapabilities(Set.of("docker")).build());
        ontology.register(RunnerProfile.builder().runnerKey("mac").gitlabRunnerId(2L)
            .declaredCapabilities(Set.of("docker")).build());
        ontology.register(RunnerProfile.builder().runnerKey("local")
            .declaredCapabilities(Set.of("shell")).build());

        properties = new ArbiterProperties();
        properties.getAvailability().setGitlabUrl("https://gitlab.example.com/api/v4");
        properties.getAvailability().setGitlabToken("secret-token");
        properties.getAvailability().setTimeout(Duration.ofMillis(500));
    }

    @Test
    void noTokenMeansUnknown() {
        properties.getAvailability().setGitlabToken(null);
        GitLabAvailabilityProber prober = prober(request -> Mono.error(new IllegalStateException("unexpected call")));

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> {
                assertTrue(snapshot.isUnknown());
                assertNotNull(snapshot.getReason());
            })
            .verifyComplete();
        assertTrue(requests.isEmpty());
    }

    @Test
    void splitsFleetIntoOnlineAndOffline() {
        GitLabAvailabilityProber prober = prober(request -> {
            String path = request.url().getPath();
            String status = path.endsWith("/runners/1") ? "online" : "offline";
            return Mono.just(json("{\"id\": 0, \"status\": \"" + status + "\"}"));
        });

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> {
                assertEquals(AvailabilitySnapshot.Status.KNOWN, snapshot.getStatus());
                assertEquals(Set.of("nordic", "local"), snapshot.getOnlineRunners());
                assertEquals(Set.of("mac"), snapshot.getOfflineRunners());
            })
            .verifyComplete();

        assertEquals(2, requests.size());
        assertEquals("secret-token", requests.get(0).headers().getFirst(GitLabAvailabilityProber.TOKEN_HEADER));
        assertEquals("/api/v4/runners/2", requests.get(0).url().getPath());
    }

    @Test
    void allRunnersOfflineIsKnownAndEmpty() {
        properties.getAvailability().setGitlabToken("t");
        ontology.register(RunnerProfile.builder().runnerKey("local").gitlabRunnerId(3L)
            .declaredCapabilities(Set.of("shell")).build());
        GitLabAvailabilityProber prober = prober(request -> Mono.just(json("{\"status\": \"offline\"}")));

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> {
                assertFalse(snapshot.isUnknown());
                assertTrue(snapshot.getOnlineRunners().isEmpty());
                assertEquals(3, snapshot.getOfflineRunners().size());
            })
            .verifyComplete();
    }

    @Test
    void httpErrorMeansUnknownNotOffline() {
        GitLabAvailabilityProber prober = prober(request -> Mono.just(
            ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> {
                assertTrue(snapshot.isUnknown());
                assertTrue(snapshot.getOnlineRunners().isEmpty());
                assertTrue(snapshot.getOfflineRunners().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    void connectionFailureMeansUnknown() {
        GitLabAvailabilityProber prober = prober(request -> Mono.error(new IOException("connection refused")));

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> assertTrue(snapshot.isUnknown()))
            .verifyComplete();
    }

    @Test
    void slowStatusFeedTimesOut() {
        properties.getAvailability().setTimeout(Duration.ofMillis(50));
        GitLabAvailabilityProber prober = prober(request -> Mono.never());

        StepVerifier.create(prober.probe())
            .assertNext(snapshot -> assertTrue(snapshot.isUnknown()))
            .verifyComplete();
    }

    private GitLabAvailabilityProber prober(ExchangeFunction exchange) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return exchange.exchange(request);
        });
        return new GitLabAvailabilityProber(builder, ontology, properties);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
