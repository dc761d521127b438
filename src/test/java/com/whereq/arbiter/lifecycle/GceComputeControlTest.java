package com.whereq.arbiter.lifecycle;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.LifecycleControlException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class GceComputeControlTest {

    private static final String INSTANCE_PATH =
        "/compute/v1/projects/ci-project/zones/europe-north2-a/instances/gitlab-runner-nordic";

    private ArbiterProperties properties;
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new ArbiterProperties();
        ArbiterProperties.GceConfig gce = properties.getLifecycle().getGce();
        gce.setProject("ci-project");
        gce.setZone("europe-north2-a");
        gce.setInstance("gitlab-runner-nordic");
        gce.setAccessToken("ya29.test");
    }

    @Test
    void startsTerminatedInstance() {
        GceComputeControl control = control("TERMINATED");

        StepVerifier.create(control.start())
            .expectNext(PowerTransition.STARTED)
            .verifyComplete();

        assertEquals(2, requests.size());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertEquals(INSTANCE_PATH, requests.get(0).url().getPath());
        assertEquals("Bearer ya29.test", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(HttpMethod.POST, requests.get(1).method());
        assertEquals(INSTANCE_PATH + "/start", requests.get(1).url().getPath());
    }

    @Test
    void leavesRunningInstanceAlone() {
        GceComputeControl control = control("RUNNING");

        StepVerifier.create(control.start())
            .expectNext(PowerTransition.ALREADY_RUNNING)
            .verifyComplete();

        assertEquals(1, requests.size());
    }

    @Test
    void stopsRunningInstance() {
        GceComputeControl control = control("RUNNING");

        StepVerifier.create(control.stop())
            .expectNext(PowerTransition.STOPPED)
            .verifyComplete();

        assertEquals(INSTANCE_PATH + "/stop", requests.get(1).url().getPath());
    }

    @Test
    void stopOnStoppedInstanceIsNoOp() {
        GceComputeControl control = control("STOPPED");

        StepVerifier.create(control.stop())
            .expectNext(PowerTransition.ALREADY_STOPPED)
            .verifyComplete();
        assertEquals(1, requests.size());
    }

    @Test
    void transitionalStateIsAnError() {
        GceComputeControl control = control("STOPPING");

        StepVerifier.create(control.start())
            .expectError(LifecycleControlException.class)
            .verify();
    }

    @Test
    void apiFailureIsAnError() {
        GceComputeControl control = new GceComputeControl(
            WebClient.builder().exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.FORBIDDEN).build())),
            properties, "http://metadata.test/computeMetadata/v1");

        StepVerifier.create(control.start())
            .expectError(LifecycleControlException.class)
            .verify();
    }

    @Test
    void unconfiguredInstanceIsAnError() {
        properties.getLifecycle().getGce().setProject(null);
        GceComputeControl control = control("RUNNING");

        StepVerifier.create(control.status())
            .expectError(LifecycleControlException.class)
            .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    void fetchesTokenFromMetadataServerWhenNoneConfigured() {
        properties.getLifecycle().getGce().setAccessToken(null);
        GceComputeControl control = control("RUNNING");

        StepVerifier.create(control.status())
            .expectNext("RUNNING")
            .verifyComplete();

        assertEquals("/computeMetadata/v1/instance/service-accounts/default/token", requests.get(0).url().getPath());
        assertEquals("Google", requests.get(0).headers().getFirst("Metadata-Flavor"));
        assertEquals("Bearer metadata-token", requests.get(1).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    private GceComputeControl control(String instanceStatus) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            String path = request.url().getPath();
            if (path.endsWith("/token")) {
                return Mono.just(json("{\"access_token\": \"metadata-token\", \"expires_in\": 3599}"));
            }
            if (request.method() == HttpMethod.POST) {
                return Mono.just(json("{\"name\": \"operation-123\", \"status\": \"RUNNING\"}"));
            }
            return Mono.just(json("{\"name\": \"gitlab-runner-nordic\", \"status\": \"" + instanceStatus + "\"}"));
        });
        return new GceComputeControl(builder, properties, "http://metadata.test/computeMetadata/v1");
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
