package com.whereq.arbiter.state;

import com.whereq.arbiter.model.BanditState;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateBackendTest {

    private final InMemoryStateBackend backend = new InMemoryStateBackend();

    @Test
    void startsEmpty() {
        StepVerifier.create(backend.load())
            .assertNext(state -> assertTrue(state.getArms().isEmpty()))
            .verifyComplete();
    }

    @Test
    void loadReturnsWhatWasSaved() {
        BanditState state = new BanditState();
        state.armOrCreate("R1").record(1.5, true, 30);

        backend.save(state).block();

        assertEquals(state, backend.load().block());
    }

    @Test
    void storedDocumentIsIsolatedFromCallers() {
        BanditState state = new BanditState();
        state.armOrCreate("R1").record(1.5, true, 30);
        backend.save(state).block();

        state.armOrCreate("R1").record(1.0, true, 10);
        BanditState loaded = backend.load().block();
        loaded.armOrCreate("R2");

        BanditState again = backend.load().block();
        assertEquals(1, again.pulls("R1"));
        assertTrue(again.arm("R2").isEmpty());
    }
}
