package com.whereq.arbiter.state;

import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local state. Suitable for a single node and for testing; everything is lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "arbiter.state.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryStateBackend implements StateBackend {

    private final AtomicReference<BanditState> current = new AtomicReference<>(BanditState.empty());

    @Override
    public Mono<BanditState> load() {
        return Mono.fromSupplier(() -> current.get().copy());
    }

    @Override
    public Mono<Void> save(BanditState state) {
        return Mono.fromRunnable(() -> {
            current.set(state.copy());
            log.debug("Stored bandit state in memory ({} arms)", state.getArms().size());
        });
    }

    @Override
    public String name() {
        return "memory";
    }
}
