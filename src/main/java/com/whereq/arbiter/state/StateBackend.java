package com.whereq.arbiter.state;

import com.whereq.arbiter.model.BanditState;
import reactor.core.publisher.Mono;

/**
 * Durable home of the bandit state document.
 *
 * Implementations store the whole document at once; there is no partial update and no locking
 * between concurrent writers (last writer wins).
 */
public interface StateBackend {

    /**
     * Load the stored document
     *
     * @return Mono with the stored state, an empty state when nothing was stored yet
     */
    Mono<BanditState> load();

    /**
     * Replace the stored document
     *
     * @param state the state to store
     * @return Mono that completes when the state is durable
     */
    Mono<Void> save(BanditState state);

    /**
     * Short backend name for logs and health output
     */
    String name();
}
