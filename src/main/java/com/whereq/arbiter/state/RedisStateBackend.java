package com.whereq.arbiter.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.StatePersistenceException;
import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Stores the state document as a single JSON string value in Redis
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "arbiter.state.backend", havingValue = "redis")
public class RedisStateBackend implements StateBackend {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;
    private final Duration timeout;

    public RedisStateBackend(ReactiveRedisTemplate<String, String> redisTemplate,
                             ObjectMapper objectMapper,
                             ArbiterProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getState().getRedisKey();
        this.timeout = properties.getState().getTimeout();
    }

    @Override
    public Mono<BanditState> load() {
        return redisTemplate.opsForValue().get(key)
            .timeout(timeout)
            .map(json -> {
                try {
                    return objectMapper.readValue(json, BanditState.class);
                } catch (JsonProcessingException e) {
                    throw new StatePersistenceException("Corrupt bandit state under Redis key " + key, e);
                }
            })
            .defaultIfEmpty(BanditState.empty())
            .onErrorMap(e -> !(e instanceof StatePersistenceException),
                e -> new StatePersistenceException("Failed to load bandit state from Redis key " + key, e));
    }

    @Override
    public Mono<Void> save(BanditState state) {
        return Mono.fromCallable(() -> {
            try {
                return objectMapper.writeValueAsString(state);
            } catch (JsonProcessingException e) {
                throw new StatePersistenceException("Failed to serialize bandit state", e);
            }
        })
        .flatMap(json -> redisTemplate.opsForValue().set(key, json))
        .timeout(timeout)
        .flatMap(stored -> stored
            ? Mono.<Void>empty()
            : Mono.<Void>error(new StatePersistenceException("Redis refused write of key " + key)))
        .doOnSuccess(v -> log.debug("Wrote bandit state to Redis key {}", key))
        .onErrorMap(e -> !(e instanceof StatePersistenceException),
            e -> new StatePersistenceException("Failed to save bandit state to Redis key " + key, e));
    }

    @Override
    public String name() {
        return "redis";
    }
}
