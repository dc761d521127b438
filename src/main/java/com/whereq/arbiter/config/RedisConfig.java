package com.whereq.arbiter.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

/**
 * Redis template for the bandit state document, only when state lives in Redis.
 * The document is stored as a plain JSON string so it stays readable with redis-cli.
 */
@Configuration
@ConditionalOnProperty(name = "arbiter.state.backend", havingValue = "redis")
public class RedisConfig {

    @Bean
    @Primary
    public ReactiveRedisTemplate<String, String> stateRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }
}
