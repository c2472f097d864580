package io.atom.governor.cache.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.config.RedisConfig;
import io.atom.governor.domain.model.MaturitySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed maturity cache shared across service instances.
 * Values are stored as JSON strings under {@code <keyPrefix><agentId>}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "governor.cache", name = "backend", havingValue = "redis")
public class RedisGovernanceCache implements GovernanceCache {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final GovernorProperties.CacheProperties config;

    public RedisGovernanceCache(
            @Qualifier(RedisConfig.TEMPLATE_BEAN) ReactiveRedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            GovernorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getCache();
    }

    @Override
    public Mono<MaturitySnapshot> get(String agentId) {
        return redisTemplate.opsForValue()
                .get(key(agentId))
                .timeout(config.getTimeout())
                .flatMap(this::deserialize);
    }

    @Override
    public Mono<Void> set(String agentId, MaturitySnapshot snapshot, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return redisTemplate.opsForValue()
                .set(key(agentId), json, ttl)
                .timeout(config.getTimeout())
                .doOnSuccess(stored -> log.debug("Cached maturity for agent {}", agentId))
                .then();
    }

    @Override
    public Mono<Void> invalidate(String agentId) {
        return redisTemplate.delete(key(agentId))
                .timeout(config.getTimeout())
                .then();
    }

    private Mono<MaturitySnapshot> deserialize(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, MaturitySnapshot.class));
        } catch (JsonProcessingException e) {
            // unreadable entries count as a miss
            log.warn("Discarding unreadable maturity cache entry: {}", e.getMessage());
            return Mono.empty();
        }
    }

    private String key(String agentId) {
        return config.getKeyPrefix() + agentId;
    }
}
