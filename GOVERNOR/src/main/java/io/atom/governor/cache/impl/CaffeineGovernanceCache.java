package io.atom.governor.cache.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.MaturitySnapshot;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Process-local maturity cache backed by Caffeine.
 * Entries expire after the TTL given on write, capped by the configured maturity TTL.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "governor.cache", name = "backend", havingValue = "local", matchIfMissing = true)
public class CaffeineGovernanceCache implements GovernanceCache {

    private final Cache<String, CachedMaturity> cache;

    @Autowired
    public CaffeineGovernanceCache(GovernorProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    CaffeineGovernanceCache(GovernorProperties properties, Ticker ticker) {
        GovernorProperties.CacheProperties config = properties.getCache();
        long maxTtlNanos = config.getMaturityTtl().toNanos();

        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry(maxTtlNanos))
                .maximumSize(config.getMaxSize())
                .ticker(ticker)
                .recordStats()
                .build();

        log.info("Initialized local governance cache: ttl={}, maxSize={}",
                config.getMaturityTtl(), config.getMaxSize());
    }

    @Override
    public Mono<MaturitySnapshot> get(String agentId) {
        return Mono.fromSupplier(() -> {
            CachedMaturity cached = cache.getIfPresent(agentId);
            return cached != null ? cached.snapshot() : null;
        });
    }

    @Override
    public Mono<Void> set(String agentId, MaturitySnapshot snapshot, Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(agentId, new CachedMaturity(snapshot, ttl.toNanos())));
    }

    @Override
    public Mono<Void> invalidate(String agentId) {
        return Mono.fromRunnable(() -> cache.invalidate(agentId));
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return CacheStats.builder()
                .size(cache.estimatedSize())
                .hitCount(stats.hitCount())
                .missCount(stats.missCount())
                .hitRate(stats.hitRate())
                .evictionCount(stats.evictionCount())
                .build();
    }

    private record CachedMaturity(MaturitySnapshot snapshot, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<String, CachedMaturity> {

        private final long maxTtlNanos;

        PerEntryExpiry(long maxTtlNanos) {
            this.maxTtlNanos = maxTtlNanos;
        }

        @Override
        public long expireAfterCreate(String key, CachedMaturity value, long currentTime) {
            return Math.max(0L, Math.min(value.ttlNanos(), maxTtlNanos));
        }

        @Override
        public long expireAfterUpdate(String key, CachedMaturity value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CachedMaturity value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Data
    @Builder
    public static class CacheStats {
        private long size;
        private long hitCount;
        private long missCount;
        private double hitRate;
        private long evictionCount;
    }
}
