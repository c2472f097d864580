package io.atom.governor.cache;

import io.atom.governor.domain.model.MaturitySnapshot;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Short-lived cache of agent maturity, keyed by agent id.
 * The record store stays the source of truth; entries are a read optimisation only.
 */
public interface GovernanceCache {

    /**
     * Get a cached snapshot.
     *
     * @param agentId the agent ID
     * @return the snapshot, or empty on a miss
     */
    Mono<MaturitySnapshot> get(String agentId);

    /**
     * Cache a snapshot.
     *
     * @param agentId the agent ID
     * @param snapshot the maturity snapshot
     * @param ttl how long the entry stays valid
     * @return completion signal
     */
    Mono<Void> set(String agentId, MaturitySnapshot snapshot, Duration ttl);

    /**
     * Drop the entry for an agent.
     *
     * @param agentId the agent ID
     * @return completion signal
     */
    Mono<Void> invalidate(String agentId);
}
