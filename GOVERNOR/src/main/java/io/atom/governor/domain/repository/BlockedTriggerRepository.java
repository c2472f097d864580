package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.BlockedTriggerContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for blocked trigger records.
 */
public interface BlockedTriggerRepository {

    Mono<BlockedTriggerContext> save(BlockedTriggerContext context);

    Mono<BlockedTriggerContext> findById(String id);

    Flux<BlockedTriggerContext> findByAgentId(String agentId);
}
