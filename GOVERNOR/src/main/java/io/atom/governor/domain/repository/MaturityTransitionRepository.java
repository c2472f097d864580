package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.MaturityTransition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit trail of promotions and demotions.
 */
public interface MaturityTransitionRepository {

    Mono<MaturityTransition> append(MaturityTransition transition);

    /**
     * Transitions of one agent, oldest first.
     */
    Flux<MaturityTransition> findByAgentId(String agentId);
}
