package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.MaturityTransition;
import io.atom.governor.domain.repository.MaturityTransitionRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Simple in-memory implementation of {@link MaturityTransitionRepository}.
 */
@Repository
public class InMemoryMaturityTransitionRepository implements MaturityTransitionRepository {

    private final Queue<MaturityTransition> log = new ConcurrentLinkedQueue<>();

    @Override
    public Mono<MaturityTransition> append(MaturityTransition transition) {
        return Mono.fromSupplier(() -> {
            if (transition.getId() == null) {
                transition.setId(UUID.randomUUID().toString());
            }
            if (transition.getOccurredAt() == null) {
                transition.setOccurredAt(Instant.now());
            }
            log.add(transition);
            return transition;
        });
    }

    @Override
    public Flux<MaturityTransition> findByAgentId(String agentId) {
        return Flux.fromStream(() -> log.stream()
                .filter(transition -> Objects.equals(transition.getAgentId(), agentId)));
    }
}
