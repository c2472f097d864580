package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.repository.AgentRepository;
import io.atom.governor.error.InvalidStateException;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Simple in-memory implementation of {@link AgentRepository}.
 * Row-level mutations go through {@link ConcurrentHashMap#computeIfPresent}, which serialises writers per agent.
 */
@Repository
public class InMemoryAgentRepository implements AgentRepository {

    private final Map<String, Agent> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Agent> save(Agent agent) {
        return Mono.fromSupplier(() -> {
            if (agent.getId() == null || agent.getId().isBlank()) {
                agent.setId(UUID.randomUUID().toString());
            }
            Instant now = Instant.now();
            if (agent.getCreatedAt() == null) {
                agent.setCreatedAt(now);
            }
            agent.setUpdatedAt(now);
            store.put(agent.getId(), agent);
            return agent;
        });
    }

    @Override
    public Mono<Agent> findById(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.get(id));
    }

    @Override
    public Mono<Agent> findByModule(String modulePath, String className) {
        return Flux.fromStream(() -> store.values().stream()
                        .filter(agent -> Objects.equals(agent.getModulePath(), modulePath)
                                && Objects.equals(agent.getClassName(), className)))
                .next();
    }

    @Override
    public Flux<Agent> findAll() {
        return Flux.fromStream(() -> store.values().stream());
    }

    @Override
    public Flux<Agent> findByCategory(String category) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(agent -> Objects.equals(agent.getCategory(), category)));
    }

    @Override
    public Mono<Agent> updateConfidence(String id, DoubleUnaryOperator update) {
        return Mono.fromSupplier(() -> store.computeIfPresent(id, (key, agent) -> {
            agent.setConfidenceScore(update.applyAsDouble(agent.effectiveConfidence()));
            agent.setUpdatedAt(Instant.now());
            return agent;
        }));
    }

    @Override
    public Mono<Agent> transitionStatus(String id, MaturityLevel expected, MaturityLevel target) {
        return Mono.fromSupplier(() -> store.computeIfPresent(id, (key, agent) -> {
            if (agent.effectiveStatus() != expected) {
                throw new InvalidStateException("Agent " + id + " changed maturity concurrently: expected "
                        + expected.getValue() + " but found " + agent.effectiveStatus().getValue());
            }
            agent.setStatus(target);
            agent.setUpdatedAt(Instant.now());
            return agent;
        }));
    }
}
