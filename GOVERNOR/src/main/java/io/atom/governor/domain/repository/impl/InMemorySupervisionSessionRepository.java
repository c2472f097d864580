package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.SupervisionSession;
import io.atom.governor.domain.repository.SupervisionSessionRepository;
import io.atom.governor.error.InvalidStateException;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Simple in-memory implementation of {@link SupervisionSessionRepository}.
 */
@Repository
public class InMemorySupervisionSessionRepository implements SupervisionSessionRepository {

    private final Map<String, SupervisionSession> store = new ConcurrentHashMap<>();

    @Override
    public Mono<SupervisionSession> save(SupervisionSession session) {
        return Mono.fromSupplier(() -> {
            if (session.getId() == null || session.getId().isBlank()) {
                session.setId(UUID.randomUUID().toString());
            }
            if (session.getStartedAt() == null) {
                session.setStartedAt(Instant.now());
            }
            store.put(session.getId(), session);
            return session;
        });
    }

    @Override
    public Mono<SupervisionSession> findById(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.get(id));
    }

    @Override
    public Flux<SupervisionSession> findOpenByWorkspace(String workspaceId) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(session -> Objects.equals(session.getWorkspaceId(), workspaceId))
                .filter(SupervisionSession::isOpen)
                .sorted(Comparator.comparing(SupervisionSession::getStartedAt)));
    }

    @Override
    public Flux<SupervisionSession> findByAgentId(String agentId) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(session -> Objects.equals(session.getAgentId(), agentId))
                .sorted(Comparator.comparing(SupervisionSession::getStartedAt).reversed()));
    }

    @Override
    public Mono<SupervisionSession> updateIfOpen(String id, UnaryOperator<SupervisionSession> update) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.computeIfPresent(id, (key, session) -> {
            if (!session.isOpen()) {
                throw new InvalidStateException("Supervision session " + id + " is already " + session.getStatus());
            }
            return update.apply(session);
        }));
    }
}
