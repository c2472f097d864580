package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.ChatSession;
import io.atom.governor.domain.repository.ChatSessionRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory implementation of {@link ChatSessionRepository}.
 */
@Repository
public class InMemoryChatSessionRepository implements ChatSessionRepository {

    private final Map<String, ChatSession> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ChatSession> save(ChatSession session) {
        return Mono.fromSupplier(() -> {
            if (session.getId() == null || session.getId().isBlank()) {
                session.setId(UUID.randomUUID().toString());
            }
            Instant now = Instant.now();
            if (session.getCreatedAt() == null) {
                session.setCreatedAt(now);
            }
            session.setUpdatedAt(now);
            store.put(session.getId(), session);
            return session;
        });
    }

    @Override
    public Mono<ChatSession> findById(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.get(id));
    }
}
