package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.BlockedTriggerContext;
import io.atom.governor.domain.repository.BlockedTriggerRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory implementation of {@link BlockedTriggerRepository}.
 */
@Repository
public class InMemoryBlockedTriggerRepository implements BlockedTriggerRepository {

    private final Map<String, BlockedTriggerContext> store = new ConcurrentHashMap<>();

    @Override
    public Mono<BlockedTriggerContext> save(BlockedTriggerContext context) {
        return Mono.fromSupplier(() -> {
            if (context.getId() == null || context.getId().isBlank()) {
                context.setId(UUID.randomUUID().toString());
            }
            if (context.getCreatedAt() == null) {
                context.setCreatedAt(Instant.now());
            }
            store.put(context.getId(), context);
            return context;
        });
    }

    @Override
    public Mono<BlockedTriggerContext> findById(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.get(id));
    }

    @Override
    public Flux<BlockedTriggerContext> findByAgentId(String agentId) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(context -> Objects.equals(context.getAgentId(), agentId)));
    }
}
