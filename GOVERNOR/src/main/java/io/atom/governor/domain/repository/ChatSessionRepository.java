package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.ChatSession;
import reactor.core.publisher.Mono;

/**
 * Repository interface for chat sessions consulted during agent resolution.
 */
public interface ChatSessionRepository {

    Mono<ChatSession> save(ChatSession session);

    Mono<ChatSession> findById(String id);
}
