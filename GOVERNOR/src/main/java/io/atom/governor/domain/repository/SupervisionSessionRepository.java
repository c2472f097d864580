package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.SupervisionSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Repository interface for supervision sessions.
 */
public interface SupervisionSessionRepository {

    Mono<SupervisionSession> save(SupervisionSession session);

    Mono<SupervisionSession> findById(String id);

    /**
     * Sessions still in ACTIVE or RUNNING state for a workspace.
     */
    Flux<SupervisionSession> findOpenByWorkspace(String workspaceId);

    Flux<SupervisionSession> findByAgentId(String agentId);

    /**
     * Apply an update only while the session is still open.
     *
     * @return the updated session, empty when absent, or an error when the session was closed concurrently
     */
    Mono<SupervisionSession> updateIfOpen(String id, UnaryOperator<SupervisionSession> update);
}
