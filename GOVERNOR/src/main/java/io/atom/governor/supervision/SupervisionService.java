package io.atom.governor.supervision;

import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.ImpactLevel;
import io.atom.governor.domain.model.SupervisionSession;
import io.atom.governor.domain.model.SupervisionSession.SupervisionStatus;
import io.atom.governor.domain.repository.SupervisionSessionRepository;
import io.atom.governor.error.EntityNotFoundException;
import io.atom.governor.error.StoreCallGuard;
import io.atom.governor.governance.AgentGovernanceService;
import io.atom.governor.observability.GovernanceEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Lifecycle of supervision sessions opened for supervised agents.
 * The supervisor rating on completion is converted into a confidence signal.
 */
@Service
@Slf4j
public class SupervisionService {

    private static final String ENTITY = "SupervisionSession";

    private final SupervisionSessionRepository sessionRepository;
    private final AgentGovernanceService governanceService;
    private final GovernanceEventLogger eventLogger;
    private final Duration storeTimeout;

    public SupervisionService(
            SupervisionSessionRepository sessionRepository,
            AgentGovernanceService governanceService,
            GovernanceEventLogger eventLogger,
            GovernorProperties properties) {
        this.sessionRepository = sessionRepository;
        this.governanceService = governanceService;
        this.eventLogger = eventLogger;
        this.storeTimeout = properties.getStore().getTimeout();
    }

    public Flux<SupervisionSession> getActiveSessions(String workspaceId) {
        return sessionRepository.findOpenByWorkspace(workspaceId)
                .transform(StoreCallGuard.guardAll("activeSessions", storeTimeout));
    }

    /**
     * Count a supervisor intervention on an open session.
     */
    public Mono<SupervisionSession> recordIntervention(String sessionId) {
        return updateOpenSession(sessionId, session -> {
                    session.setInterventionCount(session.getInterventionCount() + 1);
                    return session;
                })
                .transform(StoreCallGuard.guard("recordIntervention", storeTimeout));
    }

    /**
     * Close a session with a supervisor rating.
     *
     * @param supervisorRating 1 (poor) to 5 (excellent)
     * @throws IllegalArgumentException if the rating is outside 1..5
     */
    public Mono<SupervisionSession> completeSupervision(String sessionId, int supervisorRating) {
        if (supervisorRating < 1 || supervisorRating > 5) {
            return Mono.error(new IllegalArgumentException("Supervisor rating must be between 1 and 5: " + supervisorRating));
        }
        return updateOpenSession(sessionId, session -> {
                    session.setStatus(SupervisionStatus.COMPLETED);
                    session.setSupervisorRating(supervisorRating);
                    session.setCompletedAt(Instant.now());
                    return session;
                })
                .transform(StoreCallGuard.guard("completeSupervision", storeTimeout))
                .flatMap(session -> {
                    eventLogger.logSupervisionCompleted(session.getId(), session.getAgentId(),
                            supervisorRating, session.getInterventionCount());
                    return applyRating(session, supervisorRating).thenReturn(session);
                });
    }

    /**
     * Stop an open session without a rating.
     */
    public Mono<SupervisionSession> terminate(String sessionId) {
        return updateOpenSession(sessionId, session -> {
                    session.setStatus(SupervisionStatus.TERMINATED);
                    session.setCompletedAt(Instant.now());
                    return session;
                })
                .transform(StoreCallGuard.guard("terminateSupervision", storeTimeout))
                .doOnNext(session -> log.info("Supervision session {} terminated", session.getId()));
    }

    private Mono<Void> applyRating(SupervisionSession session, int rating) {
        Mono<?> update;
        switch (rating) {
            case 5:
                update = governanceService.updateConfidence(session.getAgentId(), true, ImpactLevel.HIGH);
                break;
            case 4:
                update = governanceService.updateConfidence(session.getAgentId(), true, ImpactLevel.LOW);
                break;
            case 2:
                update = governanceService.updateConfidence(session.getAgentId(), false, ImpactLevel.LOW);
                break;
            case 1:
                update = governanceService.updateConfidence(session.getAgentId(), false, ImpactLevel.HIGH);
                break;
            default:
                return Mono.empty();
        }
        return update.then()
                .onErrorResume(EntityNotFoundException.class, e -> {
                    log.warn("Supervised agent {} of session {} no longer exists", session.getAgentId(), session.getId());
                    return Mono.empty();
                });
    }

    private Mono<SupervisionSession> updateOpenSession(String sessionId, UnaryOperator<SupervisionSession> update) {
        return sessionRepository.updateIfOpen(sessionId, update)
                .switchIfEmpty(Mono.error(() -> new EntityNotFoundException(ENTITY, sessionId)));
    }
}
