package io.atom.governor.supervision;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.atom.governor.cache.impl.CaffeineGovernanceCache;
import io.atom.governor.client.PermissionChecker;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.model.SupervisionSession;
import io.atom.governor.domain.model.SupervisionSession.SupervisionStatus;
import io.atom.governor.domain.repository.impl.InMemoryAgentRepository;
import io.atom.governor.domain.repository.impl.InMemoryMaturityTransitionRepository;
import io.atom.governor.domain.repository.impl.InMemorySupervisionSessionRepository;
import io.atom.governor.error.EntityNotFoundException;
import io.atom.governor.error.InvalidStateException;
import io.atom.governor.governance.AgentGovernanceService;
import io.atom.governor.observability.GovernanceEventLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SupervisionService}.
 */
@ExtendWith(MockitoExtension.class)
class SupervisionServiceTest {

    @Mock
    private PermissionChecker permissionChecker;

    private InMemoryAgentRepository agentRepository;
    private InMemorySupervisionSessionRepository sessionRepository;
    private SupervisionService supervisionService;
    private Agent supervised;

    @BeforeEach
    void setUp() {
        GovernorProperties properties = new GovernorProperties();
        GovernanceEventLogger eventLogger = new GovernanceEventLogger(new ObjectMapper());
        agentRepository = new InMemoryAgentRepository();
        sessionRepository = new InMemorySupervisionSessionRepository();
        AgentGovernanceService governanceService = new AgentGovernanceService(
                agentRepository,
                new InMemoryMaturityTransitionRepository(),
                new CaffeineGovernanceCache(properties),
                permissionChecker,
                eventLogger,
                properties,
                new SimpleMeterRegistry());
        supervisionService = new SupervisionService(sessionRepository, governanceService, eventLogger, properties);

        supervised = agentRepository.save(Agent.builder()
                .name("Supervised")
                .status(MaturityLevel.SUPERVISED)
                .confidenceScore(0.75)
                .build()).block();
    }

    private SupervisionSession openSession(String workspaceId) {
        return sessionRepository.save(SupervisionSession.builder()
                .agentId(supervised.getId())
                .workspaceId(workspaceId)
                .startedAt(Instant.now())
                .build()).block();
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @ParameterizedTest
        @CsvSource({"5, 0.85", "4, 0.76", "3, 0.75", "2, 0.74", "1, 0.65"})
        @DisplayName("should convert the rating into a confidence change")
        void ratingToConfidence(int rating, double expectedConfidence) {
            SupervisionSession session = openSession("ws-1");

            StepVerifier.create(supervisionService.completeSupervision(session.getId(), rating))
                    .assertNext(completed -> {
                        assertThat(completed.getStatus()).isEqualTo(SupervisionStatus.COMPLETED);
                        assertThat(completed.getSupervisorRating()).isEqualTo(rating);
                        assertThat(completed.getCompletedAt()).isNotNull();
                    })
                    .verifyComplete();

            assertThat(supervised.getConfidenceScore()).isCloseTo(expectedConfidence, within(1e-9));
            assertThat(supervised.getStatus()).isEqualTo(MaturityLevel.SUPERVISED);
        }

        @Test
        @DisplayName("should reject ratings outside 1..5")
        void invalidRating() {
            SupervisionSession session = openSession("ws-1");

            StepVerifier.create(supervisionService.completeSupervision(session.getId(), 6))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse to complete a closed session")
        void completeTwice() {
            SupervisionSession session = openSession("ws-1");
            supervisionService.completeSupervision(session.getId(), 3).block();

            StepVerifier.create(supervisionService.completeSupervision(session.getId(), 5))
                    .expectError(InvalidStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should still complete the session when the supervised agent is gone")
        void completeForRemovedAgent() {
            SupervisionSession session = sessionRepository.save(SupervisionSession.builder()
                    .agentId("removed-agent")
                    .workspaceId("ws-1")
                    .startedAt(Instant.now())
                    .build()).block();

            StepVerifier.create(supervisionService.completeSupervision(session.getId(), 5))
                    .assertNext(completed -> {
                        assertThat(completed.getStatus()).isEqualTo(SupervisionStatus.COMPLETED);
                        assertThat(completed.getSupervisorRating()).isEqualTo(5);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should let exactly one of a concurrent completion and termination win")
        void concurrentClose() {
            for (int i = 0; i < 200; i++) {
                SupervisionSession session = openSession("ws-1");

                List<Signal<SupervisionSession>> outcomes = Flux.merge(
                                supervisionService.completeSupervision(session.getId(), 3)
                                        .subscribeOn(Schedulers.parallel()).materialize(),
                                supervisionService.terminate(session.getId())
                                        .subscribeOn(Schedulers.parallel()).materialize())
                        .filter(signal -> !signal.isOnComplete())
                        .collectList()
                        .block();

                assertThat(outcomes).filteredOn(Signal::isOnNext).hasSize(1);
                assertThat(outcomes).filteredOn(Signal::isOnError)
                        .singleElement()
                        .satisfies(signal -> assertThat(signal.getThrowable()).isInstanceOf(InvalidStateException.class));
            }
        }

        @Test
        @DisplayName("should fail with not found for unknown sessions")
        void unknownSession() {
            StepVerifier.create(supervisionService.completeSupervision("missing", 4))
                    .expectError(EntityNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should count interventions")
        void interventions() {
            SupervisionSession session = openSession("ws-1");

            supervisionService.recordIntervention(session.getId()).block();

            StepVerifier.create(supervisionService.recordIntervention(session.getId()))
                    .assertNext(updated -> assertThat(updated.getInterventionCount()).isEqualTo(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should terminate without touching confidence")
        void terminate() {
            SupervisionSession session = openSession("ws-1");

            StepVerifier.create(supervisionService.terminate(session.getId()))
                    .assertNext(terminated -> assertThat(terminated.getStatus()).isEqualTo(SupervisionStatus.TERMINATED))
                    .verifyComplete();
            assertThat(supervised.getConfidenceScore()).isEqualTo(0.75);
        }

        @Test
        @DisplayName("should list only open sessions of the workspace")
        void activeSessions() {
            SupervisionSession open = openSession("ws-1");
            SupervisionSession closed = openSession("ws-1");
            openSession("ws-2");
            supervisionService.terminate(closed.getId()).block();

            StepVerifier.create(supervisionService.getActiveSessions("ws-1"))
                    .assertNext(session -> assertThat(session.getId()).isEqualTo(open.getId()))
                    .verifyComplete();
        }
    }
}
