package io.atom.governor.proposal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.atom.governor.cache.impl.CaffeineGovernanceCache;
import io.atom.governor.client.PermissionChecker;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.model.AgentProposal.ProposalStatus;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.repository.impl.InMemoryAgentProposalRepository;
import io.atom.governor.domain.repository.impl.InMemoryAgentRepository;
import io.atom.governor.domain.repository.impl.InMemoryMaturityTransitionRepository;
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
 * Unit tests for {@link ProposalService}.
 */
@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    @Mock
    private PermissionChecker permissionChecker;

    private InMemoryAgentRepository agentRepository;
    private InMemoryAgentProposalRepository proposalRepository;
    private ProposalService proposalService;
    private Agent intern;

    @BeforeEach
    void setUp() {
        GovernorProperties properties = new GovernorProperties();
        GovernanceEventLogger eventLogger = new GovernanceEventLogger(new ObjectMapper());
        agentRepository = new InMemoryAgentRepository();
        proposalRepository = new InMemoryAgentProposalRepository();
        AgentGovernanceService governanceService = new AgentGovernanceService(
                agentRepository,
                new InMemoryMaturityTransitionRepository(),
                new CaffeineGovernanceCache(properties),
                permissionChecker,
                eventLogger,
                properties,
                new SimpleMeterRegistry());
        proposalService = new ProposalService(proposalRepository, governanceService, eventLogger, properties);

        intern = agentRepository.save(Agent.builder()
                .name("Intern")
                .status(MaturityLevel.INTERN)
                .confidenceScore(0.6)
                .build()).block();
    }

    private AgentProposal saveProposal(String type, String workspaceId, Instant createdAt) {
        return proposalRepository.save(AgentProposal.builder()
                .agentId(intern.getId())
                .proposalType(type)
                .title("Proposed action: update")
                .workspaceId(workspaceId)
                .createdAt(createdAt)
                .build()).block();
    }

    @Nested
    @DisplayName("Review")
    class ReviewTests {

        @Test
        @DisplayName("should approve a pending proposal and reward the agent")
        void approve() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());

            StepVerifier.create(proposalService.approveProposal(proposal.getId(), "reviewer-1", "looks good"))
                    .assertNext(approved -> {
                        assertThat(approved.getStatus()).isEqualTo(ProposalStatus.APPROVED);
                        assertThat(approved.getReviewedBy()).isEqualTo("reviewer-1");
                        assertThat(approved.getReviewNote()).isEqualTo("looks good");
                        assertThat(approved.getReviewedAt()).isNotNull();
                    })
                    .verifyComplete();
            assertThat(intern.getConfidenceScore()).isCloseTo(0.61, within(1e-9));
        }

        @Test
        @DisplayName("should reject a pending proposal and penalise the agent")
        void reject() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());

            StepVerifier.create(proposalService.rejectProposal(proposal.getId(), "reviewer-1", "too risky"))
                    .assertNext(rejected -> assertThat(rejected.getStatus()).isEqualTo(ProposalStatus.REJECTED))
                    .verifyComplete();
            assertThat(intern.getConfidenceScore()).isCloseTo(0.59, within(1e-9));
            assertThat(intern.getStatus()).isEqualTo(MaturityLevel.INTERN);
        }

        @Test
        @DisplayName("should leave confidence alone when reviewing training proposals")
        void trainingProposalNoFeedback() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_TRAINING, "ws-1", Instant.now());

            proposalService.approveProposal(proposal.getId(), "reviewer-1", null).block();

            assertThat(intern.getConfidenceScore()).isEqualTo(0.6);
        }

        @Test
        @DisplayName("should still approve when the proposing agent is gone")
        void approveForRemovedAgent() {
            AgentProposal proposal = proposalRepository.save(AgentProposal.builder()
                    .agentId("removed-agent")
                    .proposalType(AgentProposal.TYPE_ACTION)
                    .title("Proposed action: update")
                    .workspaceId("ws-1")
                    .build()).block();

            StepVerifier.create(proposalService.approveProposal(proposal.getId(), "reviewer-1", null))
                    .assertNext(approved -> assertThat(approved.getStatus()).isEqualTo(ProposalStatus.APPROVED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to review a proposal twice")
        void reviewTwice() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());
            proposalService.rejectProposal(proposal.getId(), "reviewer-1", "no").block();

            StepVerifier.create(proposalService.approveProposal(proposal.getId(), "reviewer-2", "yes"))
                    .expectError(InvalidStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should let exactly one of two concurrent reviews win")
        void concurrentReviews() {
            for (int i = 0; i < 200; i++) {
                AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());

                List<Signal<AgentProposal>> outcomes = Flux.merge(
                                proposalService.approveProposal(proposal.getId(), "reviewer-1", "yes")
                                        .subscribeOn(Schedulers.parallel()).materialize(),
                                proposalService.rejectProposal(proposal.getId(), "reviewer-2", "no")
                                        .subscribeOn(Schedulers.parallel()).materialize())
                        .filter(signal -> !signal.isOnComplete())
                        .collectList()
                        .block();

                assertThat(outcomes).hasSize(2);
                assertThat(outcomes).filteredOn(Signal::isOnNext).hasSize(1);
                assertThat(outcomes).filteredOn(Signal::isOnError)
                        .singleElement()
                        .satisfies(signal -> assertThat(signal.getThrowable()).isInstanceOf(InvalidStateException.class));
            }
        }

        @Test
        @DisplayName("should fail with not found for unknown proposals")
        void unknownProposal() {
            StepVerifier.create(proposalService.approveProposal("missing", "reviewer-1", null))
                    .expectError(EntityNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("should mark an approved proposal as executed")
        void markExecuted() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());
            proposalService.approveProposal(proposal.getId(), "reviewer-1", null).block();

            StepVerifier.create(proposalService.markExecuted(proposal.getId()))
                    .assertNext(executed -> {
                        assertThat(executed.getStatus()).isEqualTo(ProposalStatus.EXECUTED);
                        assertThat(executed.getExecutedAt()).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to execute a pending proposal")
        void executePending() {
            AgentProposal proposal = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());

            StepVerifier.create(proposalService.markExecuted(proposal.getId()))
                    .expectError(InvalidStateException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("should list only pending proposals of the workspace")
        void pendingByWorkspace() {
            AgentProposal pending = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());
            AgentProposal reviewed = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.now());
            saveProposal(AgentProposal.TYPE_ACTION, "ws-2", Instant.now());
            proposalService.rejectProposal(reviewed.getId(), "reviewer-1", null).block();

            StepVerifier.create(proposalService.getPendingProposals("ws-1"))
                    .assertNext(proposal -> assertThat(proposal.getId()).isEqualTo(pending.getId()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return the history newest first")
        void historyNewestFirst() {
            AgentProposal older = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.parse("2024-01-01T00:00:00Z"));
            AgentProposal newer = saveProposal(AgentProposal.TYPE_ACTION, "ws-1", Instant.parse("2024-06-01T00:00:00Z"));

            StepVerifier.create(proposalService.getProposalHistory(intern.getId()))
                    .assertNext(proposal -> assertThat(proposal.getId()).isEqualTo(newer.getId()))
                    .assertNext(proposal -> assertThat(proposal.getId()).isEqualTo(older.getId()))
                    .verifyComplete();
        }
    }
}
