package io.atom.governor.proposal;

import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.model.AgentProposal.ProposalStatus;
import io.atom.governor.domain.repository.AgentProposalRepository;
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
 * Review workflow for agent proposals.
 * <p>
 * PENDING moves to APPROVED or REJECTED, APPROVED moves to EXECUTED; each move is a compare-and-set on
 * the stored status. Reviewing an action proposal feeds a low-impact confidence signal back to the
 * proposing agent.
 */
@Service
@Slf4j
public class ProposalService {

    private static final String ENTITY = "Proposal";

    private final AgentProposalRepository proposalRepository;
    private final AgentGovernanceService governanceService;
    private final GovernanceEventLogger eventLogger;
    private final Duration storeTimeout;

    public ProposalService(
            AgentProposalRepository proposalRepository,
            AgentGovernanceService governanceService,
            GovernanceEventLogger eventLogger,
            GovernorProperties properties) {
        this.proposalRepository = proposalRepository;
        this.governanceService = governanceService;
        this.eventLogger = eventLogger;
        this.storeTimeout = properties.getStore().getTimeout();
    }

    public Flux<AgentProposal> getPendingProposals(String workspaceId) {
        return proposalRepository.findByWorkspaceAndStatus(workspaceId, ProposalStatus.PENDING)
                .transform(StoreCallGuard.guardAll("pendingProposals", storeTimeout));
    }

    /**
     * Proposals of an agent, newest first.
     */
    public Flux<AgentProposal> getProposalHistory(String agentId) {
        return proposalRepository.findByAgentId(agentId)
                .transform(StoreCallGuard.guardAll("proposalHistory", storeTimeout));
    }

    public Mono<AgentProposal> approveProposal(String proposalId, String reviewerId, String note) {
        return review(proposalId, reviewerId, note, ProposalStatus.APPROVED);
    }

    public Mono<AgentProposal> rejectProposal(String proposalId, String reviewerId, String reason) {
        return review(proposalId, reviewerId, reason, ProposalStatus.REJECTED);
    }

    /**
     * Record that an approved proposal has been carried out.
     */
    public Mono<AgentProposal> markExecuted(String proposalId) {
        return updateProposal(proposalId, ProposalStatus.APPROVED, proposal -> {
                    proposal.setStatus(ProposalStatus.EXECUTED);
                    proposal.setExecutedAt(Instant.now());
                    return proposal;
                })
                .transform(StoreCallGuard.guard("markProposalExecuted", storeTimeout))
                .doOnNext(p -> log.info("Proposal {} executed", p.getId()));
    }

    private Mono<AgentProposal> review(String proposalId, String reviewerId, String note, ProposalStatus target) {
        return updateProposal(proposalId, ProposalStatus.PENDING, proposal -> {
                    proposal.setStatus(target);
                    proposal.setReviewedBy(reviewerId);
                    proposal.setReviewNote(note);
                    proposal.setReviewedAt(Instant.now());
                    return proposal;
                })
                .transform(StoreCallGuard.guard("reviewProposal", storeTimeout))
                .flatMap(saved -> {
                    eventLogger.logProposalReviewed(saved.getId(), saved.getAgentId(), target.name(), reviewerId);
                    return feedBackOutcome(saved, target == ProposalStatus.APPROVED);
                });
    }

    private Mono<AgentProposal> feedBackOutcome(AgentProposal proposal, boolean approved) {
        if (!AgentProposal.TYPE_ACTION.equals(proposal.getProposalType())) {
            return Mono.just(proposal);
        }
        return governanceService.recordOutcome(proposal.getAgentId(), approved)
                .thenReturn(proposal)
                .onErrorResume(EntityNotFoundException.class, e -> {
                    log.warn("Proposing agent {} of proposal {} no longer exists", proposal.getAgentId(), proposal.getId());
                    return Mono.just(proposal);
                });
    }

    private Mono<AgentProposal> updateProposal(String proposalId, ProposalStatus expected,
                                               UnaryOperator<AgentProposal> update) {
        return proposalRepository.updateIfStatus(proposalId, expected, update)
                .switchIfEmpty(Mono.error(() -> new EntityNotFoundException(ENTITY, proposalId)));
    }
}
