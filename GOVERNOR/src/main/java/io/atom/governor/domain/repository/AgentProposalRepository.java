package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.AgentProposal;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Repository interface for agent proposals.
 */
public interface AgentProposalRepository {

    Mono<AgentProposal> save(AgentProposal proposal);

    Mono<AgentProposal> findById(String id);

    Flux<AgentProposal> findByWorkspaceAndStatus(String workspaceId, AgentProposal.ProposalStatus status);

    /**
     * Proposals of one agent, newest first.
     */
    Flux<AgentProposal> findByAgentId(String agentId);

    /**
     * Apply an update only while the proposal still has the expected status.
     *
     * @return the updated proposal, empty when absent, or an error when the status changed concurrently
     */
    Mono<AgentProposal> updateIfStatus(String id, AgentProposal.ProposalStatus expected,
                                       UnaryOperator<AgentProposal> update);
}
