package io.atom.governor.domain.repository.impl;

import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.repository.AgentProposalRepository;
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
 * Simple in-memory implementation of {@link AgentProposalRepository}.
 */
@Repository
public class InMemoryAgentProposalRepository implements AgentProposalRepository {

    private final Map<String, AgentProposal> store = new ConcurrentHashMap<>();

    @Override
    public Mono<AgentProposal> save(AgentProposal proposal) {
        return Mono.fromSupplier(() -> {
            if (proposal.getId() == null || proposal.getId().isBlank()) {
                proposal.setId(UUID.randomUUID().toString());
            }
            if (proposal.getCreatedAt() == null) {
                proposal.setCreatedAt(Instant.now());
            }
            store.put(proposal.getId(), proposal);
            return proposal;
        });
    }

    @Override
    public Mono<AgentProposal> findById(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.get(id));
    }

    @Override
    public Flux<AgentProposal> findByWorkspaceAndStatus(String workspaceId, AgentProposal.ProposalStatus status) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(proposal -> Objects.equals(proposal.getWorkspaceId(), workspaceId))
                .filter(proposal -> proposal.getStatus() == status)
                .sorted(Comparator.comparing(AgentProposal::getCreatedAt)));
    }

    @Override
    public Flux<AgentProposal> findByAgentId(String agentId) {
        return Flux.fromStream(() -> store.values().stream()
                .filter(proposal -> Objects.equals(proposal.getAgentId(), agentId))
                .sorted(Comparator.comparing(AgentProposal::getCreatedAt).reversed()));
    }

    @Override
    public Mono<AgentProposal> updateIfStatus(String id, AgentProposal.ProposalStatus expected,
                                              UnaryOperator<AgentProposal> update) {
        if (id == null) {
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> store.computeIfPresent(id, (key, proposal) -> {
            if (proposal.getStatus() != expected) {
                throw new InvalidStateException("Proposal " + id + " must be " + expected
                        + ", current: " + proposal.getStatus());
            }
            return update.apply(proposal);
        }));
    }
}
