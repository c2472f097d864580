package io.atom.governor.client;

import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.model.BlockedTriggerContext;
import reactor.core.publisher.Mono;

/**
 * Client for the training service that turns blocked triggers into training proposals.
 */
public interface TrainingClient {

    /**
     * Create a training proposal for a blocked trigger.
     *
     * @param blockedContext trace of the blocked trigger
     * @return the generated proposal
     */
    Mono<AgentProposal> createTrainingProposal(BlockedTriggerContext blockedContext);
}
