package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of intercepting one trigger.
 * At most one of {@code blockedContext}, {@code proposal} and {@code supervisionSession} is set,
 * matching the routing decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerDecision {

    private RoutingDecision routingDecision;

    /**
     * Whether the caller may proceed with the action now.
     */
    private boolean execute;

    private String agentId;

    private String agentMaturity;

    private double confidenceScore;

    private TriggerSource triggerSource;

    private String reason;

    private BlockedTriggerContext blockedContext;

    private AgentProposal proposal;

    private SupervisionSession supervisionSession;
}
