package io.atom.governor.domain.model;

import java.util.Optional;

/**
 * Result of a resolver call: the agent, if any, and how it was found.
 */
public record ResolvedAgent(Agent agent, ResolutionContext context) {

    public Optional<Agent> agentIfPresent() {
        return Optional.ofNullable(agent);
    }

    public boolean isResolved() {
        return agent != null;
    }
}
