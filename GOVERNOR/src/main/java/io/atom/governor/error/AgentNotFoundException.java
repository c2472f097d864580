package io.atom.governor.error;

public class AgentNotFoundException extends EntityNotFoundException {

    public AgentNotFoundException(String agentId) {
        super("Agent", agentId);
    }
}
