package io.atom.governor.domain.model;

import java.util.Map;

/**
 * Confirmation that an agent may execute a trigger directly.
 */
public record ExecutionGrant(boolean allowed, String agentId, Map<String, Object> triggerContext) {
}
