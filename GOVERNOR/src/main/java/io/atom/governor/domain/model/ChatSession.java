package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A user conversation. Its metadata may carry the agent bound to the session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    public static final String AGENT_ID_KEY = "agent_id";

    private String id;

    private String userId;

    private Map<String, Object> metadata;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Agent id stored in the session metadata, or null.
     */
    public String boundAgentId() {
        if (metadata == null) {
            return null;
        }
        Object agentId = metadata.get(AGENT_ID_KEY);
        return agentId != null ? agentId.toString() : null;
    }
}
