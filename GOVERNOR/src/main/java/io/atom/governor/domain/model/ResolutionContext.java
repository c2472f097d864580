package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes how an agent reference was resolved. Attached to every resolver call for observability.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionContext {

    public static final String EXPLICIT_AGENT_ID = "explicit_agent_id";
    public static final String EXPLICIT_AGENT_ID_NOT_FOUND = "explicit_agent_id_not_found";
    public static final String SESSION_AGENT = "session_agent";
    public static final String NO_SESSION_AGENT = "no_session_agent";
    public static final String SESSION_AGENT_NOT_FOUND = "session_agent_not_found";
    public static final String SYSTEM_DEFAULT = "system_default";
    public static final String RESOLUTION_FAILED = "resolution_failed";

    private String userId;

    private String sessionId;

    private String requestedAgentId;

    private String actionType;

    @Builder.Default
    private List<String> resolutionPath = new ArrayList<>();

    private Instant resolvedAt;

    public void addStep(String step) {
        resolutionPath.add(step);
    }
}
