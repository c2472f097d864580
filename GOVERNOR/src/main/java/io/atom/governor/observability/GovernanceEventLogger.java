package io.atom.governor.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.atom.governor.domain.model.MaturityTransition;
import io.atom.governor.domain.model.ResolutionContext;
import io.atom.governor.domain.model.TriggerDecision;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for governance events.
 * Emits one machine-parseable JSON line per event, enriched with MDC context.
 */
@Component
@Slf4j
public class GovernanceEventLogger {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_WORKSPACE_ID = "workspaceId";
    public static final String MDC_USER_ID = "userId";

    private final ObjectMapper objectMapper;

    public GovernanceEventLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a governance call.
     */
    public void setContext(String agentId, String workspaceId, String userId, String correlationId) {
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
        if (workspaceId != null) MDC.put(MDC_WORKSPACE_ID, workspaceId);
        if (userId != null) MDC.put(MDC_USER_ID, userId);
        if (correlationId != null) MDC.put(MDC_CORRELATION_ID, correlationId);
    }

    public void clearContext() {
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_WORKSPACE_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_CORRELATION_ID);
    }

    public void logTriggerIntercepted(String workspaceId, TriggerDecision decision) {
        Map<String, Object> data = new HashMap<>();
        data.put("workspaceId", workspaceId);
        data.put("agentId", decision.getAgentId());
        data.put("maturity", decision.getAgentMaturity());
        data.put("confidence", decision.getConfidenceScore());
        data.put("triggerSource", decision.getTriggerSource().getValue());
        data.put("routingDecision", decision.getRoutingDecision().getValue());
        data.put("execute", decision.isExecute());
        logEvent("trigger_intercepted", data);
    }

    public void logConfidenceUpdated(String agentId, double previous, double current, boolean positive, String impact) {
        logEvent("confidence_updated", Map.of(
                "agentId", agentId,
                "previous", previous,
                "current", current,
                "positive", positive,
                "impact", impact
        ));
    }

    public void logMaturityTransition(MaturityTransition transition) {
        logEvent("maturity_transition", Map.of(
                "agentId", transition.getAgentId(),
                "from", transition.getFromLevel().getValue(),
                "to", transition.getToLevel().getValue(),
                "actor", transition.getActor() != null ? transition.getActor() : "unknown"
        ));
    }

    public void logAgentResolved(ResolutionContext context, String agentId) {
        Map<String, Object> data = new HashMap<>();
        data.put("resolutionPath", context.getResolutionPath());
        data.put("actionType", context.getActionType());
        if (agentId != null) data.put("agentId", agentId);
        if (context.getUserId() != null) data.put("userId", context.getUserId());
        if (context.getSessionId() != null) data.put("sessionId", context.getSessionId());
        logEvent("agent_resolved", data);
    }

    public void logProposalReviewed(String proposalId, String agentId, String status, String reviewer) {
        Map<String, Object> data = new HashMap<>();
        data.put("proposalId", proposalId);
        data.put("agentId", agentId);
        data.put("status", status);
        if (reviewer != null) data.put("reviewer", reviewer);
        logEvent("proposal_reviewed", data);
    }

    public void logSupervisionCompleted(String sessionId, String agentId, int rating, int interventions) {
        logEvent("supervision_completed", Map.of(
                "sessionId", sessionId,
                "agentId", agentId,
                "rating", rating,
                "interventions", interventions
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "governor");

        String correlationId = MDC.get(MDC_CORRELATION_ID);
        if (correlationId != null) event.put("correlationId", correlationId);

        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
