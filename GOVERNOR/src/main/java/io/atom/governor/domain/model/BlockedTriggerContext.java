package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Trace of an automated trigger that was blocked because the agent is still a student.
 * Handed to the training collaborator so the attempt turns into a learning signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockedTriggerContext {

    private String id;

    private String agentId;

    private String agentName;

    private String agentMaturityAtBlock;

    private Double confidenceScoreAtBlock;

    private String triggerType;

    private String triggerSource;

    private Map<String, Object> triggerContext;

    private String routingDecision;

    private String blockReason;

    private String workspaceId;

    /**
     * Training proposal generated for this block, once known.
     */
    private String proposalId;

    private boolean resolved;

    private Instant createdAt;
}
