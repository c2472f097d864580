package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * An action an agent would like to take, parked for human or supervisor review.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentProposal {

    public static final String TYPE_ACTION = "action";
    public static final String TYPE_TRAINING = "training";

    private String id;

    private String agentId;

    private String agentName;

    /**
     * {@link #TYPE_ACTION} or {@link #TYPE_TRAINING}.
     */
    private String proposalType;

    private String title;

    private String description;

    private Map<String, Object> proposedAction;

    private Map<String, Object> triggerContext;

    private String reasoning;

    @Builder.Default
    private ProposalStatus status = ProposalStatus.PENDING;

    private String proposedBy;

    private String workspaceId;

    private String reviewedBy;

    private String reviewNote;

    private Instant createdAt;

    private Instant reviewedAt;

    private Instant executedAt;

    public enum ProposalStatus {
        PENDING,
        APPROVED,
        REJECTED,
        EXECUTED
    }

    public boolean isPending() {
        return status == ProposalStatus.PENDING;
    }
}
