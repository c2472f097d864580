package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to "may this agent perform this action?".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionPermission {

    private boolean allowed;

    private boolean requiresHumanApproval;

    private String reason;

    private String agentStatus;

    private int actionComplexity;

    private String requiredStatus;

    private double confidenceScore;
}
