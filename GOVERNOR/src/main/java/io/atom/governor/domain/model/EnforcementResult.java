package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verdict of enforcing an action: approved outright, allowed pending approval, or blocked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnforcementResult {

    private boolean proceed;

    private EnforcementStatus status;

    private String reason;

    private ActionPermission permission;

    public enum EnforcementStatus {
        APPROVED,
        PENDING_APPROVAL,
        BLOCKED
    }
}
