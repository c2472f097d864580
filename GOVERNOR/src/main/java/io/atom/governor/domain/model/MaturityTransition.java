package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit row written for every promotion or demotion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaturityTransition {

    private String id;

    private String agentId;

    private MaturityLevel fromLevel;

    private MaturityLevel toLevel;

    private Double confidenceScore;

    /**
     * User who authorised the transition.
     */
    private String actor;

    private Instant occurredAt;

    public boolean isPromotion() {
        return toLevel.ordinal() > fromLevel.ordinal();
    }
}
