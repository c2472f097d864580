package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached {@code (status, confidence)} pair of an agent.
 * Status is kept as its stored string value so cache entries stay readable by other services.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaturitySnapshot {

    private String status;

    private double confidence;

    public static MaturitySnapshot of(Agent agent) {
        return new MaturitySnapshot(agent.effectiveStatus().getValue(), agent.effectiveConfidence());
    }

    public MaturityLevel level() {
        return MaturityLevel.resolve(status, confidence);
    }
}
