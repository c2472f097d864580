package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A registered agent together with its governance state.
 * {@code confidenceScore} is the authoritative numeric signal; {@code status} is the symbolic tier and
 * only changes through an explicit promotion or demotion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    private String id;

    private String name;

    private String description;

    /**
     * Functional grouping, e.g. "system", "finance".
     */
    private String category;

    private String modulePath;

    private String className;

    private MaturityLevel status;

    private Double confidenceScore;

    /**
     * Free-form agent configuration (system prompt, capabilities, ...).
     */
    private Map<String, Object> configuration;

    private String workspaceId;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Confidence score, falling back to the default when never set.
     */
    public double effectiveConfidence() {
        return confidenceScore != null ? confidenceScore : DEFAULT_CONFIDENCE;
    }

    /**
     * Maturity level, derived from confidence when no status has been stored.
     */
    public MaturityLevel effectiveStatus() {
        return status != null ? status : MaturityLevel.fromConfidence(effectiveConfidence());
    }

    /**
     * Clamp a raw score into [0, 1].
     */
    public static double clampConfidence(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
