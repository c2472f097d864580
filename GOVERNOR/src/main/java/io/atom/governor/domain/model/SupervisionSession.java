package io.atom.governor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * An execution by a supervised agent that proceeds while being tracked.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupervisionSession {

    private String id;

    private String agentId;

    private String agentName;

    private String workspaceId;

    private Map<String, Object> triggerContext;

    @Builder.Default
    private SupervisionStatus status = SupervisionStatus.RUNNING;

    private String supervisorId;

    /**
     * Supervisor rating 1-5, set on completion.
     */
    private Integer supervisorRating;

    private int interventionCount;

    private Instant startedAt;

    private Instant completedAt;

    public enum SupervisionStatus {
        ACTIVE,
        RUNNING,
        COMPLETED,
        TERMINATED
    }

    public boolean isOpen() {
        return status == SupervisionStatus.ACTIVE || status == SupervisionStatus.RUNNING;
    }
}
