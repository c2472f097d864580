package io.atom.governor.trigger;

import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.client.TrainingClient;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.repository.AgentProposalRepository;
import io.atom.governor.domain.repository.BlockedTriggerRepository;
import io.atom.governor.domain.repository.SupervisionSessionRepository;
import io.atom.governor.governance.AgentGovernanceService;
import io.atom.governor.observability.GovernanceEventLogger;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for workspace-scoped {@link TriggerInterceptor} instances.
 */
@Component
@Slf4j
public class TriggerInterceptorFactory {

    private final Map<String, TriggerInterceptor> interceptors = new ConcurrentHashMap<>();

    private final AgentGovernanceService governanceService;
    private final GovernanceCache governanceCache;
    private final TrainingClient trainingClient;
    private final AgentProposalRepository proposalRepository;
    private final SupervisionSessionRepository supervisionRepository;
    private final BlockedTriggerRepository blockedTriggerRepository;
    private final GovernanceEventLogger eventLogger;
    private final GovernorProperties properties;
    private final MeterRegistry meterRegistry;

    public TriggerInterceptorFactory(
            AgentGovernanceService governanceService,
            GovernanceCache governanceCache,
            TrainingClient trainingClient,
            AgentProposalRepository proposalRepository,
            SupervisionSessionRepository supervisionRepository,
            BlockedTriggerRepository blockedTriggerRepository,
            GovernanceEventLogger eventLogger,
            GovernorProperties properties,
            MeterRegistry meterRegistry) {
        this.governanceService = governanceService;
        this.governanceCache = governanceCache;
        this.trainingClient = trainingClient;
        this.proposalRepository = proposalRepository;
        this.supervisionRepository = supervisionRepository;
        this.blockedTriggerRepository = blockedTriggerRepository;
        this.eventLogger = eventLogger;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Get the interceptor for a workspace, creating it on first use.
     *
     * @param workspaceId the workspace
     * @return the interceptor
     * @throws IllegalArgumentException if the workspace id is blank
     */
    public TriggerInterceptor forWorkspace(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("Workspace id is required");
        }
        return interceptors.computeIfAbsent(workspaceId, id -> {
            log.info("Creating trigger interceptor for workspace: {}", id);
            return new TriggerInterceptor(
                    id,
                    governanceService,
                    governanceCache,
                    trainingClient,
                    proposalRepository,
                    supervisionRepository,
                    blockedTriggerRepository,
                    eventLogger,
                    properties.getCache().getMaturityTtl(),
                    properties.getStore().getTimeout(),
                    meterRegistry);
        });
    }
}
