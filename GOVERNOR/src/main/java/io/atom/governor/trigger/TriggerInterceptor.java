package io.atom.governor.trigger;

import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.client.TrainingClient;
import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.model.BlockedTriggerContext;
import io.atom.governor.domain.model.ExecutionGrant;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.model.MaturitySnapshot;
import io.atom.governor.domain.model.RoutingDecision;
import io.atom.governor.domain.model.SupervisionSession;
import io.atom.governor.domain.model.TriggerDecision;
import io.atom.governor.domain.model.TriggerSource;
import io.atom.governor.domain.repository.AgentProposalRepository;
import io.atom.governor.domain.repository.BlockedTriggerRepository;
import io.atom.governor.domain.repository.SupervisionSessionRepository;
import io.atom.governor.error.InvalidStateException;
import io.atom.governor.error.StoreCallGuard;
import io.atom.governor.governance.AgentGovernanceService;
import io.atom.governor.observability.GovernanceEventLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Routes every trigger according to the agent's maturity.
 * <pre>
 *   maturity     manual    automated
 *   student      execute   TRAINING     (blocked, training proposal)
 *   intern       execute   PROPOSAL     (blocked, action proposal)
 *   supervised   execute   SUPERVISION  (executes, session tracked)
 *   autonomous   execute   EXECUTION
 * </pre>
 * One interceptor serves one workspace; its id is stamped on every record it creates.
 * Instances are obtained from {@link TriggerInterceptorFactory}.
 */
@Slf4j
public class TriggerInterceptor {

    static final String ACTION_KEY = "action";
    static final String TRIGGER_TYPE_KEY = "trigger_type";

    private final String workspaceId;
    private final AgentGovernanceService governanceService;
    private final GovernanceCache governanceCache;
    private final TrainingClient trainingClient;
    private final AgentProposalRepository proposalRepository;
    private final SupervisionSessionRepository supervisionRepository;
    private final BlockedTriggerRepository blockedTriggerRepository;
    private final GovernanceEventLogger eventLogger;
    private final Duration cacheTtl;
    private final Duration storeTimeout;

    private final Map<RoutingDecision, Counter> decisionCounters = new EnumMap<>(RoutingDecision.class);
    private final Counter blockedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    TriggerInterceptor(
            String workspaceId,
            AgentGovernanceService governanceService,
            GovernanceCache governanceCache,
            TrainingClient trainingClient,
            AgentProposalRepository proposalRepository,
            SupervisionSessionRepository supervisionRepository,
            BlockedTriggerRepository blockedTriggerRepository,
            GovernanceEventLogger eventLogger,
            Duration cacheTtl,
            Duration storeTimeout,
            MeterRegistry meterRegistry) {
        this.workspaceId = workspaceId;
        this.governanceService = governanceService;
        this.governanceCache = governanceCache;
        this.trainingClient = trainingClient;
        this.proposalRepository = proposalRepository;
        this.supervisionRepository = supervisionRepository;
        this.blockedTriggerRepository = blockedTriggerRepository;
        this.eventLogger = eventLogger;
        this.cacheTtl = cacheTtl;
        this.storeTimeout = storeTimeout;

        for (RoutingDecision decision : RoutingDecision.values()) {
            decisionCounters.put(decision, Counter.builder("governor.trigger.decisions")
                    .tag("decision", decision.getValue())
                    .register(meterRegistry));
        }
        this.blockedCounter = Counter.builder("governor.trigger.blocked").register(meterRegistry);
        this.cacheHitCounter = Counter.builder("governor.cache.hits").register(meterRegistry);
        this.cacheMissCounter = Counter.builder("governor.cache.misses").register(meterRegistry);
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    /**
     * Decide what happens to a trigger.
     *
     * @param agentId        agent the trigger is addressed to
     * @param triggerSource  origin of the trigger
     * @param triggerContext trigger payload, {@code action} names the intended action
     * @param userId         initiating user, may be null for automated triggers
     * @return the routing decision; fails with NotFound when the agent does not exist
     */
    public Mono<TriggerDecision> interceptTrigger(String agentId, TriggerSource triggerSource,
                                                  Map<String, Object> triggerContext, String userId) {
        Map<String, Object> context = triggerContext != null ? triggerContext : Map.of();

        return getAgentMaturityCached(agentId)
                .flatMap(snapshot -> {
                    MaturityLevel level = snapshot.level();
                    if (!triggerSource.isAutomated()) {
                        return Mono.just(manualDecision(agentId, level, snapshot.getConfidence(), triggerSource));
                    }
                    switch (level) {
                        case STUDENT:
                            return routeStudent(agentId, snapshot, triggerSource, context);
                        case INTERN:
                            return routeIntern(agentId, snapshot, triggerSource, context);
                        case SUPERVISED:
                            return routeSupervised(agentId, snapshot, triggerSource, context, userId);
                        default:
                            return routeAutonomous(agentId, snapshot, triggerSource, context);
                    }
                })
                .doOnNext(decision -> {
                    decisionCounters.get(decision.getRoutingDecision()).increment();
                    if (!decision.isExecute()) {
                        blockedCounter.increment();
                    }
                    eventLogger.setContext(agentId, workspaceId, userId, null);
                    try {
                        eventLogger.logTriggerIntercepted(workspaceId, decision);
                    } finally {
                        eventLogger.clearContext();
                    }
                });
    }

    // --------------------------------------------------------------------------------------------
    // Maturity lookup
    // --------------------------------------------------------------------------------------------

    /**
     * Maturity of an agent, served from the cache when present and written back on a miss.
     * A cache failure falls back to the record store; an unknown agent fails with NotFound.
     */
    public Mono<MaturitySnapshot> getAgentMaturityCached(String agentId) {
        return governanceCache.get(agentId)
                .onErrorResume(e -> {
                    log.warn("Maturity cache read failed for agent {}: {}", agentId, e.getMessage());
                    return Mono.empty();
                })
                .doOnNext(hit -> cacheHitCounter.increment())
                .switchIfEmpty(Mono.defer(() -> {
                    cacheMissCounter.increment();
                    return governanceService.getMaturity(agentId)
                            .flatMap(snapshot -> governanceCache.set(agentId, snapshot, cacheTtl)
                                    .onErrorResume(e -> {
                                        log.warn("Maturity cache write failed for agent {}: {}", agentId, e.getMessage());
                                        return Mono.empty();
                                    })
                                    .thenReturn(snapshot));
                }));
    }

    // --------------------------------------------------------------------------------------------
    // Routing
    // --------------------------------------------------------------------------------------------

    private TriggerDecision manualDecision(String agentId, MaturityLevel level, double confidence,
                                           TriggerSource source) {
        String reason;
        switch (level) {
            case STUDENT:
                reason = String.format(Locale.ROOT, "Manual trigger allowed. Warning: agent is a student (confidence %.2f), "
                        + "review its output carefully", confidence);
                break;
            case INTERN:
                reason = "Manual trigger allowed. Note: agent is an intern in learning mode";
                break;
            default:
                reason = "Manual trigger allowed for " + level.getValue() + " agent";
        }
        return baseDecision(agentId, level, confidence, source)
                .routingDecision(RoutingDecision.EXECUTION)
                .execute(true)
                .reason(reason)
                .build();
    }

    private Mono<TriggerDecision> routeStudent(String agentId, MaturitySnapshot snapshot, TriggerSource source,
                                               Map<String, Object> context) {
        String blockReason = "Student agents cannot execute automated triggers; routed to training";

        return governanceService.requireAgent(agentId)
                .flatMap(agent -> blockedTriggerRepository.save(BlockedTriggerContext.builder()
                        .agentId(agentId)
                        .agentName(agent.getName())
                        .agentMaturityAtBlock(snapshot.level().getValue())
                        .confidenceScoreAtBlock(snapshot.getConfidence())
                        .triggerType(triggerType(context, source))
                        .triggerSource(source.getValue())
                        .triggerContext(context)
                        .routingDecision(RoutingDecision.TRAINING.getValue())
                        .blockReason(blockReason)
                        .workspaceId(workspaceId)
                        .createdAt(Instant.now())
                        .build()))
                .transform(StoreCallGuard.guard("saveBlockedTrigger", storeTimeout))
                .flatMap(blocked -> routeToTraining(blocked)
                        .flatMap(proposal -> {
                            blocked.setProposalId(proposal.getId());
                            return blockedTriggerRepository.save(blocked);
                        })
                        .onErrorResume(e -> {
                            log.error("Training proposal failed for blocked trigger {}: {}", blocked.getId(), e.getMessage());
                            return Mono.just(blocked);
                        })
                        .defaultIfEmpty(blocked))
                .map(blocked -> baseDecision(agentId, snapshot.level(), snapshot.getConfidence(), source)
                        .routingDecision(RoutingDecision.TRAINING)
                        .execute(false)
                        .reason(blockReason)
                        .blockedContext(blocked)
                        .build());
    }

    private Mono<TriggerDecision> routeIntern(String agentId, MaturitySnapshot snapshot, TriggerSource source,
                                              Map<String, Object> context) {
        String action = triggerType(context, source);
        Map<String, Object> proposedAction = new HashMap<>(context);
        proposedAction.putIfAbsent("type", action);
        String reasoning = String.format(Locale.ROOT, "Intern agent (confidence %.2f) proposes '%s' from a %s trigger; "
                + "human approval is required before it runs", snapshot.getConfidence(), action, source.getValue());

        return createProposal(agentId, context, proposedAction, reasoning)
                .map(proposal -> baseDecision(agentId, snapshot.level(), snapshot.getConfidence(), source)
                        .routingDecision(RoutingDecision.PROPOSAL)
                        .execute(false)
                        .reason("Intern agents propose automated actions for approval")
                        .proposal(proposal)
                        .build());
    }

    private Mono<TriggerDecision> routeSupervised(String agentId, MaturitySnapshot snapshot, TriggerSource source,
                                                  Map<String, Object> context, String userId) {
        return executeWithSupervision(context, agentId, userId)
                .map(session -> baseDecision(agentId, snapshot.level(), snapshot.getConfidence(), source)
                        .routingDecision(RoutingDecision.SUPERVISION)
                        .execute(true)
                        .reason("Supervised agent executes under monitoring")
                        .supervisionSession(session)
                        .build());
    }

    private Mono<TriggerDecision> routeAutonomous(String agentId, MaturitySnapshot snapshot, TriggerSource source,
                                                  Map<String, Object> context) {
        return allowExecution(agentId, context)
                .map(grant -> baseDecision(agentId, snapshot.level(), snapshot.getConfidence(), source)
                        .routingDecision(RoutingDecision.EXECUTION)
                        .execute(grant.allowed())
                        .reason("Autonomous agent executes directly")
                        .build());
    }

    private TriggerDecision.TriggerDecisionBuilder baseDecision(String agentId, MaturityLevel level,
                                                                double confidence, TriggerSource source) {
        return TriggerDecision.builder()
                .agentId(agentId)
                .agentMaturity(level.getValue())
                .confidenceScore(confidence)
                .triggerSource(source);
    }

    // --------------------------------------------------------------------------------------------
    // Routing targets
    // --------------------------------------------------------------------------------------------

    /**
     * Hand a blocked trigger to the training collaborator.
     */
    public Mono<AgentProposal> routeToTraining(BlockedTriggerContext blockedContext) {
        return trainingClient.createTrainingProposal(blockedContext)
                .doOnNext(proposal -> log.info("Blocked trigger {} routed to training proposal {}",
                        blockedContext.getId(), proposal.getId()));
    }

    /**
     * Park an intern's intended action as a pending proposal. The action is not executed.
     * Fails with {@link InvalidStateException} when the agent is not an intern.
     */
    public Mono<AgentProposal> createProposal(String internAgentId, Map<String, Object> triggerContext,
                                              Map<String, Object> proposedAction, String reasoning) {
        return governanceService.requireAgent(internAgentId)
                .flatMap(agent -> {
                    MaturityLevel level = agent.effectiveStatus();
                    if (level != MaturityLevel.INTERN) {
                        return Mono.<AgentProposal>error(new InvalidStateException(
                                "Agent " + agent.getId() + " is " + level.getValue() + ", only intern agents create proposals"));
                    }
                    Map<String, Object> action = proposedAction != null ? proposedAction : Map.of();
                    Object actionName = action.getOrDefault("type",
                            triggerContext != null ? triggerContext.get(ACTION_KEY) : null);
                    String label = actionName != null ? actionName.toString() : "action";

                    AgentProposal proposal = AgentProposal.builder()
                            .agentId(agent.getId())
                            .agentName(agent.getName())
                            .proposalType(AgentProposal.TYPE_ACTION)
                            .title("Proposed action: " + label)
                            .description(describeProposal(agent, label, reasoning))
                            .proposedAction(action)
                            .triggerContext(triggerContext)
                            .reasoning(reasoning)
                            .proposedBy(agent.getId())
                            .workspaceId(workspaceId)
                            .createdAt(Instant.now())
                            .build();
                    return proposalRepository.save(proposal);
                })
                .transform(StoreCallGuard.guard("createProposal", storeTimeout))
                .doOnNext(saved -> log.info("Created proposal {} for intern agent {}", saved.getId(), internAgentId));
    }

    private static String describeProposal(Agent agent, String label, String reasoning) {
        return String.format("%s proposes to perform '%s'.%n%nReasoning: %s",
                agent.getName(), label, reasoning != null ? reasoning : "none given");
    }

    /**
     * Open a running supervision session. The caller performs the action once it holds the session.
     */
    public Mono<SupervisionSession> executeWithSupervision(Map<String, Object> triggerContext, String agentId,
                                                           String userId) {
        return governanceService.requireAgent(agentId)
                .flatMap(agent -> supervisionRepository.save(SupervisionSession.builder()
                        .agentId(agent.getId())
                        .agentName(agent.getName())
                        .workspaceId(workspaceId)
                        .triggerContext(triggerContext)
                        .status(SupervisionSession.SupervisionStatus.RUNNING)
                        .supervisorId(userId)
                        .startedAt(Instant.now())
                        .build()))
                .transform(StoreCallGuard.guard("startSupervision", storeTimeout))
                .doOnNext(session -> log.info("Started supervision session {} for agent {}", session.getId(), agentId));
    }

    /**
     * Confirm direct execution for an existing agent.
     */
    public Mono<ExecutionGrant> allowExecution(String agentId, Map<String, Object> triggerContext) {
        return governanceService.requireAgent(agentId)
                .map(agent -> new ExecutionGrant(true, agent.getId(), triggerContext));
    }

    private static String triggerType(Map<String, Object> context, TriggerSource source) {
        Object action = context.get(ACTION_KEY);
        if (action == null) {
            action = context.get(TRIGGER_TYPE_KEY);
        }
        return action != null ? action.toString() : source.getValue();
    }
}
