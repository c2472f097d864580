package io.atom.governor.governance;

import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.client.PermissionChecker;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.ActionPermission;
import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.AgentCapabilities;
import io.atom.governor.domain.model.EnforcementResult;
import io.atom.governor.domain.model.EnforcementResult.EnforcementStatus;
import io.atom.governor.domain.model.GovernedAction;
import io.atom.governor.domain.model.ImpactLevel;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.model.MaturitySnapshot;
import io.atom.governor.domain.model.MaturityTransition;
import io.atom.governor.domain.repository.AgentRepository;
import io.atom.governor.domain.repository.MaturityTransitionRepository;
import io.atom.governor.error.AgentNotFoundException;
import io.atom.governor.error.InvalidStateException;
import io.atom.governor.error.PermissionDeniedException;
import io.atom.governor.error.StoreCallGuard;
import io.atom.governor.observability.GovernanceEventLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import java.util.function.Function;

/**
 * Confidence and maturity ledger.
 * <p>
 * Owns the numeric confidence score and the symbolic maturity level of every agent:
 * <ul>
 *   <li>confidence moves only through {@link #updateConfidence} and never rewrites the maturity level</li>
 *   <li>maturity moves only through the authorised {@link #promote} / {@link #demote} transitions</li>
 *   <li>{@link #canPerformAction} gates an action by comparing its complexity tier to the level's ceiling</li>
 * </ul>
 * Every successful write invalidates the agent's maturity cache entry.
 */
@Service
@Slf4j
public class AgentGovernanceService {

    private final AgentRepository agentRepository;
    private final MaturityTransitionRepository transitionRepository;
    private final GovernanceCache governanceCache;
    private final PermissionChecker permissionChecker;
    private final GovernanceEventLogger eventLogger;
    private final Duration storeTimeout;
    private final Counter confidenceUpdateCounter;
    private final Counter transitionCounter;

    public AgentGovernanceService(
            AgentRepository agentRepository,
            MaturityTransitionRepository transitionRepository,
            GovernanceCache governanceCache,
            PermissionChecker permissionChecker,
            GovernanceEventLogger eventLogger,
            GovernorProperties properties,
            MeterRegistry meterRegistry) {
        this.agentRepository = agentRepository;
        this.transitionRepository = transitionRepository;
        this.governanceCache = governanceCache;
        this.permissionChecker = permissionChecker;
        this.eventLogger = eventLogger;
        this.storeTimeout = properties.getStore().getTimeout();

        this.confidenceUpdateCounter = Counter.builder("governor.confidence.updates").register(meterRegistry);
        this.transitionCounter = Counter.builder("governor.maturity.transitions").register(meterRegistry);
    }

    // --------------------------------------------------------------------------------------------
    // Reads
    // --------------------------------------------------------------------------------------------

    /**
     * Current maturity level and confidence of an agent, read from the record store.
     */
    public Mono<MaturitySnapshot> getMaturity(String agentId) {
        return requireAgent(agentId).map(MaturitySnapshot::of);
    }

    /**
     * Load an agent or fail with {@link AgentNotFoundException}.
     */
    public Mono<Agent> requireAgent(String agentId) {
        return agentRepository.findById(agentId)
                .transform(StoreCallGuard.guard("findAgent", storeTimeout))
                .switchIfEmpty(Mono.error(() -> new AgentNotFoundException(agentId)));
    }

    public Flux<Agent> listAgents(String category) {
        Flux<Agent> agents = category == null
                ? agentRepository.findAll()
                : agentRepository.findByCategory(category);
        return agents.transform(StoreCallGuard.guardAll("listAgents", storeTimeout));
    }

    public Flux<MaturityTransition> getTransitionHistory(String agentId) {
        return transitionRepository.findByAgentId(agentId)
                .transform(StoreCallGuard.guardAll("transitionHistory", storeTimeout));
    }

    // --------------------------------------------------------------------------------------------
    // Registration
    // --------------------------------------------------------------------------------------------

    /**
     * Register a new agent as a student with default confidence, or refresh the descriptive fields of the
     * agent already registered for the same module and class. Governance state is never reset.
     */
    public Mono<Agent> registerOrUpdateAgent(String name, String category, String modulePath,
                                             String className, String description) {
        return agentRepository.findByModule(modulePath, className)
                .flatMap(existing -> {
                    existing.setName(name);
                    existing.setCategory(category);
                    if (description != null) {
                        existing.setDescription(description);
                    }
                    log.info("Updating registered agent {} ({})", existing.getId(), name);
                    return agentRepository.save(existing);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    Agent agent = Agent.builder()
                            .name(name)
                            .category(category)
                            .modulePath(modulePath)
                            .className(className)
                            .description(description)
                            .status(MaturityLevel.STUDENT)
                            .confidenceScore(Agent.DEFAULT_CONFIDENCE)
                            .configuration(new HashMap<>())
                            .build();
                    log.info("Registering new agent {}", name);
                    return agentRepository.save(agent);
                }))
                .transform(StoreCallGuard.guard("registerAgent", storeTimeout));
    }

    // --------------------------------------------------------------------------------------------
    // Confidence
    // --------------------------------------------------------------------------------------------

    /**
     * Apply a signed confidence delta (low 0.01, high 0.10), clamped to [0, 1].
     * The maturity level is left untouched.
     */
    public Mono<Agent> updateConfidence(String agentId, boolean positive, ImpactLevel impactLevel) {
        double delta = positive ? impactLevel.delta() : -impactLevel.delta();
        double[] previous = new double[1];

        return agentRepository.updateConfidence(agentId, current -> {
                    previous[0] = current;
                    return Agent.clampConfidence(current + delta);
                })
                .transform(StoreCallGuard.guard("updateConfidence", storeTimeout))
                .switchIfEmpty(Mono.error(() -> new AgentNotFoundException(agentId)))
                .doOnNext(agent -> {
                    confidenceUpdateCounter.increment();
                    eventLogger.logConfidenceUpdated(agentId, previous[0], agent.effectiveConfidence(),
                            positive, impactLevel.name().toLowerCase());
                })
                .flatMap(this::invalidateCached);
    }

    /**
     * Record the outcome of an executed action as a low-impact confidence signal.
     */
    public Mono<Agent> recordOutcome(String agentId, boolean success) {
        return updateConfidence(agentId, success, ImpactLevel.LOW);
    }

    // --------------------------------------------------------------------------------------------
    // Maturity transitions
    // --------------------------------------------------------------------------------------------

    /**
     * Move an agent one level up. Requires the {@code promote} permission.
     */
    public Mono<Agent> promote(String agentId, String actorId) {
        return transition(agentId, actorId, PermissionChecker.PROMOTE, MaturityLevel::next);
    }

    /**
     * Move an agent one level down. Requires the {@code demote} permission.
     */
    public Mono<Agent> demote(String agentId, String actorId) {
        return transition(agentId, actorId, PermissionChecker.DEMOTE, MaturityLevel::previous);
    }

    private Mono<Agent> transition(String agentId, String actorId, String action,
                                   Function<MaturityLevel, Optional<MaturityLevel>> step) {
        return requireAgent(agentId)
                .flatMap(agent -> permissionChecker.checkPermission(actorId, action)
                        .flatMap(permitted -> {
                            if (!Boolean.TRUE.equals(permitted)) {
                                log.warn("Denied {} of agent {} by {}", action, agentId, actorId);
                                return Mono.error(new PermissionDeniedException(actorId, action + " agent " + agentId));
                            }
                            MaturityLevel from = agent.effectiveStatus();
                            Optional<MaturityLevel> target = step.apply(from);
                            if (target.isEmpty()) {
                                return Mono.error(new InvalidStateException(
                                        "Cannot " + action + " agent " + agentId + " beyond " + from.getValue()));
                            }
                            return applyTransition(agent, from, target.get(), actorId);
                        }));
    }

    private Mono<Agent> applyTransition(Agent agent, MaturityLevel from, MaturityLevel to, String actorId) {
        return agentRepository.transitionStatus(agent.getId(), from, to)
                .transform(StoreCallGuard.guard("transitionStatus", storeTimeout))
                .switchIfEmpty(Mono.error(() -> new AgentNotFoundException(agent.getId())))
                .flatMap(updated -> transitionRepository.append(MaturityTransition.builder()
                                .agentId(updated.getId())
                                .fromLevel(from)
                                .toLevel(to)
                                .confidenceScore(updated.effectiveConfidence())
                                .actor(actorId)
                                .occurredAt(Instant.now())
                                .build())
                        .doOnNext(recorded -> {
                            transitionCounter.increment();
                            eventLogger.logMaturityTransition(recorded);
                        })
                        .thenReturn(updated))
                .flatMap(this::invalidateCached);
    }

    // --------------------------------------------------------------------------------------------
    // Action gating
    // --------------------------------------------------------------------------------------------

    /**
     * Complexity tier 1-4 of an action. Unknown actions fail closed to tier 4.
     */
    public static int actionComplexity(String actionName) {
        return GovernedAction.complexityOf(actionName);
    }

    /**
     * Highest complexity tier a maturity level may perform.
     */
    public static int maturityCeiling(MaturityLevel level) {
        return level.ceiling();
    }

    /**
     * Check whether an agent may perform an action.
     *
     * @param requireApprovalOverride null for the default (supervised agents need approval),
     *                                otherwise forces the human-approval flag of an allowed action
     */
    public Mono<ActionPermission> canPerformAction(String agentId, String actionName, Boolean requireApprovalOverride) {
        return requireAgent(agentId)
                .map(agent -> evaluate(agent, actionName, requireApprovalOverride));
    }

    /**
     * Pure permission evaluation for an already loaded agent.
     */
    public ActionPermission evaluate(Agent agent, String actionName, Boolean requireApprovalOverride) {
        MaturityLevel level = agent.effectiveStatus();
        int complexity = actionComplexity(actionName);
        MaturityLevel required = MaturityLevel.requiredFor(complexity);
        boolean allowed = complexity <= maturityCeiling(level);

        if (!allowed) {
            return ActionPermission.builder()
                    .allowed(false)
                    .requiresHumanApproval(false)
                    .reason(String.format("Denied for insufficient maturity: agent is %s but '%s' (complexity %d) requires %s",
                            level.getValue(), actionName, complexity, required.getValue()))
                    .agentStatus(level.getValue())
                    .actionComplexity(complexity)
                    .requiredStatus(required.getValue())
                    .confidenceScore(agent.effectiveConfidence())
                    .build();
        }

        boolean requiresApproval = requireApprovalOverride != null
                ? requireApprovalOverride
                : level == MaturityLevel.SUPERVISED;

        return ActionPermission.builder()
                .allowed(true)
                .requiresHumanApproval(requiresApproval)
                .reason(String.format("Agent is %s; '%s' (complexity %d) is within its ceiling of %d",
                        level.getValue(), actionName, complexity, maturityCeiling(level)))
                .agentStatus(level.getValue())
                .actionComplexity(complexity)
                .requiredStatus(required.getValue())
                .confidenceScore(agent.effectiveConfidence())
                .build();
    }

    /**
     * Catalogued actions the agent may and may not perform at its current level.
     */
    public Mono<AgentCapabilities> getCapabilities(String agentId) {
        return requireAgent(agentId).map(agent -> {
            MaturityLevel level = agent.effectiveStatus();
            int ceiling = maturityCeiling(level);
            return AgentCapabilities.builder()
                    .agentId(agent.getId())
                    .maturityLevel(level.getValue())
                    .confidenceScore(agent.effectiveConfidence())
                    .maxComplexity(ceiling)
                    .allowedActions(GovernedAction.identifiersUpTo(ceiling))
                    .restrictedActions(GovernedAction.identifiersAbove(ceiling))
                    .build();
        });
    }

    /**
     * Turn a permission check into an enforcement verdict.
     */
    public Mono<EnforcementResult> enforceAction(String agentId, String actionName) {
        return canPerformAction(agentId, actionName, null).map(permission -> {
            if (!permission.isAllowed()) {
                return EnforcementResult.builder()
                        .proceed(false)
                        .status(EnforcementStatus.BLOCKED)
                        .reason(permission.getReason())
                        .permission(permission)
                        .build();
            }
            if (permission.isRequiresHumanApproval()) {
                return EnforcementResult.builder()
                        .proceed(true)
                        .status(EnforcementStatus.PENDING_APPROVAL)
                        .reason("Human approval required before '" + actionName + "' takes effect")
                        .permission(permission)
                        .build();
            }
            return EnforcementResult.builder()
                    .proceed(true)
                    .status(EnforcementStatus.APPROVED)
                    .reason(permission.getReason())
                    .permission(permission)
                    .build();
        });
    }

    private Mono<Agent> invalidateCached(Agent agent) {
        return governanceCache.invalidate(agent.getId())
                .onErrorResume(e -> {
                    log.warn("Failed to invalidate maturity cache for agent {}: {}", agent.getId(), e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(agent);
    }
}
