package io.atom.governor.resolver;

import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.ActionPermission;
import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.ChatSession;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.model.ResolutionContext;
import io.atom.governor.domain.model.ResolvedAgent;
import io.atom.governor.domain.repository.AgentRepository;
import io.atom.governor.domain.repository.ChatSessionRepository;
import io.atom.governor.error.AgentNotFoundException;
import io.atom.governor.error.StoreCallGuard;
import io.atom.governor.error.TransientGovernanceException;
import io.atom.governor.governance.AgentGovernanceService;
import io.atom.governor.observability.GovernanceEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which agent should handle a request.
 * <p>
 * Fallback chain: explicit agent id, then the agent bound to the chat session, then the
 * system default agent. Every step taken is recorded in the {@link ResolutionContext}.
 */
@Service
@Slf4j
public class AgentContextResolver {

    private final AgentRepository agentRepository;
    private final ChatSessionRepository chatSessionRepository;
    private final AgentGovernanceService governanceService;
    private final GovernanceEventLogger eventLogger;
    private final GovernorProperties.ResolverProperties resolverProperties;
    private final GovernorProperties.DefaultAgentProperties defaultAgentProperties;
    private final Duration storeTimeout;

    /**
     * Id of the system default agent. Concurrent first callers share one in-flight creation;
     * an error is not cached, so the next call retries.
     */
    private final Mono<String> systemDefaultAgentId;

    public AgentContextResolver(
            AgentRepository agentRepository,
            ChatSessionRepository chatSessionRepository,
            AgentGovernanceService governanceService,
            GovernanceEventLogger eventLogger,
            GovernorProperties properties) {
        this.agentRepository = agentRepository;
        this.chatSessionRepository = chatSessionRepository;
        this.governanceService = governanceService;
        this.eventLogger = eventLogger;
        this.resolverProperties = properties.getResolver();
        this.defaultAgentProperties = properties.getDefaultAgent();
        this.storeTimeout = properties.getStore().getTimeout();
        this.systemDefaultAgentId = Mono.defer(this::loadOrCreateSystemDefault)
                .map(Agent::getId)
                .cacheInvalidateIf(id -> false);
    }

    public Mono<ResolvedAgent> resolve(String userId, String sessionId, String requestedAgentId) {
        return resolve(userId, sessionId, requestedAgentId, resolverProperties.getDefaultActionType());
    }

    /**
     * Resolve the agent for a request.
     *
     * @return the resolved agent, or a {@link ResolvedAgent} without agent when every step failed.
     *         Fails with {@link AgentNotFoundException} when an explicit agent id does not resolve
     *         and strict explicit resolution is enabled, and with {@link TransientGovernanceException}
     *         when the explicit agent cannot be looked up.
     */
    public Mono<ResolvedAgent> resolve(String userId, String sessionId, String requestedAgentId, String actionType) {
        ResolutionContext context = ResolutionContext.builder()
                .userId(userId)
                .sessionId(sessionId)
                .requestedAgentId(requestedAgentId)
                .actionType(actionType != null ? actionType : resolverProperties.getDefaultActionType())
                .build();

        return fromExplicitId(requestedAgentId, context)
                .switchIfEmpty(Mono.defer(() -> fromSession(sessionId, context)))
                .switchIfEmpty(Mono.defer(() -> fromSystemDefault(context)))
                .map(agent -> finish(context, agent))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    context.addStep(ResolutionContext.RESOLUTION_FAILED);
                    return finish(context, null);
                }));
    }

    private Mono<Agent> fromExplicitId(String requestedAgentId, ResolutionContext context) {
        if (!StringUtils.hasText(requestedAgentId)) {
            return Mono.empty();
        }
        return agentRepository.findById(requestedAgentId)
                .transform(StoreCallGuard.guard("resolveExplicitAgent", storeTimeout))
                .doOnNext(agent -> context.addStep(ResolutionContext.EXPLICIT_AGENT_ID))
                .switchIfEmpty(Mono.defer(() -> {
                    if (resolverProperties.isStrictExplicitAgent()) {
                        return Mono.<Agent>error(new AgentNotFoundException(requestedAgentId));
                    }
                    context.addStep(ResolutionContext.EXPLICIT_AGENT_ID_NOT_FOUND);
                    return Mono.<Agent>empty();
                }))
                .doOnError(TransientGovernanceException.class, e ->
                        log.warn("Explicit agent lookup failed for {}: {}", requestedAgentId, e.getMessage()));
    }

    private Mono<Agent> fromSession(String sessionId, ResolutionContext context) {
        if (!StringUtils.hasText(sessionId)) {
            return Mono.empty();
        }
        return chatSessionRepository.findById(sessionId)
                .transform(StoreCallGuard.guard("findSession", storeTimeout))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(session -> {
                    String boundAgentId = session.map(ChatSession::boundAgentId).orElse(null);
                    if (!StringUtils.hasText(boundAgentId)) {
                        context.addStep(ResolutionContext.NO_SESSION_AGENT);
                        return Mono.<Agent>empty();
                    }
                    return agentRepository.findById(boundAgentId)
                            .transform(StoreCallGuard.guard("findSessionAgent", storeTimeout))
                            .doOnNext(agent -> context.addStep(ResolutionContext.SESSION_AGENT))
                            .switchIfEmpty(Mono.fromRunnable(
                                    () -> context.addStep(ResolutionContext.SESSION_AGENT_NOT_FOUND)));
                })
                .onErrorResume(e -> {
                    log.warn("Session agent lookup failed for session {}: {}", sessionId, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Agent> fromSystemDefault(ResolutionContext context) {
        return systemDefaultAgentId
                .flatMap(agentRepository::findById)
                .transform(StoreCallGuard.guard("findSystemDefault", storeTimeout))
                .doOnNext(agent -> context.addStep(ResolutionContext.SYSTEM_DEFAULT))
                .onErrorResume(e -> {
                    log.error("Failed to resolve system default agent: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Agent> loadOrCreateSystemDefault() {
        return agentRepository.findByModule(defaultAgentProperties.getModulePath(), defaultAgentProperties.getClassName())
                .switchIfEmpty(Mono.defer(() -> {
                    Map<String, Object> configuration = new HashMap<>();
                    configuration.put("system_prompt", defaultAgentProperties.getSystemPrompt());
                    configuration.put("capabilities", new ArrayList<>(defaultAgentProperties.getCapabilities()));

                    Agent agent = Agent.builder()
                            .name(defaultAgentProperties.getName())
                            .description("Default system agent for general conversations")
                            .category(defaultAgentProperties.getCategory())
                            .modulePath(defaultAgentProperties.getModulePath())
                            .className(defaultAgentProperties.getClassName())
                            .status(MaturityLevel.STUDENT)
                            .confidenceScore(defaultAgentProperties.getConfidence())
                            .configuration(configuration)
                            .build();
                    log.info("Creating system default agent '{}'", agent.getName());
                    return agentRepository.save(agent);
                }))
                .transform(StoreCallGuard.guard("loadOrCreateSystemDefault", storeTimeout));
    }

    private ResolvedAgent finish(ResolutionContext context, Agent agent) {
        context.setResolvedAt(Instant.now());
        String agentId = agent != null ? agent.getId() : null;
        eventLogger.logAgentResolved(context, agentId);
        if (agent == null) {
            log.error("Agent resolution failed for user {} (path {})", context.getUserId(), context.getResolutionPath());
        }
        return new ResolvedAgent(agent, context);
    }

    /**
     * Bind an agent to a chat session, keeping any other session metadata.
     *
     * @return false when the session or the agent does not exist or the store call fails
     */
    public Mono<Boolean> setSessionAgent(String sessionId, String agentId) {
        return chatSessionRepository.findById(sessionId)
                .zipWith(agentRepository.findById(agentId))
                .flatMap(found -> {
                    ChatSession session = found.getT1();
                    Map<String, Object> metadata = session.getMetadata() != null
                            ? new HashMap<>(session.getMetadata())
                            : new HashMap<>();
                    metadata.put(ChatSession.AGENT_ID_KEY, agentId);
                    session.setMetadata(metadata);
                    return chatSessionRepository.save(session);
                })
                .transform(StoreCallGuard.guard("setSessionAgent", storeTimeout))
                .map(saved -> {
                    log.info("Bound agent {} to session {}", agentId, sessionId);
                    return true;
                })
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Failed to bind agent {} to session {}: {}", agentId, sessionId, e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Check a resolved agent against an action through the governance ledger.
     */
    public Mono<ActionPermission> validateAgentForAction(Agent agent, String actionType, Boolean requireApproval) {
        return governanceService.canPerformAction(agent.getId(), actionType, requireApproval);
    }
}
