package io.atom.governor.client.impl;

import io.atom.governor.client.TrainingClient;
import io.atom.governor.config.GovernorProperties;
import io.atom.governor.domain.model.AgentProposal;
import io.atom.governor.domain.model.BlockedTriggerContext;
import io.atom.governor.domain.model.MaturityLevel;
import io.atom.governor.domain.repository.AgentProposalRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * WebClient-based implementation of {@link TrainingClient}.
 * Without a configured base URL it runs in local mode and records the training proposal itself.
 */
@Component
@Slf4j
public class WebClientTrainingClient implements TrainingClient {

    static final String SYSTEM_PROPOSER = "system";

    private final WebClient webClient;
    private final GovernorProperties.TrainingProperties config;
    private final AgentProposalRepository proposalRepository;
    private final boolean localMode;

    public WebClientTrainingClient(GovernorProperties properties, AgentProposalRepository proposalRepository) {
        this.config = properties.getTraining();
        this.proposalRepository = proposalRepository;

        this.localMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!localMode) {
            this.webClient = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Training client running in local mode - training proposals are recorded locally");
        }
    }

    @Override
    @CircuitBreaker(name = "training")
    @Retry(name = "training")
    public Mono<AgentProposal> createTrainingProposal(BlockedTriggerContext blockedContext) {
        if (localMode) {
            return proposalRepository.save(buildLocalProposal(blockedContext))
                    .doOnSuccess(p -> log.info("Recorded local training proposal {} for agent {}",
                            p.getId(), p.getAgentId()));
        }

        return webClient.post()
                .uri("/api/v1/training/proposals")
                .bodyValue(blockedContext)
                .retrieve()
                .bodyToMono(AgentProposal.class)
                .timeout(config.getTimeout())
                .doOnSuccess(p -> log.debug("Training service created proposal {}", p.getId()))
                .doOnError(e -> log.error("Training proposal request failed: {}", e.getMessage()));
    }

    AgentProposal buildLocalProposal(BlockedTriggerContext blocked) {
        String targetLevel = MaturityLevel.fromValue(blocked.getAgentMaturityAtBlock())
                .flatMap(MaturityLevel::next)
                .orElse(MaturityLevel.INTERN)
                .getValue();

        Map<String, Object> action = new HashMap<>();
        action.put("type", AgentProposal.TYPE_TRAINING);
        action.put("blocked_trigger_id", blocked.getId());
        action.put("target_maturity", targetLevel);

        String description = String.format(Locale.ROOT,
                "%s was blocked from running '%s' (source: %s) at maturity %s with confidence %.2f. "
                        + "Reason: %s. Complete supervised training to progress toward %s.",
                blocked.getAgentName() != null ? blocked.getAgentName() : blocked.getAgentId(),
                blocked.getTriggerType(),
                blocked.getTriggerSource(),
                blocked.getAgentMaturityAtBlock(),
                blocked.getConfidenceScoreAtBlock() != null ? blocked.getConfidenceScoreAtBlock() : 0.0,
                blocked.getBlockReason(),
                targetLevel);

        return AgentProposal.builder()
                .agentId(blocked.getAgentId())
                .agentName(blocked.getAgentName())
                .proposalType(AgentProposal.TYPE_TRAINING)
                .title("Training: " + blocked.getTriggerType())
                .description(description)
                .proposedAction(action)
                .triggerContext(blocked.getTriggerContext())
                .proposedBy(SYSTEM_PROPOSER)
                .workspaceId(blocked.getWorkspaceId())
                .build();
    }
}
