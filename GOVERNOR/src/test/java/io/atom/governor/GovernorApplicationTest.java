package io.atom.governor;

import io.atom.governor.cache.GovernanceCache;
import io.atom.governor.cache.impl.CaffeineGovernanceCache;
import io.atom.governor.domain.model.ResolutionContext;
import io.atom.governor.domain.model.ResolvedAgent;
import io.atom.governor.domain.model.RoutingDecision;
import io.atom.governor.domain.model.TriggerSource;
import io.atom.governor.resolver.AgentContextResolver;
import io.atom.governor.trigger.TriggerInterceptorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context tests for {@link GovernorApplication} with the default local cache backend.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class GovernorApplicationTest {

    @Autowired
    private GovernanceCache governanceCache;

    @Autowired
    private AgentContextResolver resolver;

    @Autowired
    private TriggerInterceptorFactory interceptorFactory;

    @Test
    @DisplayName("should start with the local cache backend")
    void usesLocalCache() {
        assertThat(governanceCache).isInstanceOf(CaffeineGovernanceCache.class);
    }

    @Test
    @DisplayName("should route an automated trigger for the system default agent to training")
    void defaultAgentTriggerRoutesToTraining() {
        ResolvedAgent resolved = resolver.resolve("user-1", null, null).block();
        assertThat(resolved).isNotNull();
        assertThat(resolved.context().getResolutionPath()).containsExactly(ResolutionContext.SYSTEM_DEFAULT);

        StepVerifier.create(interceptorFactory.forWorkspace("ws-context")
                        .interceptTrigger(resolved.agent().getId(), TriggerSource.WORKFLOW_ENGINE,
                                Map.of("action", "send_email"), null))
                .assertNext(decision -> {
                    assertThat(decision.getRoutingDecision()).isEqualTo(RoutingDecision.TRAINING);
                    assertThat(decision.isExecute()).isFalse();
                    assertThat(decision.getBlockedContext().getWorkspaceId()).isEqualTo("ws-context");
                    assertThat(decision.getBlockedContext().getProposalId()).isNotNull();
                })
                .verifyComplete();
    }
}
