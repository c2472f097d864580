package io.atom.governor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Configuration properties for the GOVERNOR service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "governor")
public class GovernorProperties {

    private CacheProperties cache = new CacheProperties();
    private StoreProperties store = new StoreProperties();
    private ResolverProperties resolver = new ResolverProperties();
    private DefaultAgentProperties defaultAgent = new DefaultAgentProperties();
    private TrainingProperties training = new TrainingProperties();
    private PermissionProperties permissions = new PermissionProperties();

    @Data
    public static class CacheProperties {
        private String backend = "local"; // local, redis
        private Duration maturityTtl = Duration.ofSeconds(60);
        private int maxSize = 10_000;
        private Duration timeout = Duration.ofMillis(250);
        private String keyPrefix = "governor:maturity:";
    }

    @Data
    public static class StoreProperties {
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ResolverProperties {
        /**
         * When true an explicit agent id that does not resolve fails the call;
         * when false the fallback chain continues.
         */
        private boolean strictExplicitAgent = true;
        private String defaultActionType = "chat";
    }

    @Data
    public static class DefaultAgentProperties {
        private String name = "Chat Assistant";
        private String category = "system";
        private String modulePath = "system";
        private String className = "ChatAssistant";
        private double confidence = 0.5;
        private String systemPrompt = "You are a helpful assistant. Answer questions and present information clearly.";
        private Set<String> capabilities = new HashSet<>(Set.of("chat", "search", "summarize", "present_chart", "present_markdown"));
    }

    @Data
    public static class TrainingProperties {
        private String baseUrl; // empty = local training proposals
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class PermissionProperties {
        /**
         * Users allowed to promote and demote agents.
         */
        private Set<String> maturityAdmins = new HashSet<>();
    }
}
