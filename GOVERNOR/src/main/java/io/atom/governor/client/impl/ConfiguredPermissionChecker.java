package io.atom.governor.client.impl;

import io.atom.governor.client.PermissionChecker;
import io.atom.governor.config.GovernorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Grants promotion and demotion to the users listed in {@code governor.permissions.maturity-admins}.
 */
@Component
@Slf4j
public class ConfiguredPermissionChecker implements PermissionChecker {

    private static final Set<String> GOVERNED_ACTIONS = Set.of(PROMOTE, DEMOTE);

    private final GovernorProperties.PermissionProperties config;

    public ConfiguredPermissionChecker(GovernorProperties properties) {
        this.config = properties.getPermissions();
    }

    @Override
    public Mono<Boolean> checkPermission(String userId, String action) {
        if (userId == null || !GOVERNED_ACTIONS.contains(action)) {
            return Mono.just(false);
        }
        boolean permitted = config.getMaturityAdmins().contains(userId);
        if (!permitted) {
            log.debug("User {} lacks permission for {}", userId, action);
        }
        return Mono.just(permitted);
    }
}
