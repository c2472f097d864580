package io.atom.governor.client.impl;

import io.atom.governor.client.PermissionChecker;
import io.atom.governor.config.GovernorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

/**
 * Tests for {@link ConfiguredPermissionChecker}.
 */
class ConfiguredPermissionCheckerTest {

    private ConfiguredPermissionChecker checker;

    @BeforeEach
    void setUp() {
        GovernorProperties properties = new GovernorProperties();
        properties.getPermissions().getMaturityAdmins().add("admin");
        checker = new ConfiguredPermissionChecker(properties);
    }

    @Test
    @DisplayName("should grant promotion and demotion to configured admins")
    void adminsPermitted() {
        StepVerifier.create(checker.checkPermission("admin", PermissionChecker.PROMOTE)).expectNext(true).verifyComplete();
        StepVerifier.create(checker.checkPermission("admin", PermissionChecker.DEMOTE)).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("should deny other users")
    void othersDenied() {
        StepVerifier.create(checker.checkPermission("user-1", PermissionChecker.PROMOTE)).expectNext(false).verifyComplete();
        StepVerifier.create(checker.checkPermission(null, PermissionChecker.PROMOTE)).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("should deny actions it does not govern")
    void unknownActionDenied() {
        StepVerifier.create(checker.checkPermission("admin", "delete_agent")).expectNext(false).verifyComplete();
    }
}
