package io.atom.governor.client;

import reactor.core.publisher.Mono;

/**
 * Authorization check consulted before maturity promotions and demotions.
 */
public interface PermissionChecker {

    String PROMOTE = "promote";
    String DEMOTE = "demote";

    /**
     * Check whether a user may perform a governance action.
     *
     * @param userId the acting user
     * @param action {@link #PROMOTE} or {@link #DEMOTE}
     * @return true if permitted
     */
    Mono<Boolean> checkPermission(String userId, String action);
}
