package io.atom.governor.error;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;

/**
 * Bounds a record-store call by a deadline and surfaces infrastructure failures as
 * {@link TransientGovernanceException}. Governance errors pass through untouched.
 */
public final class StoreCallGuard {

    private StoreCallGuard() {
    }

    public static <T> Function<Mono<T>, Mono<T>> guard(String operation, Duration timeout) {
        return mono -> mono
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof GovernanceException),
                        e -> new TransientGovernanceException(
                                "Record store call '" + operation + "' failed: " + e.getMessage(), e));
    }

    /**
     * Multi-row variant; the deadline applies to each emitted row.
     */
    public static <T> Function<Flux<T>, Flux<T>> guardAll(String operation, Duration timeout) {
        return flux -> flux
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof GovernanceException),
                        e -> new TransientGovernanceException(
                                "Record store call '" + operation + "' failed: " + e.getMessage(), e));
    }
}
