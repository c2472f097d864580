package io.atom.governor.domain.model;

/**
 * Verdict of the trigger interceptor.
 */
public enum RoutingDecision {
    TRAINING("training"),
    PROPOSAL("proposal"),
    SUPERVISION("supervision"),
    EXECUTION("execution");

    private final String value;

    RoutingDecision(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
