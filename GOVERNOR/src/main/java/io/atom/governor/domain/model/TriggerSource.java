package io.atom.governor.domain.model;

/**
 * Origin of a trigger. Only {@link #MANUAL} is human-initiated.
 */
public enum TriggerSource {
    MANUAL("manual"),
    DATA_SYNC("data_sync"),
    WORKFLOW_ENGINE("workflow_engine"),
    AI_COORDINATOR("ai_coordinator");

    private final String value;

    TriggerSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAutomated() {
        return this != MANUAL;
    }
}
