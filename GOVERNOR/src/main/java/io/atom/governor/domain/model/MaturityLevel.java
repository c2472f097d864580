package io.atom.governor.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discrete governance tier of an agent.
 * Levels are strictly ordered; each level bounds the highest action complexity the agent may perform.
 */
public enum MaturityLevel {
    STUDENT("student", 1, 0.0),
    INTERN("intern", 2, 0.5),
    SUPERVISED("supervised", 3, 0.7),
    AUTONOMOUS("autonomous", 4, 0.9);

    private final String value;
    private final int ceiling;
    private final double confidenceFloor;

    MaturityLevel(String value, int ceiling, double confidenceFloor) {
        this.value = value;
        this.ceiling = ceiling;
        this.confidenceFloor = confidenceFloor;
    }

    public String getValue() {
        return value;
    }

    /**
     * Highest action complexity tier this level may perform.
     */
    public int ceiling() {
        return ceiling;
    }

    /**
     * Lowest confidence score normally associated with this level.
     */
    public double confidenceFloor() {
        return confidenceFloor;
    }

    /**
     * The next level up, or empty when already autonomous.
     */
    public Optional<MaturityLevel> next() {
        return this == AUTONOMOUS ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
    }

    /**
     * The next level down, or empty when already a student.
     */
    public Optional<MaturityLevel> previous() {
        return this == STUDENT ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    /**
     * Lowest level allowed to perform an action of the given complexity.
     */
    public static MaturityLevel requiredFor(int complexity) {
        return Arrays.stream(values())
                .filter(level -> level.ceiling >= complexity)
                .findFirst()
                .orElse(AUTONOMOUS);
    }

    /**
     * Derive a level purely from a confidence score (thresholds 0.5 / 0.7 / 0.9).
     */
    public static MaturityLevel fromConfidence(double confidence) {
        if (confidence >= AUTONOMOUS.confidenceFloor) return AUTONOMOUS;
        if (confidence >= SUPERVISED.confidenceFloor) return SUPERVISED;
        if (confidence >= INTERN.confidenceFloor) return INTERN;
        return STUDENT;
    }

    /**
     * Parse a stored status value, ignoring case. Empty for null or unknown values.
     */
    public static Optional<MaturityLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(level -> level.value.equals(normalized))
                .findFirst();
    }

    /**
     * Resolve the effective level from a stored status and confidence pair.
     * The stored status wins; confidence is only consulted when the status is missing or unreadable.
     */
    public static MaturityLevel resolve(String status, double confidence) {
        return fromValue(status).orElseGet(() -> fromConfidence(confidence));
    }
}
