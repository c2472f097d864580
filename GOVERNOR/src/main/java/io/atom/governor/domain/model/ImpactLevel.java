package io.atom.governor.domain.model;

/**
 * Magnitude of a confidence adjustment.
 */
public enum ImpactLevel {
    LOW(0.01),
    HIGH(0.10);

    private final double delta;

    ImpactLevel(double delta) {
        this.delta = delta;
    }

    public double delta() {
        return delta;
    }
}
