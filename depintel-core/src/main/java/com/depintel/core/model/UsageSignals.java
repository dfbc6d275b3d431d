package com.depintel.core.model;

/**
 * Project-specific usage signals for one declared dependency.
 *
 * <p>Produced by the upload side (static analysis of the project's sources). Every
 * component may be {@code null}, meaning the signal is unknown.
 *
 * @param usedFeatures number of package features the project uses
 * @param unusedFeatures number of package features the project imports but never uses
 * @param usageScore opaque usage score in [0, 1]
 */
public record UsageSignals(
    Integer usedFeatures,
    Integer unusedFeatures,
    Double usageScore
) {
    /**
     * Compact constructor with validation.
     */
    public UsageSignals {
        if (usedFeatures != null && usedFeatures < 0) {
            throw new IllegalArgumentException("usedFeatures must not be negative");
        }
        if (unusedFeatures != null && unusedFeatures < 0) {
            throw new IllegalArgumentException("unusedFeatures must not be negative");
        }
        if (usageScore != null && (usageScore < 0.0 || usageScore > 1.0)) {
            throw new IllegalArgumentException("usageScore must be within [0, 1]: " + usageScore);
        }
    }

    /**
     * Returns signals with every component unknown.
     *
     * @return unknown usage signals
     */
    public static UsageSignals unknown() {
        return new UsageSignals(null, null, null);
    }
}
