package com.depintel.core.model;

import java.util.Locale;

/**
 * Priority of a recommendation.
 */
public enum Severity {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    /**
     * @return numeric rank, higher is more urgent
     */
    public int rank() {
        return rank;
    }

    /**
     * @return lower-case label used in result documents
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the more urgent of two severities.
     *
     * @param a first severity
     * @param b second severity
     * @return the severity with the higher rank
     */
    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }
}
