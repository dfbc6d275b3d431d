package com.depintel.core.util;

import java.util.Locale;

/**
 * Health bucket of a package.
 */
public enum HealthStatus {
    HEALTHY,
    MODERATE,
    AT_RISK;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a health score to its bucket. Unknown scores land in {@link #MODERATE}.
     *
     * @param score health score in [0, 1], or {@code null}
     * @return bucket
     */
    public static HealthStatus of(Double score) {
        if (score == null) {
            return MODERATE;
        }
        if (score >= 0.7) {
            return HEALTHY;
        }
        if (score >= 0.4) {
            return MODERATE;
        }
        return AT_RISK;
    }
}
