package com.depintel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The six analyses the engine can run.
 */
public enum AnalysisType {
    IMPACT_SCORING("impact_scoring"),
    COMPATIBILITY_PREDICTION("compatibility_prediction"),
    DEPENDENCY_CONSOLIDATION("dependency_consolidation"),
    HEALTH_MONITORING("health_monitoring"),
    LICENSE_COMPLIANCE("license_compliance"),
    PERFORMANCE_PROFILING("performance_profiling");

    private final String id;

    AnalysisType(String id) {
        this.id = id;
    }

    /**
     * Returns the wire identifier used in job submissions and result documents.
     *
     * @return snake_case identifier
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a wire identifier.
     *
     * @param id snake_case identifier, case-insensitive
     * @return matching type, or empty for unknown identifiers
     */
    public static Optional<AnalysisType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(type -> type.id.equals(normalized))
            .findFirst();
    }
}
