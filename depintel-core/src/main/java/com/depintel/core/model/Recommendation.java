package com.depintel.core.model;

import java.util.Objects;

/**
 * An actionable suggestion derived from a completed analysis.
 *
 * @param title short headline
 * @param description explanation shown to the user
 * @param analysisType analysis the recommendation was extracted from
 * @param recommendationType category ({@code consolidation}, {@code license_compliance}, ...)
 * @param severity priority
 * @param dependency affected package name, {@code null} for project-wide recommendations
 * @param ecosystem ecosystem of the affected package, {@code null} when unknown or project-wide
 * @param versionTransition suggested version change, {@code null} when not applicable
 */
public record Recommendation(
    String title,
    String description,
    AnalysisType analysisType,
    String recommendationType,
    Severity severity,
    String dependency,
    String ecosystem,
    VersionTransition versionTransition
) {
    /**
     * Compact constructor with validation.
     */
    public Recommendation {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(analysisType, "analysisType must not be null");
        Objects.requireNonNull(recommendationType, "recommendationType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a recommendation about one dependency without a version change.
     */
    public static Recommendation forDependency(String dependency, String ecosystem, AnalysisType analysisType,
                                              String recommendationType, Severity severity,
                                              String title, String description) {
        return new Recommendation(title, description, analysisType, recommendationType, severity,
            dependency, ecosystem, null);
    }

    /**
     * Creates a project-wide recommendation.
     */
    public static Recommendation projectWide(AnalysisType analysisType, String recommendationType,
                                             Severity severity, String title, String description) {
        return new Recommendation(title, description, analysisType, recommendationType, severity,
            null, null, null);
    }

    /**
     * A suggested move from one version to another.
     *
     * @param from current version or constraint
     * @param to target version
     */
    public record VersionTransition(String from, String to) {}
}
