package com.depintel.core.model;

import java.util.Objects;

/**
 * One entry of a project's flat manifest list.
 *
 * @param name package name as published in its registry
 * @param ecosystem package ecosystem (npm, pypi, maven, ...)
 * @param versionConstraint declared version or constraint ({@code *} when absent)
 * @param usage usage signals for this dependency (never null, components may be unknown)
 */
public record DeclaredDependency(
    String name,
    String ecosystem,
    String versionConstraint,
    UsageSignals usage
) {
    /**
     * Compact constructor with validation.
     */
    public DeclaredDependency {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(ecosystem, "ecosystem must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (versionConstraint == null || versionConstraint.isBlank()) {
            versionConstraint = "*";
        }
        if (usage == null) {
            usage = UsageSignals.unknown();
        }
    }

    /**
     * Creates a declared dependency without usage signals.
     *
     * @param name package name
     * @param ecosystem package ecosystem
     * @param versionConstraint declared constraint
     * @return declared dependency
     */
    public static DeclaredDependency of(String name, String ecosystem, String versionConstraint) {
        return new DeclaredDependency(name, ecosystem, versionConstraint, null);
    }
}
