package com.depintel.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A package in a project's dependency graph.
 *
 * <p>Identity is {@code (ecosystem, name)}; one node exists per identity no matter how many
 * parents request it. Every constraint requested for the package is kept in
 * {@link #versionUsage()} together with the parents that requested it.
 *
 * @param name package name
 * @param ecosystem package ecosystem
 * @param versionConstraint constraint that introduced the node (the declared one for direct nodes)
 * @param latestVersion resolved latest version, {@code null} when unknown
 * @param depth shortest edge count from the project root minus one (0 = direct)
 * @param parents ids of requiring nodes ({@code project} for direct dependencies)
 * @param versionUsage requested constraint to ids of the parents requesting it
 * @param usage project usage signals (unknown for transitive nodes)
 * @param metadata registry metadata, {@code null} when unknown
 * @param releases release history, oldest first (empty when unknown)
 */
public record DependencyNode(
    String name,
    String ecosystem,
    String versionConstraint,
    String latestVersion,
    int depth,
    Set<String> parents,
    Map<String, Set<String>> versionUsage,
    UsageSignals usage,
    PackageMetadata metadata,
    List<ReleaseRecord> releases
) {
    /**
     * Compact constructor with validation.
     */
    public DependencyNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(ecosystem, "ecosystem must not be null");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        if (versionConstraint == null) {
            versionConstraint = "*";
        }
        parents = parents == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(parents));
        if (versionUsage == null) {
            versionUsage = Map.of();
        } else {
            Map<String, Set<String>> copy = new TreeMap<>();
            versionUsage.forEach((constraint, requesters) ->
                copy.put(constraint, Collections.unmodifiableSet(new TreeSet<>(requesters))));
            versionUsage = Collections.unmodifiableMap(copy);
        }
        if (usage == null) {
            usage = UsageSignals.unknown();
        }
        releases = releases == null ? List.of() : List.copyOf(releases);
    }

    /**
     * Builds the node id for a package identity.
     *
     * @param ecosystem package ecosystem
     * @param name package name
     * @return {@code ecosystem:name}
     */
    public static String idOf(String ecosystem, String name) {
        return ecosystem + ":" + name;
    }

    public String id() {
        return idOf(ecosystem, name);
    }

    public boolean isDirect() {
        return depth == 0;
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    /**
     * @return functional category from metadata, or {@code null}
     */
    public String category() {
        return metadata == null ? null : metadata.category();
    }

    /**
     * @return license identifiers from metadata (empty when unknown)
     */
    public List<String> licenses() {
        return metadata == null ? List.of() : metadata.licenses();
    }

    public boolean isDeprecated() {
        return metadata != null && metadata.deprecated();
    }
}
