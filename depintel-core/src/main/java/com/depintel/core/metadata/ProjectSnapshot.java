package com.depintel.core.metadata;

import com.depintel.core.model.DeclaredDependency;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.ReleaseRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File-based capture of one project: its declared dependencies plus the registry data the
 * engine needs about every package reachable from them.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * projectId: storefront
 * dependencies:
 *   - name: axios
 *     ecosystem: npm
 *     versionConstraint: "^1.6.0"
 *     usage: { usedFeatures: 5, unusedFeatures: 2, usageScore: 0.8 }
 * packages:
 *   - name: axios
 *     ecosystem: npm
 *     latestVersion: 1.7.2
 *     licenses: [MIT]
 *     category: http-client
 *     requirements: { follow-redirects: "^1.15.0" }
 * releases:
 *   "npm:axios":
 *     - { version: 1.7.2, releaseDate: 2024-05-21 }
 * }</pre>
 *
 * @param projectId project identifier
 * @param dependencies declared (direct) dependencies
 * @param packages registry metadata for direct and transitive packages
 * @param releases release histories keyed by {@code ecosystem:name}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectSnapshot(
    @JsonProperty("projectId") String projectId,
    @JsonProperty("dependencies") List<DeclaredDependency> dependencies,
    @JsonProperty("packages") List<PackageMetadata> packages,
    @JsonProperty("releases") Map<String, List<ReleaseRecord>> releases
) {
    /**
     * Compact constructor with validation.
     */
    public ProjectSnapshot {
        Objects.requireNonNull(projectId, "projectId must not be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        packages = packages == null ? List.of() : List.copyOf(packages);
        releases = releases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(releases));
    }
}
