package com.depintel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry metadata bundle for one package.
 *
 * <p>Everything except identity is optional. {@code null} scalars and nested records mean
 * the registry did not report the value; analyzers surface those as unknown.
 *
 * @param name package name
 * @param ecosystem package ecosystem
 * @param latestVersion latest published version
 * @param licenses declared license identifiers (may be aliases, normalized later)
 * @param deprecated whether the registry flags the package as deprecated
 * @param deprecationMessage registry deprecation notice
 * @param category functional category ("http-client", "testing", ...)
 * @param requirements package name to version constraint of the package's own dependencies
 * @param community community activity signals
 * @param size bundle size figures
 * @param runtime runtime cost figures
 * @param vulnerabilities known vulnerabilities
 * @param breakingChanges announced breaking changes
 * @param alternatives names of packages offering the same functionality
 */
public record PackageMetadata(
    String name,
    String ecosystem,
    String latestVersion,
    List<String> licenses,
    boolean deprecated,
    String deprecationMessage,
    String category,
    Map<String, String> requirements,
    CommunitySignals community,
    SizeMetrics size,
    RuntimeMetrics runtime,
    List<Vulnerability> vulnerabilities,
    List<BreakingChange> breakingChanges,
    List<String> alternatives
) {
    /**
     * Compact constructor with validation.
     */
    public PackageMetadata {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(ecosystem, "ecosystem must not be null");
        licenses = licenses == null ? List.of() : List.copyOf(licenses);
        requirements = requirements == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
        vulnerabilities = vulnerabilities == null ? List.of() : List.copyOf(vulnerabilities);
        breakingChanges = breakingChanges == null ? List.of() : List.copyOf(breakingChanges);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    /**
     * Creates a metadata bundle carrying only identity, latest version and licenses.
     *
     * @param name package name
     * @param ecosystem package ecosystem
     * @param latestVersion latest version
     * @param licenses license identifiers
     * @return metadata bundle
     */
    public static PackageMetadata basic(String name, String ecosystem, String latestVersion, List<String> licenses) {
        return new PackageMetadata(name, ecosystem, latestVersion, licenses, false, null, null,
            null, null, null, null, null, null, null);
    }

    /**
     * Returns whether the bundle resolves the package: a latest version or license info is known.
     *
     * @return true when at least one resolving field is present
     */
    public boolean isResolved() {
        return latestVersion != null || !licenses.isEmpty();
    }

    /**
     * Community activity signals. Either component may be unknown.
     *
     * @param contributorCount number of active contributors
     * @param openIssueRatio open issues divided by all issues, in [0, 1]
     */
    public record CommunitySignals(Integer contributorCount, Double openIssueRatio) {
        public CommunitySignals {
            if (contributorCount != null && contributorCount < 0) {
                throw new IllegalArgumentException("contributorCount must not be negative");
            }
            if (openIssueRatio != null && (openIssueRatio < 0.0 || openIssueRatio > 1.0)) {
                throw new IllegalArgumentException("openIssueRatio must be within [0, 1]: " + openIssueRatio);
            }
        }
    }

    /**
     * Bundle size figures in bytes.
     *
     * @param minifiedBytes minified size
     * @param gzippedBytes minified and gzipped size
     */
    public record SizeMetrics(Long minifiedBytes, Long gzippedBytes) {}

    /**
     * Runtime cost figures.
     *
     * @param startupMs time added to application startup
     * @param runtimeMs average per-operation overhead
     * @param memoryMb resident memory footprint
     */
    public record RuntimeMetrics(Double startupMs, Double runtimeMs, Double memoryMb) {}

    /**
     * A known vulnerability.
     *
     * @param id advisory identifier
     * @param severity advisory severity label
     * @param summary short description
     */
    public record Vulnerability(String id, String severity, String summary) {
        public Vulnerability {
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    /**
     * A breaking change announced for a release.
     *
     * @param version release introducing the change
     * @param description what breaks
     * @param compatibilityScore estimated share of dependents unaffected, in [0, 1]
     */
    public record BreakingChange(String version, String description, Double compatibilityScore) {
        public BreakingChange {
            Objects.requireNonNull(version, "version must not be null");
        }
    }
}
