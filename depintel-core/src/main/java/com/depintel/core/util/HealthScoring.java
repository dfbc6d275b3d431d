package com.depintel.core.util;

import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.PackageMetadata.CommunitySignals;
import com.depintel.core.model.ReleaseRecord;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Health scoring shared by the health monitor and the impact scorer.
 *
 * <p>The composite is a weighted mean of two components, each in [0, 1]:
 * <ul>
 *   <li><b>staleness</b>: {@code max(0, 1 - daysSinceLastRelease / 730)}, reaching 0 after two
 *       years without a release</li>
 *   <li><b>community</b>: mean of contributor strength {@code min(1, log10(contributors + 1) / 2)}
 *       and {@code 1 - openIssueRatio}, over whichever of the two is known</li>
 * </ul>
 * Unknown components are left out and the remaining weights renormalized. A deprecated
 * package scores at most {@value #DEPRECATED_CAP}. When nothing is known the score is
 * {@code null} (unknown), never zero.
 */
public final class HealthScoring {

    /** Days without a release after which the staleness component is zero. */
    public static final int STALENESS_FLOOR_DAYS = 730;

    /** Upper bound for deprecated packages. */
    public static final double DEPRECATED_CAP = 0.1;

    static final int STALE_AFTER_DAYS = 365;
    static final int FEW_CONTRIBUTORS = 3;
    static final double HIGH_OPEN_ISSUE_RATIO = 0.5;

    private HealthScoring() {
        // Utility class
    }

    /**
     * Assesses a graph node.
     *
     * @param node node to assess
     * @param today reference date
     * @param stalenessWeight relative weight of the staleness component
     * @param communityWeight relative weight of the community component
     * @return assessment
     */
    public static HealthAssessment assess(DependencyNode node, LocalDate today,
                                          double stalenessWeight, double communityWeight) {
        return assess(node.metadata(), node.releases(), today, stalenessWeight, communityWeight);
    }

    /**
     * Assesses a package from its metadata and release history.
     *
     * @param metadata registry metadata, {@code null} when unknown
     * @param releases release history (any order)
     * @param today reference date
     * @param stalenessWeight relative weight of the staleness component
     * @param communityWeight relative weight of the community component
     * @return assessment
     */
    public static HealthAssessment assess(PackageMetadata metadata, List<ReleaseRecord> releases, LocalDate today,
                                          double stalenessWeight, double communityWeight) {
        Long daysSinceRelease = lastRelease(releases)
            .map(release -> Math.max(0L, ChronoUnit.DAYS.between(release.releaseDate(), today)))
            .orElse(null);
        Double staleness = daysSinceRelease == null ? null : stalenessScore(daysSinceRelease);
        Double community = communityScore(metadata == null ? null : metadata.community());

        double weighted = 0.0;
        double weightSum = 0.0;
        if (staleness != null) {
            weighted += stalenessWeight * staleness;
            weightSum += stalenessWeight;
        }
        if (community != null) {
            weighted += communityWeight * community;
            weightSum += communityWeight;
        }
        Double score = weightSum > 0 ? Scores.clamp(weighted / weightSum) : null;

        boolean deprecated = metadata != null && metadata.deprecated();
        if (deprecated) {
            score = score == null ? DEPRECATED_CAP : Math.min(score, DEPRECATED_CAP);
        }
        if (score != null) {
            score = Scores.round(score);
        }

        return new HealthAssessment(score, staleness == null ? null : Scores.round(staleness),
            community == null ? null : Scores.round(community), daysSinceRelease, deprecated,
            riskFactors(metadata, daysSinceRelease, deprecated));
    }

    /**
     * Staleness component for a number of days since the last release.
     *
     * @param days days since last release, non-negative
     * @return score in [0, 1]
     */
    public static double stalenessScore(long days) {
        return Math.max(0.0, 1.0 - (double) days / STALENESS_FLOOR_DAYS);
    }

    /**
     * Community component, or {@code null} when no signal is known.
     *
     * @param community community signals
     * @return score in [0, 1] or {@code null}
     */
    public static Double communityScore(CommunitySignals community) {
        if (community == null) {
            return null;
        }
        List<Double> parts = new ArrayList<>(2);
        if (community.contributorCount() != null) {
            parts.add(Math.min(1.0, Math.log10(community.contributorCount() + 1.0) / 2.0));
        }
        if (community.openIssueRatio() != null) {
            parts.add(1.0 - community.openIssueRatio());
        }
        if (parts.isEmpty()) {
            return null;
        }
        return parts.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    /**
     * Latest non-yanked release, falling back to the latest release of any kind.
     *
     * @param releases release history
     * @return most recent release
     */
    public static Optional<ReleaseRecord> lastRelease(List<ReleaseRecord> releases) {
        if (releases == null || releases.isEmpty()) {
            return Optional.empty();
        }
        Comparator<ReleaseRecord> byDate = Comparator.comparing(ReleaseRecord::releaseDate);
        Optional<ReleaseRecord> published = releases.stream().filter(r -> !r.yanked()).max(byDate);
        return published.isPresent() ? published : releases.stream().max(byDate);
    }

    private static List<String> riskFactors(PackageMetadata metadata, Long daysSinceRelease, boolean deprecated) {
        List<String> factors = new ArrayList<>();
        if (deprecated) {
            factors.add("deprecated");
        }
        if (daysSinceRelease == null) {
            factors.add("no_release_history");
        } else if (daysSinceRelease > STALE_AFTER_DAYS) {
            factors.add("stale");
        }
        if (metadata != null) {
            if (!metadata.vulnerabilities().isEmpty()) {
                factors.add("known_vulnerabilities");
            }
            CommunitySignals community = metadata.community();
            if (community != null && community.contributorCount() != null
                    && community.contributorCount() < FEW_CONTRIBUTORS) {
                factors.add("few_contributors");
            }
            if (community != null && community.openIssueRatio() != null
                    && community.openIssueRatio() > HIGH_OPEN_ISSUE_RATIO) {
                factors.add("high_open_issue_ratio");
            }
        } else {
            factors.add("missing_metadata");
        }
        return List.copyOf(factors);
    }

    /**
     * Result of a health assessment.
     *
     * @param score composite score, {@code null} when unknown
     * @param stalenessScore staleness component, {@code null} when there is no release history
     * @param communityScore community component, {@code null} when no signal is known
     * @param daysSinceLastRelease days since the latest release, {@code null} when unknown
     * @param deprecated whether the package is deprecated
     * @param riskFactors short machine-readable risk tags
     */
    public record HealthAssessment(
        Double score,
        Double stalenessScore,
        Double communityScore,
        Long daysSinceLastRelease,
        boolean deprecated,
        List<String> riskFactors
    ) {
        public HealthAssessment {
            riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        }

        public HealthStatus status() {
            return HealthStatus.of(score);
        }

        public boolean isKnown() {
            return score != null;
        }
    }
}
