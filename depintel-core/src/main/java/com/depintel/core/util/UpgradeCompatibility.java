package com.depintel.core.util;

import com.depintel.core.model.PackageMetadata.BreakingChange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores how safely a dependency can move from one version to another.
 *
 * <p>The score starts at 1.0 and loses a fixed amount for the kind of version change
 * (major 0.3, minor 0.1, patch 0.02, downgrades 0.5 / 0.2 / 0.05) and for each expected
 * breaking change (high 0.15, medium 0.08, low 0.03). Expected breaking changes are the one
 * implied by the version change itself plus every announced breaking change released after
 * the current version and no later than the target.
 */
public final class UpgradeCompatibility {

    static final double MAJOR_CHANGE_CONFIDENCE = 0.8;
    static final double MINOR_CHANGE_CONFIDENCE = 0.6;
    static final double ANNOUNCED_CONFIDENCE = 0.9;
    static final double BASE_CONFIDENCE = 0.7;

    private UpgradeCompatibility() {
        // Utility class
    }

    /**
     * Kind of change between two versions.
     */
    public enum VersionChange {
        MAJOR(0.3, 0.15),
        MINOR(0.1, 0.05),
        PATCH(0.02, 0.05),
        SAME(0.0, 0.0),
        MAJOR_DOWNGRADE(0.5, -0.1),
        MINOR_DOWNGRADE(0.2, -0.1),
        PATCH_DOWNGRADE(0.05, -0.1);

        private final double penalty;
        private final double confidenceShift;

        VersionChange(double penalty, double confidenceShift) {
            this.penalty = penalty;
            this.confidenceShift = confidenceShift;
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Impact of an expected breaking change.
     */
    public enum Impact {
        HIGH(0.15),
        MEDIUM(0.08),
        LOW(0.03);

        private final double penalty;

        Impact(double penalty) {
            this.penalty = penalty;
        }
    }

    /**
     * A breaking change expected on the way to the target version.
     *
     * @param version version introducing it
     * @param description what changes
     * @param impact expected impact
     * @param confidence how sure the expectation is, in [0, 1]
     */
    public record ExpectedChange(String version, String description, Impact impact, double confidence) {
        public ExpectedChange {
            Objects.requireNonNull(version, "version must not be null");
            Objects.requireNonNull(impact, "impact must not be null");
        }
    }

    /**
     * Result of scoring one version transition.
     *
     * @param from current version
     * @param to target version
     * @param change kind of version change
     * @param expectedChanges breaking changes expected between the two
     * @param score compatibility in [0, 1], higher is safer
     * @param confidence confidence in the score, in [0.1, 1]
     * @param action suggested action
     */
    public record Assessment(
        SemanticVersion from,
        SemanticVersion to,
        VersionChange change,
        List<ExpectedChange> expectedChanges,
        double score,
        double confidence,
        String action
    ) {
        public Assessment {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
            Objects.requireNonNull(change, "change must not be null");
            expectedChanges = expectedChanges == null ? List.of() : List.copyOf(expectedChanges);
        }
    }

    /**
     * Classifies the change from {@code current} to {@code target}. Pre-release tags are ignored.
     *
     * @param current current version
     * @param target target version
     * @return kind of change
     */
    public static VersionChange classify(SemanticVersion current, SemanticVersion target) {
        if (target.major() != current.major()) {
            return target.major() > current.major() ? VersionChange.MAJOR : VersionChange.MAJOR_DOWNGRADE;
        }
        if (target.minor() != current.minor()) {
            return target.minor() > current.minor() ? VersionChange.MINOR : VersionChange.MINOR_DOWNGRADE;
        }
        if (target.patch() != current.patch()) {
            return target.patch() > current.patch() ? VersionChange.PATCH : VersionChange.PATCH_DOWNGRADE;
        }
        return VersionChange.SAME;
    }

    /**
     * Scores a transition.
     *
     * @param current current version
     * @param target target version
     * @param announced breaking changes announced by the registry, any version
     * @return assessment
     */
    public static Assessment assess(SemanticVersion current, SemanticVersion target, List<BreakingChange> announced) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(target, "target must not be null");
        VersionChange change = classify(current, target);

        List<ExpectedChange> expected = new ArrayList<>();
        if (change == VersionChange.MAJOR) {
            expected.add(new ExpectedChange(target.toString(),
                "Major version change from " + current.major() + " to " + target.major(),
                Impact.HIGH, MAJOR_CHANGE_CONFIDENCE));
        } else if (change == VersionChange.MINOR) {
            expected.add(new ExpectedChange(target.toString(),
                "Minor version change from " + current.major() + "." + current.minor()
                    + " to " + target.major() + "." + target.minor(),
                Impact.MEDIUM, MINOR_CHANGE_CONFIDENCE));
        }
        if (announced != null) {
            for (BreakingChange breaking : announced) {
                SemanticVersion.parse(breaking.version())
                    .filter(version -> version.isAfter(current) && !version.isAfter(target))
                    .ifPresent(version -> expected.add(new ExpectedChange(breaking.version(),
                        breaking.description(), impactOf(breaking.compatibilityScore()), ANNOUNCED_CONFIDENCE)));
            }
        }

        double score = 1.0 - change.penalty;
        for (ExpectedChange expectedChange : expected) {
            score -= expectedChange.impact().penalty;
        }
        score = Scores.round(Scores.clamp(score));
        return new Assessment(current, target, change, expected, score,
            Scores.round(confidence(change, expected)), action(score));
    }

    static double confidence(VersionChange change, List<ExpectedChange> expected) {
        double confidence = BASE_CONFIDENCE + change.confidenceShift;
        if (!expected.isEmpty()) {
            double average = expected.stream().mapToDouble(ExpectedChange::confidence).average().orElseThrow();
            confidence = 0.7 * confidence + 0.3 * average;
        }
        return Math.max(0.1, Math.min(1.0, confidence));
    }

    /**
     * Maps a compatibility score to a suggested action.
     *
     * @param score compatibility score
     * @return {@code upgrade}, {@code upgrade_with_caution}, {@code careful_testing} or {@code not_recommended}
     */
    public static String action(double score) {
        if (score >= 0.9) {
            return "upgrade";
        }
        if (score >= 0.7) {
            return "upgrade_with_caution";
        }
        if (score >= 0.4) {
            return "careful_testing";
        }
        return "not_recommended";
    }

    // Announced changes without a score are assumed to hurt
    private static Impact impactOf(Double compatibilityScore) {
        if (compatibilityScore == null || compatibilityScore < 0.4) {
            return Impact.HIGH;
        }
        return compatibilityScore < 0.7 ? Impact.MEDIUM : Impact.LOW;
    }
}
