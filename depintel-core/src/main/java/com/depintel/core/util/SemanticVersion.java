package com.depintel.core.util;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient semantic version used for ordering and constraint checks across ecosystems.
 *
 * <p>Accepts {@code 1}, {@code 1.2}, {@code 1.2.3}, an optional leading {@code v} or
 * {@code =}, and a pre-release/qualifier suffix ({@code 1.2.3-beta.1}, {@code 2.0.0rc1}).
 * Build metadata after {@code +} is ignored. Missing minor and patch components are zero.
 *
 * @param major major component
 * @param minor minor component
 * @param patch patch component
 * @param preRelease qualifier, empty for final releases
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease)
        implements Comparable<SemanticVersion> {

    private static final Pattern VERSION = Pattern.compile(
        "^[vV=]?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:\\.\\d+)*[-.]?([0-9A-Za-z.-]*?)(?:\\+.*)?$");

    private static final Comparator<SemanticVersion> ORDER = Comparator
        .comparingInt(SemanticVersion::major)
        .thenComparingInt(SemanticVersion::minor)
        .thenComparingInt(SemanticVersion::patch)
        .thenComparing(SemanticVersion::preRelease, SemanticVersion::comparePreRelease);

    /**
     * Compact constructor with validation.
     */
    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must not be negative");
        }
        preRelease = preRelease == null ? "" : preRelease;
    }

    /**
     * Parses a version string.
     *
     * @param text version text
     * @return parsed version, or empty when the text holds no leading number
     */
    public static Optional<SemanticVersion> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = VERSION.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2)),
                matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3)),
                matcher.group(4)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a version string that is known to be valid.
     *
     * @param text version text
     * @return parsed version
     * @throws IllegalArgumentException when the text is not a version
     */
    public static SemanticVersion of(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Not a version: " + text));
    }

    public static SemanticVersion of(int major, int minor, int patch) {
        return new SemanticVersion(major, minor, patch, "");
    }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    public SemanticVersion nextMajor() {
        return of(major + 1, 0, 0);
    }

    public SemanticVersion nextMinor() {
        return of(major, minor + 1, 0);
    }

    public SemanticVersion nextPatch() {
        return of(major, minor, patch + 1);
    }

    /**
     * Counts how many minor releases this version trails {@code latest} by.
     *
     * <p>Any older major counts as {@link Integer#MAX_VALUE}.
     *
     * @param latest newer version
     * @return minor distance, 0 when not behind
     */
    public int minorsBehind(SemanticVersion latest) {
        Objects.requireNonNull(latest, "latest must not be null");
        if (major < latest.major) {
            return Integer.MAX_VALUE;
        }
        if (major > latest.major || minor >= latest.minor) {
            return 0;
        }
        return latest.minor - minor;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    public boolean isAfter(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        String base = major + "." + minor + "." + patch;
        return preRelease.isEmpty() ? base : base + "-" + preRelease;
    }

    // Final releases order after any qualifier of the same numbers.
    private static int comparePreRelease(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return Boolean.compare(a.isEmpty(), b.isEmpty());
        }
        return a.compareTo(b);
    }
}
