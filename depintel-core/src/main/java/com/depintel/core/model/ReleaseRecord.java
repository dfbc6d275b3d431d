package com.depintel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One published release of a package.
 *
 * @param version released version string
 * @param releaseDate publication date
 * @param yanked whether the release was withdrawn from the registry
 */
public record ReleaseRecord(
    String version,
    LocalDate releaseDate,
    boolean yanked
) {
    /**
     * Compact constructor with validation.
     */
    public ReleaseRecord {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(releaseDate, "releaseDate must not be null");
    }

    /**
     * Creates a regular (not yanked) release.
     *
     * @param version released version
     * @param releaseDate publication date
     * @return release record
     */
    public static ReleaseRecord of(String version, LocalDate releaseDate) {
        return new ReleaseRecord(version, releaseDate, false);
    }
}
