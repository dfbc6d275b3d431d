package com.depintel.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemanticVersionTest {

    @ParameterizedTest
    @CsvSource({
        "1.2.3, 1, 2, 3, ''",
        "v2.0, 2, 0, 0, ''",
        "7, 7, 0, 0, ''",
        "1.2.3-beta.1, 1, 2, 3, beta.1",
        "2.0.0rc1, 2, 0, 0, rc1",
        "3.1.4+build.7, 3, 1, 4, ''",
        "=4.5.6, 4, 5, 6, ''"
    })
    void parse_variousFormats_extractsComponents(String text, int major, int minor, int patch, String pre) {
        SemanticVersion version = SemanticVersion.of(text);

        assertThat(version.major()).isEqualTo(major);
        assertThat(version.minor()).isEqualTo(minor);
        assertThat(version.patch()).isEqualTo(patch);
        assertThat(version.preRelease()).isEqualTo(pre);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "latest", "abc", "*"})
    void parse_nonVersions_returnsEmpty(String text) {
        assertThat(SemanticVersion.parse(text)).isEmpty();
    }

    @Test
    void of_invalidText_throwsIllegalArgument() {
        assertThatThrownBy(() -> SemanticVersion.of("not-a-version"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not-a-version");
    }

    @Test
    void compareTo_preReleaseOrdersBeforeFinal() {
        List<SemanticVersion> versions = new ArrayList<>(List.of(
            SemanticVersion.of("1.10.0"),
            SemanticVersion.of("1.2.0"),
            SemanticVersion.of("1.2.0-beta"),
            SemanticVersion.of("1.2.0-alpha"),
            SemanticVersion.of("0.9.9")));

        Collections.sort(versions);

        assertThat(versions).extracting(SemanticVersion::toString)
            .containsExactly("0.9.9", "1.2.0-alpha", "1.2.0-beta", "1.2.0", "1.10.0");
    }

    @Test
    void minorsBehind_sameMajor_countsMinorDistance() {
        assertThat(SemanticVersion.of("1.2.0").minorsBehind(SemanticVersion.of("1.5.3"))).isEqualTo(3);
        assertThat(SemanticVersion.of("1.5.0").minorsBehind(SemanticVersion.of("1.5.3"))).isZero();
    }

    @Test
    void minorsBehind_olderMajor_isMaximal() {
        assertThat(SemanticVersion.of("1.9.0").minorsBehind(SemanticVersion.of("2.0.0")))
            .isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void nextVersions_resetLowerComponents() {
        SemanticVersion version = SemanticVersion.of("1.4.7-rc.2");

        assertThat(version.nextMajor()).hasToString("2.0.0");
        assertThat(version.nextMinor()).hasToString("1.5.0");
        assertThat(version.nextPatch()).hasToString("1.4.8");
        assertThat(version.isPreRelease()).isTrue();
    }
}
