package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalyzerTestBase;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.ReleaseRecord;
import com.depintel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompatibilityPredictorTest extends AnalyzerTestBase {

    private final CompatibilityPredictor predictor = new CompatibilityPredictor();

    @Test
    void analyze_regularCadence_predictsNextMinorRelease() {
        // Given: 1.0.0 .. 1.4.0 every 30 days, the last one 10 days ago
        pkg("lodash").latest("1.4.0").cadence(1, 0, 5, 30, 10);
        declare("lodash", "^1.4.0");

        // When
        AnalysisResult result = predictor.analyze(context(Map.of()));

        // Then
        Map<String, Object> issue = entryFor(result, "dependency_issues", "lodash");
        assertThat(issue.get("severity")).isEqualTo("low");
        assertThat(issue.get("predicted_release")).isEqualTo(TODAY.plusDays(20).toString());
        assertThat(num(issue.get("mean_release_interval_days"))).isEqualTo(30.0);

        List<Map<String, Object>> events = eventsOn(result, TODAY.plusDays(20).toString());
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.get("event_type")).isEqualTo("predicted_release");
            assertThat(event.get("version")).isEqualTo("1.5.0");
            assertThat(event.get("is_major")).isEqualTo(false);
        });
        assertThat(predictor.recommend(result)).isEmpty();
    }

    @Test
    void analyze_frequentMajorBumps_predictsMajorRelease() {
        pkg("webpack").latest("3.0.0")
            .release("1.0.0", TODAY.minusDays(210))
            .release("2.0.0", TODAY.minusDays(110))
            .release("3.0.0", TODAY.minusDays(10));
        declare("webpack", "^3.0.0");

        AnalysisResult result = analyze(predictor);

        List<Map<String, Object>> events = eventsOn(result, TODAY.plusDays(90).toString());
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.get("version")).isEqualTo("4.0.0");
            assertThat(event.get("is_major")).isEqualTo(true);
        });
        assertThat(intValue(result.summaryValue("predicted_major_releases"))).isEqualTo(1);
    }

    @Test
    void analyze_predictionBeyondHorizon_isLeftOutOfTimeline() {
        pkg("slow-lib").latest("1.1.0")
            .release("1.0.0", TODAY.minusDays(310))
            .release("1.1.0", TODAY.minusDays(10));
        declare("slow-lib", "^1.1.0");

        assertThat(analyze(predictor).detailSection("timeline")).isEmpty();
        assertThat(analyze(predictor, Map.of("time_horizon", 365)).detailSection("timeline"))
            .containsOnlyKeys(TODAY.plusDays(290).toString());
    }

    @Test
    void analyze_declaredVersionFarBehindLatest_addsDeprecationDatedToday() {
        pkg("chalk").latest("1.4.0").cadence(1, 0, 5, 30, 10);
        declare("chalk", "^1.0.0");

        AnalysisResult result = analyze(predictor);

        assertThat(eventsOn(result, TODAY.toString()))
            .extracting(e -> e.get("event_type"))
            .containsExactly("deprecation");
        assertThat(entryFor(result, "dependency_issues", "chalk").get("severity")).isEqualTo("medium");

        List<Recommendation> recommendations = predictor.recommend(result);
        assertThat(recommendations).singleElement().satisfies(r -> {
            assertThat(r.recommendationType()).isEqualTo("upgrade");
            assertThat(r.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(r.versionTransition()).isEqualTo(new Recommendation.VersionTransition("1.0.0", "1.4.0"));
        });
    }

    @Test
    void analyze_yankedRelease_isBreakingChangeAtItsReleaseDate() {
        pkg("uuid").latest("2.1.0")
            .release("2.0.0", TODAY.minusDays(100))
            .yanked("2.0.1", TODAY.minusDays(90))
            .release("2.1.0", TODAY.minusDays(80));
        declare("uuid", "^2.1.0");

        AnalysisResult result = analyze(predictor);

        assertThat(eventsOn(result, TODAY.minusDays(90).toString())).singleElement().satisfies(event -> {
            assertThat(event.get("event_type")).isEqualTo("breaking_change");
            assertThat(event.get("version")).isEqualTo("2.0.1");
            assertThat(num(event.get("compatibility_score"))).isEqualTo(0.5);
        });
        // Overdue prediction is clamped to today
        assertThat(eventsOn(result, TODAY.toString())).extracting(e -> e.get("event_type"))
            .containsExactly("predicted_release");
        assertThat(entryFor(result, "dependency_issues", "uuid").get("severity")).isEqualTo("high");
        assertThat(predictor.recommend(result)).singleElement()
            .extracting(Recommendation::recommendationType, Recommendation::severity)
            .containsExactly("breaking_change_planning", Severity.HIGH);
    }

    @Test
    void analyze_announcedBreakingChangeWithoutRelease_isSkippedWithWarning() {
        pkg("react").latest("18.3.1").breaking("19.0.0", "legacy context removed", 0.2)
            .release("18.2.0", TODAY.minusDays(400))
            .release("18.3.1", TODAY.minusDays(40));
        declare("react", "^18.2.0");

        AnalysisResult result = analyze(predictor);

        assertThat(result.warnings()).contains("No release date for breaking change react@19.0.0");
        assertThat(entryFor(result, "dependency_issues", "react").get("severity")).isNotEqualTo("high");
    }

    @Test
    void analyze_noReleaseHistory_reportsUnknownAndStaysOffTimeline() {
        pkg("ghost");
        pkg("lodash").latest("1.4.0").cadence(1, 0, 5, 30, 10);
        declare("ghost", "^1.0.0");
        declare("lodash", "^1.4.0");

        AnalysisResult result = analyze(predictor);

        assertThat(entryFor(result, "dependency_issues", "ghost").get("severity")).isEqualTo("unknown");
        assertThat(allEvents(result)).extracting(e -> e.get("dependency")).doesNotContain("ghost");
        @SuppressWarnings("unchecked")
        Map<String, Object> counts = (Map<String, Object>) result.summaryValue("issue_counts");
        assertThat(intValue(counts.get("unknown"))).isEqualTo(1);
        assertThat(intValue(counts.get("low"))).isEqualTo(1);
    }

    @Test
    void analyze_timelineIsChronological() {
        pkg("a-lib").latest("1.4.0").cadence(1, 0, 5, 30, 10);
        pkg("b-lib").latest("2.1.0")
            .release("2.0.0", TODAY.minusDays(100))
            .yanked("2.0.1", TODAY.minusDays(90))
            .release("2.1.0", TODAY.minusDays(80));
        pkg("c-lib").latest("3.5.0").cadence(3, 0, 6, 60, 5);
        declare("a-lib", "^1.0.0");
        declare("b-lib", "^2.1.0");
        declare("c-lib", "^3.5.0");

        AnalysisResult result = analyze(predictor);

        List<String> dates = new ArrayList<>(result.detailSection("timeline").keySet());
        assertThat(dates).isSorted().hasSizeGreaterThan(2);
        assertThat(intValue(result.summaryValue("timeline_event_count"))).isEqualTo(allEvents(result).size());
    }

    @Test
    void analyze_transitiveDependencies_onlyWhenRequested() {
        pkg("express").latest("4.19.0").requires("qs", "^6.0.0").cadence(4, 17, 3, 60, 20);
        pkg("qs").latest("6.12.0").cadence(6, 10, 3, 60, 20);
        declare("express", "^4.19.0");

        assertThat(analyze(predictor).detailEntries("dependency_issues")).hasSize(1);
        assertThat(analyze(predictor, Map.of("include_transitive", true)).detailEntries("dependency_issues"))
            .extracting(e -> e.get("name"))
            .containsExactlyInAnyOrder("express", "qs");
    }

    @Test
    void validateConfiguration_rejectsInvalidOptions() {
        assertThatThrownBy(() -> predictor.validateConfiguration(Map.of("history_window", 1)))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> predictor.validateConfiguration(Map.of("time_horizon", 0)))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void analyze_preReleaseBurst_doesNotShortenCadence() {
        // Given: stable releases 90 days apart followed by five daily betas
        PackageSpec spec = pkg("vite")
            .release("1.0.0", TODAY.minusDays(180))
            .release("1.1.0", TODAY.minusDays(90));
        for (int i = 1; i <= 5; i++) {
            spec.release("1.2.0-beta." + i, TODAY.minusDays(6 - i));
        }
        declare("vite", "^1.1.0");

        // When
        AnalysisResult result = analyze(predictor);

        // Then
        Map<String, Object> issue = entryFor(result, "dependency_issues", "vite");
        assertThat(num(issue.get("mean_release_interval_days"))).isEqualTo(90.0);
        assertThat(issue.get("predicted_release")).isEqualTo(TODAY.toString());
        assertThat(issue.get("latest_version")).isEqualTo("1.1.0");
        assertThat(eventsOn(result, TODAY.toString())).singleElement()
            .satisfies(event -> assertThat(event.get("version")).isEqualTo("1.2.0"));
    }

    @Test
    void majorBumpsPerYear_ignoresReleaseCandidates() {
        pkg("y").release("1.0.0", TODAY.minusDays(200)).release("2.0.0-rc.1", TODAY.minusDays(10));
        List<ReleaseRecord> history = provider().versionHistory("y", "npm");

        assertThat(CompatibilityPredictor.majorBumpsPerYear(history)).isZero();
    }

    @Test
    void analyze_scoresUpgradeFromDeclaredToLatestVersion() {
        // Given: a major upgrade with an announced breaking change in the target
        pkg("vue").latest("3.0.0")
            .release("2.6.0", TODAY.minusDays(400))
            .release("3.0.0", TODAY.minusDays(100))
            .breaking("3.0.0", "Options API reworked", null);
        pkg("chalk").latest("1.4.0").cadence(1, 0, 5, 30, 10);
        declare("vue", "^2.6.0");
        declare("chalk", "^1.0.0");

        // When
        AnalysisResult result = analyze(predictor);

        // Then
        Map<String, Object> vue = entryFor(result, "dependency_issues", "vue");
        assertThat(vue.get("version_change")).isEqualTo("major");
        assertThat(num(vue.get("compatibility_score"))).isEqualTo(0.4);
        assertThat(num(vue.get("confidence"))).isEqualTo(0.85);
        assertThat(vue.get("upgrade_action")).isEqualTo("careful_testing");

        Map<String, Object> chalk = entryFor(result, "dependency_issues", "chalk");
        assertThat(chalk.get("version_change")).isEqualTo("minor");
        assertThat(num(chalk.get("compatibility_score"))).isEqualTo(0.82);
        assertThat(chalk.get("upgrade_action")).isEqualTo("upgrade_with_caution");
    }

    @Test
    void analyze_unknownDeclaredVersion_leavesUpgradeScoreEmpty() {
        pkg("left-pad").latest("1.3.0").release("1.3.0", TODAY.minusDays(30));
        declare("left-pad", "latest");

        Map<String, Object> issue = entryFor(analyze(predictor), "dependency_issues", "left-pad");

        assertThat(issue.get("compatibility_score")).isNull();
        assertThat(issue.get("upgrade_action")).isNull();
    }

    @Test
    void majorBumpsPerYear_usesAtLeastOneYearOfHistory() {
        pkg("x").release("1.0.0", TODAY.minusDays(20)).release("2.0.0", TODAY.minusDays(10));
        List<ReleaseRecord> history = provider().versionHistory("x", "npm");

        assertThat(CompatibilityPredictor.majorBumpsPerYear(history)).isEqualTo(1.0);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> eventsOn(AnalysisResult result, String date) {
        Object events = result.detailSection("timeline").get(date);
        return events == null ? List.of() : (List<Map<String, Object>>) events;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> allEvents(AnalysisResult result) {
        List<Map<String, Object>> all = new ArrayList<>();
        result.detailSection("timeline").values().forEach(v -> all.addAll((List<Map<String, Object>>) v));
        return all;
    }
}
