package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalyzerTestBase;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
import com.depintel.core.model.UsageSignals;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ConsolidationAnalyzerTest extends AnalyzerTestBase {

    private final ConsolidationAnalyzer analyzer = new ConsolidationAnalyzer();

    @Test
    void analyze_twoHttpClients_keepsMostUsedAndRemovesOther() {
        // Given
        pkg("axios").category("http-client");
        pkg("request").category("HTTP-Client ");
        pkg("lodash").category("utility");
        declare("axios", "^1.6.0", new UsageSignals(10, 2, 0.8));
        declare("request", "^2.88.0", new UsageSignals(2, 8, 0.2));
        declare("lodash", "^4.17.21", new UsageSignals(4, 0, 0.5));

        // When
        AnalysisResult result = analyze(analyzer);

        // Then
        assertThat(result.detailEntries("duplicate_groups")).singleElement().satisfies(group -> {
            assertThat(group.get("category")).isEqualTo("http-client");
            assertThat(group.get("keep")).isEqualTo("axios");
            assertThat(group.get("remove")).isEqualTo(List.of("request"));
        });
        assertThat(intValue(result.summaryValue("duplicate_removals"))).isEqualTo(1);
        assertThat(intValue(result.summaryValue("potential_removals")))
            .isLessThanOrEqualTo(intValue(result.summaryValue("total_dependencies")));
        assertThat(num(result.summaryValue("reduction_percent"))).isEqualTo(33.3);

        assertThat(analyzer.recommend(result))
            .filteredOn(r -> r.recommendationType().equals("consolidation"))
            .singleElement()
            .satisfies(r -> {
                assertThat(r.dependency()).isEqualTo("request");
                assertThat(r.severity()).isEqualTo(Severity.MEDIUM);
                assertThat(r.title()).isEqualTo("Consolidate request into axios");
            });
    }

    @Test
    void analyze_equalUsage_prefersHealthierThenName() {
        pkg("got").category("http-client").deprecated();
        pkg("ky").category("http-client").release("1.2.0", TODAY.minusDays(5)).community(100, 0.1);
        pkg("axios").category("http-client");
        declare("got", "*", new UsageSignals(3, 0, 0.5));
        declare("ky", "*", new UsageSignals(3, 0, 0.5));
        declare("axios", "*", new UsageSignals(3, 0, 0.5));

        Map<String, Object> group = analyze(analyzer).detailEntries("duplicate_groups").get(0);

        assertThat(group.get("keep")).isEqualTo("ky");
        // axios has unknown health (0.5) which beats deprecated got (0.1)
        assertThat(group.get("remove")).isEqualTo(List.of("axios", "got"));
    }

    @Test
    void analyze_compatibleConstraints_recommendHighestSatisfyingAll() {
        pkg("express").requires("lodash", "4.17.21");
        pkg("lodash");
        declare("express", "^4.18.0");
        declare("lodash", "^4.17.0");

        AnalysisResult result = analyze(analyzer);

        assertThat(result.detailEntries("version_inconsistencies")).singleElement().satisfies(entry -> {
            assertThat(entry.get("recommended_version")).isEqualTo("4.17.21");
            assertThat(entry.get("satisfies_all")).isEqualTo(true);
            assertThat(entry.get("unsatisfied_constraints")).isEqualTo(List.of());
            @SuppressWarnings("unchecked")
            Map<String, Object> inUse = (Map<String, Object>) entry.get("versions_in_use");
            assertThat(inUse).containsEntry("^4.17.0", List.of("project"))
                .containsEntry("4.17.21", List.of("express"));
        });
        assertThat(analyzer.recommend(result))
            .extracting(Recommendation::recommendationType, Recommendation::severity)
            .containsExactly(tuple("version_alignment", Severity.LOW));
    }

    @Test
    void analyze_conflictingConstraints_flagsUnsatisfiedRequesters() {
        pkg("express").requires("lodash", "^4.17.0");
        pkg("lodash");
        declare("express", "^4.18.0");
        declare("lodash", "^3.10.0");

        AnalysisResult result = analyze(analyzer);

        Map<String, Object> entry = entryFor(result, "version_inconsistencies", "lodash");
        assertThat(entry.get("recommended_version")).isEqualTo("4.17.0");
        assertThat(entry.get("satisfies_all")).isEqualTo(false);
        assertThat(entry.get("unsatisfied_constraints")).isEqualTo(List.of("^3.10.0"));
        assertThat(analyzer.recommend(result)).singleElement().satisfies(r -> {
            assertThat(r.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(r.versionTransition().to()).isEqualTo("4.17.0");
        });
    }

    @Test
    void analyze_sharedDeepPackage_isTransitiveBloatAboveThreshold() {
        // Given: four direct dependencies each reach "inherits" at depth 2
        for (String name : List.of("alpha", "beta", "gamma", "delta")) {
            pkg(name).requires(name + "-core", "^1.0.0");
            pkg(name + "-core").requires("inherits", "^2.0.0");
            declare(name, "^1.0.0");
        }
        pkg("inherits");

        // When
        AnalysisResult result = analyze(analyzer);

        // Then
        Map<String, Object> bloat = entryFor(result, "transitive_bloat", "inherits");
        assertThat(intValue(bloat.get("depth"))).isEqualTo(2);
        assertThat(intValue(bloat.get("reference_count"))).isEqualTo(4);
        assertThat(bloat.get("referenced_by")).isEqualTo(List.of("alpha", "beta", "delta", "gamma"));
        assertThat(bloat.get("chain")).isEqualTo(List.of("alpha", "alpha-core", "inherits"));
        assertThat(intValue(result.summaryValue("chain_reduction"))).isEqualTo(1);

        assertThat(analyze(analyzer, Map.of("transitive_threshold", 4)).detailEntries("transitive_bloat")).isEmpty();
    }

    @Test
    void analyze_directChildren_areNeverBloat() {
        for (String name : List.of("alpha", "beta", "gamma", "delta")) {
            pkg(name).requires("inherits", "^2.0.0");
            declare(name, "^1.0.0");
        }
        pkg("inherits");

        assertThat(analyze(analyzer).detailEntries("transitive_bloat")).isEmpty();
    }

    @Test
    void analyze_emptyProject_reportsZeros() {
        AnalysisResult result = analyze(analyzer);

        assertThat(intValue(result.summaryValue("total_dependencies"))).isZero();
        assertThat(num(result.summaryValue("reduction_percent"))).isZero();
        assertThat(analyzer.recommend(result)).isEmpty();
    }

    @Test
    void validateConfiguration_nonPositiveThreshold_throws() {
        assertThatThrownBy(() -> analyzer.validateConfiguration(Map.of("transitive_threshold", 0)))
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
