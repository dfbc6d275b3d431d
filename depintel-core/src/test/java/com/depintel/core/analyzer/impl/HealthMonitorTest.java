package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalyzerTestBase;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;

class HealthMonitorTest extends AnalyzerTestBase {

    private final HealthMonitor monitor = new HealthMonitor();

    @Test
    void analyze_activeWellStaffedPackage_isHealthy() {
        pkg("react").latest("18.3.1").release("18.3.1", TODAY.minusDays(10)).community(300, 0.05)
            .alternative("preact");
        pkg("preact").release("10.0.0", TODAY.minusDays(1)).community(500, 0.0);
        declare("react", "^18.3.1");

        AnalysisResult result = monitor.analyze(context(Map.of()));

        Map<String, Object> entry = entryFor(result, "dependencies", "react");
        assertThat(entry.get("status")).isEqualTo("healthy");
        assertThat(num(entry.get("health_score"))).isGreaterThanOrEqualTo(0.7);
        assertThat(entry.get("risk_factors")).asInstanceOf(LIST).isEmpty();

        Map<String, Object> recommendation = result.detailEntries("recommendations").get(0);
        assertThat(recommendation.get("urgency")).isEqualTo("low");
        assertThat(recommendation.get("action")).isEqualTo("keep");
        // Healthy dependencies never get alternatives
        assertThat(recommendation.get("alternative")).isNull();
        assertThat(monitor.recommend(result)).isEmpty();
    }

    @Test
    void analyze_deprecatedPackage_isAtRiskWithHealthierAlternative() {
        pkg("request").deprecated().release("2.88.2", TODAY.minusDays(1500)).alternative("got").alternative("ky");
        pkg("got").release("14.0.0", TODAY.minusDays(30)).community(120, 0.2);
        pkg("ky").release("1.2.0", TODAY.minusDays(700));
        declare("request", "^2.88.0");

        AnalysisResult result = analyze(monitor);

        Map<String, Object> entry = entryFor(result, "dependencies", "request");
        assertThat(num(entry.get("health_score"))).isEqualTo(0.1);
        assertThat(entry.get("status")).isEqualTo("at_risk");
        assertThat(entry.get("risk_factors")).asInstanceOf(LIST).contains("deprecated", "stale");

        Map<String, Object> recommendation = result.detailEntries("recommendations").get(0);
        assertThat(recommendation.get("alternative")).isEqualTo("got");
        assertThat(num(recommendation.get("alternative_health_score"))).isGreaterThan(0.1);

        assertThat(monitor.recommend(result)).singleElement().satisfies(r -> {
            assertThat(r.recommendationType()).isEqualTo("health_improvement");
            assertThat(r.severity()).isEqualTo(Severity.HIGH);
            assertThat(r.description()).contains("Consider got");
        });
    }

    @Test
    void analyze_peerInSameCategory_isSuggestedWhenHealthier() {
        pkg("axios").category("http-client").release("1.7.0", TODAY.minusDays(20)).community(400, 0.1);
        pkg("superagent").category("http-client").release("8.0.0", TODAY.minusDays(500));
        declare("axios", "^1.7.0");
        declare("superagent", "^8.0.0");

        AnalysisResult result = analyze(monitor);

        assertThat(result.detailEntries("recommendations"))
            .extracting(r -> r.get("dependency"), r -> r.get("alternative"))
            .containsExactly(tuple("axios", null), tuple("superagent", "axios"));
    }

    @Test
    void analyze_noSignals_isUnknownAndBucketedModerate() {
        pkg("mystery");
        declare("mystery", "*");

        AnalysisResult result = analyze(monitor);

        Map<String, Object> entry = entryFor(result, "dependencies", "mystery");
        assertThat(entry.get("health_score")).isNull();
        assertThat(entry.get("status")).isEqualTo("moderate");
        assertThat(intValue(result.summaryValue("unknown_count"))).isEqualTo(1);
        assertThat(result.summaryValue("average_health_score")).isNull();
        assertThat(monitor.recommend(result))
            .extracting(Recommendation::recommendationType, Recommendation::severity)
            .containsExactly(tuple("health_monitoring", Severity.MEDIUM));
    }

    @Test
    void analyze_coversTransitiveNodesAndCountsFlags() {
        pkg("express").latest("5.0.0").requires("qs", "^6.11.0").release("4.19.2", TODAY.minusDays(60))
            .community(250, 0.1);
        pkg("qs").vulnerability("CVE-2022-24999").release("6.11.0", TODAY.minusDays(800));
        declare("express", "^4.19.0");

        AnalysisResult result = analyze(monitor);

        assertThat(intValue(result.summaryValue("dependency_count"))).isEqualTo(2);
        assertThat(intValue(result.summaryValue("outdated_count"))).isEqualTo(1);
        assertThat(intValue(result.summaryValue("vulnerable_count"))).isEqualTo(1);
        assertThat(entryFor(result, "dependencies", "express").get("outdated")).isEqualTo(true);

        Map<String, Object> qs = entryFor(result, "dependencies", "qs");
        assertThat(intValue(qs.get("depth"))).isEqualTo(1);
        assertThat(intValue(qs.get("vulnerability_count"))).isEqualTo(1);
        assertThat(qs.get("risk_factors")).asInstanceOf(LIST).contains("known_vulnerabilities", "stale");

        @SuppressWarnings("unchecked")
        Map<String, Object> distribution = (Map<String, Object>) result.summaryValue("health_distribution");
        assertThat(distribution).containsOnlyKeys("healthy", "moderate", "at_risk");
        int total = distribution.values().stream().mapToInt(v -> ((Number) v).intValue()).sum();
        assertThat(total).isEqualTo(2);
    }
}
