package com.depintel.core.analyzer;

import com.depintel.core.model.AnalysisType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration for {@link Analyzer} implementations.
 *
 * <p>Guards against typos in META-INF/services, constructor failures during instantiation and
 * two analyzers claiming the same id or analysis type.
 *
 * <p>Expected: one analyzer per {@link AnalysisType}.
 */
class AnalyzerServiceLoaderTest {

    private static final int EXPECTED_ANALYZER_COUNT = AnalysisType.values().length;

    @Test
    void serviceLoader_discoversAllRegisteredAnalyzers() {
        List<Analyzer> analyzers = load();

        assertThat(analyzers)
            .as("ServiceLoader should discover all %d registered analyzers", EXPECTED_ANALYZER_COUNT)
            .hasSize(EXPECTED_ANALYZER_COUNT)
            .allMatch(analyzer -> analyzer.getId() != null, "All analyzers should have an id")
            .allMatch(analyzer -> analyzer.getDisplayName() != null, "All analyzers should have a display name");
    }

    @Test
    void serviceLoader_analyzersHaveUniqueIds() {
        List<Analyzer> analyzers = load();

        Set<String> ids = analyzers.stream().map(Analyzer::getId).collect(Collectors.toSet());

        assertThat(ids).hasSize(analyzers.size());
    }

    @Test
    void serviceLoader_coversEveryAnalysisType() {
        Set<AnalysisType> types = load().stream().map(Analyzer::getType).collect(Collectors.toSet());

        assertThat(types).containsExactlyInAnyOrder(AnalysisType.values());
    }

    private static List<Analyzer> load() {
        return ServiceLoader.load(Analyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }
}
