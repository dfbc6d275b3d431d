package com.depintel.core.analyzer;

import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.Recommendation;

import java.util.List;
import java.util.Map;

/**
 * One of the engine's analyses: a pure transform from a dependency graph to a result document.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI) and dispatched by
 * {@link AnalysisType} through {@link AnalyzerRegistry}. Implementations hold no mutable state
 * and never modify the graph, so one instance serves concurrent jobs.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.depintel.core.analyzer.Analyzer}
 *
 * @see AnalysisContext
 * @see AnalysisResult
 */
public interface Analyzer {

    /**
     * Returns unique identifier for this analyzer.
     *
     * <p>Kebab-case, e.g. "impact-scorer", "license-compliance-checker".
     *
     * @return unique analyzer identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the analysis type this analyzer implements. Exactly one analyzer exists per type.
     *
     * @return analysis type
     */
    AnalysisType getType();

    /**
     * Validates a job configuration before a job is created.
     *
     * <p>The default accepts everything. Implementations reject unknown enumerated values and
     * malformed numbers with {@link com.depintel.core.exception.InvalidConfigurationException}.
     *
     * @param configuration job configuration
     */
    default void validateConfiguration(Map<String, Object> configuration) {
        // Nothing to validate
    }

    /**
     * Runs the analysis.
     *
     * <p>Missing metadata never fails the run; it surfaces as unknown values in the document.
     *
     * @param context graph, configuration and reference time
     * @return result document
     */
    AnalysisResult analyze(AnalysisContext context);

    /**
     * Extracts recommendations from a result document this analyzer produced.
     *
     * @param result completed result of {@link #getType()}
     * @return recommendations, possibly empty
     */
    List<Recommendation> recommend(AnalysisResult result);
}
