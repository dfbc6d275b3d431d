package com.depintel.core.analyzer.base;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.Analyzer;
import com.depintel.core.config.EngineConfig;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
import com.depintel.core.util.HealthScoring;
import com.depintel.core.util.HealthScoring.HealthAssessment;
import com.depintel.core.util.JsonDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for analyzer implementations providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per analyzer class)</li>
 *   <li>Result creation from typed report records ({@link #buildResult(Object, Map, List)})</li>
 *   <li>Shared health assessment ({@link #assessHealth(DependencyNode, AnalysisContext)})</li>
 *   <li>Typed readers for result documents used during recommendation extraction</li>
 * </ul>
 *
 * @see Analyzer
 */
public abstract class AbstractAnalyzer implements Analyzer {

    /**
     * Logger instance for this analyzer.
     * Automatically initialized with the concrete analyzer class name.
     */
    protected final Logger log;

    protected AbstractAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final AnalysisResult analyze(AnalysisContext context) {
        validateConfiguration(context.configuration());
        log.debug("Running {} for project {} ({} nodes)", getId(), context.projectId(), context.graph().size());
        AnalysisResult result = doAnalyze(context);
        log.info("{} finished for project {}: {}", getDisplayName(), context.projectId(), result.summary());
        return result;
    }

    /**
     * Runs the analysis after the configuration has been validated.
     *
     * @param context analysis inputs
     * @return result document
     */
    protected abstract AnalysisResult doAnalyze(AnalysisContext context);

    // ==================== Result Creation Helpers ====================

    /**
     * Builds a result document from a typed summary record and detail sections.
     *
     * @param summary summary record (converted to a snake_case map)
     * @param details detail sections; values may be records, lists of records or plain values
     * @param warnings non-fatal notes
     * @return result document
     */
    protected AnalysisResult buildResult(Object summary, Map<String, ?> details, List<String> warnings) {
        Map<String, Object> plainDetails = new LinkedHashMap<>();
        details.forEach((key, value) -> plainDetails.put(key, JsonDocuments.toPlain(value)));
        return new AnalysisResult(getType(), JsonDocuments.toMap(summary), plainDetails, warnings);
    }

    // ==================== Shared Scoring ====================

    /**
     * Assesses node health with the engine's health weights.
     *
     * @param node node to assess
     * @param context analysis inputs
     * @return assessment
     */
    protected HealthAssessment assessHealth(DependencyNode node, AnalysisContext context) {
        EngineConfig.HealthSettings weights = context.engineConfig().health();
        return HealthScoring.assess(node, context.today(), weights.stalenessWeight(), weights.communityWeight());
    }

    // ==================== Document Readers ====================

    protected static String text(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value == null ? null : value.toString();
    }

    protected static Double number(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    @SuppressWarnings("unchecked")
    protected static List<String> strings(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value instanceof List<?> list ? (List<String>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    protected static List<Map<String, Object>> entries(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> section(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Creates a recommendation about one dependency, attributed to this analyzer's type.
     */
    protected Recommendation recommendation(String dependency, String ecosystem, String recommendationType,
                                            Severity severity, String title, String description) {
        return Recommendation.forDependency(dependency, ecosystem, getType(), recommendationType, severity,
            title, description);
    }
}
