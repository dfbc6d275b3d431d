package com.depintel.core.recommendation;

import com.depintel.core.analyzer.Analyzer;
import com.depintel.core.analyzer.AnalyzerRegistry;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.Recommendation;
import com.depintel.core.orchestrator.AnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Turns the latest completed analyses of a project into one ranked recommendation list.
 *
 * <p>Recommendations are deduplicated by dependency and recommendation type, keeping the
 * more severe one, and ordered by severity (highest first), then dependency name with
 * project-wide entries last, then title. The list produced by {@link #generate(String)}
 * replaces the previous set of the project.
 */
public final class RecommendationGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecommendationGenerator.class);

    static final Comparator<Recommendation> ORDER = Comparator
        .comparing((Recommendation r) -> r.severity().rank(), Comparator.reverseOrder())
        .thenComparing(Recommendation::dependency, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Recommendation::ecosystem, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Recommendation::title);

    private final AnalyzerRegistry registry;
    private final Function<String, Map<AnalysisType, AnalysisResult>> latestResults;
    private final ConcurrentMap<String, List<Recommendation>> currentSets = new ConcurrentHashMap<>();

    /**
     * Creates a generator reading completed results from an orchestrator.
     */
    public RecommendationGenerator(AnalyzerRegistry registry, AnalysisOrchestrator orchestrator) {
        this(registry, Objects.requireNonNull(orchestrator, "orchestrator must not be null")::latestCompletedResults);
    }

    /**
     * Creates a generator over an arbitrary source of latest results per project.
     *
     * @param registry analyzers owning the extraction rules
     * @param latestResults project id to latest completed result per analysis type
     */
    public RecommendationGenerator(AnalyzerRegistry registry,
                                   Function<String, Map<AnalysisType, AnalysisResult>> latestResults) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.latestResults = Objects.requireNonNull(latestResults, "latestResults must not be null");
    }

    /**
     * Regenerates the recommendations of a project.
     *
     * @param projectId project id
     * @return ranked recommendations, empty when no analysis has completed
     */
    public List<Recommendation> generate(String projectId) {
        Map<AnalysisType, AnalysisResult> results = latestResults.apply(projectId);
        List<Recommendation> merged = new ArrayList<>();
        if (results != null) {
            results.forEach((type, result) -> {
                Optional<Analyzer> analyzer = registry.find(type);
                if (analyzer.isEmpty()) {
                    log.warn("No analyzer installed for {}, skipping its recommendations", type.id());
                    return;
                }
                List<Recommendation> extracted = analyzer.get().recommend(result);
                log.debug("{} produced {} recommendations for project {}", type.id(), extracted.size(), projectId);
                merged.addAll(extracted);
            });
        }
        List<Recommendation> ranked = rank(merged);
        currentSets.put(projectId, ranked);
        log.info("Generated {} recommendations for project {}", ranked.size(), projectId);
        return ranked;
    }

    /**
     * @return the last generated set for a project, empty if never generated
     */
    public List<Recommendation> current(String projectId) {
        return currentSets.getOrDefault(projectId, List.of());
    }

    /**
     * Deduplicates and orders recommendations.
     */
    static List<Recommendation> rank(List<Recommendation> recommendations) {
        Map<DedupKey, Recommendation> unique = new LinkedHashMap<>();
        for (Recommendation recommendation : recommendations) {
            unique.merge(DedupKey.of(recommendation), recommendation,
                (kept, candidate) -> candidate.severity().rank() > kept.severity().rank() ? candidate : kept);
        }
        return unique.values().stream().sorted(ORDER).toList();
    }

    /**
     * Project-wide recommendations have no dependency, so their title keeps distinct ones apart.
     */
    private record DedupKey(String dependency, String ecosystem, String recommendationType, String title) {
        static DedupKey of(Recommendation recommendation) {
            return recommendation.dependency() == null
                ? new DedupKey(null, null, recommendation.recommendationType(), recommendation.title())
                : new DedupKey(recommendation.dependency(), recommendation.ecosystem(),
                    recommendation.recommendationType(), null);
        }
    }
}
