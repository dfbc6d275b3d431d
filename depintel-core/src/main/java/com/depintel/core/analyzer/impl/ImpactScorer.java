package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.config.EngineConfig.ImpactWeights;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyGraph;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.ReleaseRecord;
import com.depintel.core.model.Severity;
import com.depintel.core.model.UsageSignals;
import com.depintel.core.util.Scores;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores how much each direct dependency matters to the project and how risky it is.
 *
 * <p>Per direct dependency four sub-scores in [0, 1] are combined:
 * <pre>
 * overall = wb * business_value + wu * usage + wc * complexity + wh * (1 - health)
 * </pre>
 * with default weights 0.35 / 0.25 / 0.15 / 0.25. Weights come from the engine configuration
 * and can be overridden per job with a {@code weights} map ({@code business_value},
 * {@code usage}, {@code complexity}, {@code health}).
 *
 * <p>Unknown usage or health is reported as {@code null} and counts as the neutral 0.5
 * inside the composite.
 */
public class ImpactScorer extends AbstractAnalyzer {

    static final double HIGH_IMPACT = 0.8;
    static final double MEDIUM_IMPACT = 0.5;
    static final double NEUTRAL = 0.5;
    static final double LOW_USAGE = 0.3;
    static final double HEALTH_ISSUE = 0.6;

    private static final int CHURN_WINDOW_DAYS = 365;

    private static final Comparator<DependencyImpact> RANKING = Comparator
        .comparingDouble(DependencyImpact::overallScore).reversed()
        .thenComparing(Comparator.comparingDouble(DependencyImpact::businessValueScore).reversed())
        .thenComparing(DependencyImpact::name)
        .thenComparing(DependencyImpact::ecosystem);

    @Override
    public String getId() {
        return "impact-scorer";
    }

    @Override
    public String getDisplayName() {
        return "Impact Scorer";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.IMPACT_SCORING;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        weightsOverride(configuration, ImpactWeights.defaults());
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        ImpactWeights weights = weightsOverride(context.configuration(), context.engineConfig().impact().weights());
        DependencyGraph graph = context.graph();

        List<DependencyImpact> impacts = new ArrayList<>();
        for (DependencyNode node : graph.directDependencies()) {
            impacts.add(score(node, graph, context, weights));
        }
        impacts.sort(RANKING);

        int high = 0;
        int medium = 0;
        int low = 0;
        int lowUsage = 0;
        int healthIssues = 0;
        double total = 0.0;
        for (DependencyImpact impact : impacts) {
            switch (impact.impactLevel()) {
                case "high" -> high++;
                case "medium" -> medium++;
                default -> low++;
            }
            if (impact.usageScore() != null && impact.usageScore() <= LOW_USAGE) {
                lowUsage++;
            }
            if (impact.healthScore() != null && impact.healthScore() <= HEALTH_ISSUE) {
                healthIssues++;
            }
            total += impact.overallScore();
        }
        double average = impacts.isEmpty() ? 0.0 : Scores.round(total / impacts.size());

        Map<String, Double> weightMap = new LinkedHashMap<>();
        weightMap.put("business_value", weights.businessValue());
        weightMap.put("usage", weights.usage());
        weightMap.put("complexity", weights.complexity());
        weightMap.put("health", weights.health());

        ImpactSummary summary = new ImpactSummary(impacts.size(), high, medium, low, average, lowUsage,
            healthIssues, weightMap);
        return buildResult(summary, Map.of("dependencies", impacts), List.of());
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map<String, Object> entry : result.detailEntries("dependencies")) {
            String name = text(entry, "name");
            String ecosystem = text(entry, "ecosystem");
            Double overall = number(entry, "overall_score");
            if ("high".equals(text(entry, "impact_level"))) {
                recommendations.add(recommendation(name, ecosystem, "impact_monitoring", Severity.HIGH,
                    "Monitor high-impact dependency " + name,
                    String.format(Locale.ROOT, "%s has an impact score of %.2f. Changes to it affect the project broadly; "
                        + "pin it carefully and watch its releases.", name, overall)));
            }
            Double usage = number(entry, "usage_score");
            if (usage != null && usage <= LOW_USAGE) {
                recommendations.add(recommendation(name, ecosystem, "usage_optimization", Severity.MEDIUM,
                    "Review low usage of " + name,
                    String.format(Locale.ROOT, "Usage score of %s is %.2f. Consider replacing it with a lighter "
                        + "alternative or removing it.", name, usage)));
            }
        }
        return recommendations;
    }

    private DependencyImpact score(DependencyNode node, DependencyGraph graph, AnalysisContext context,
                                   ImpactWeights weights) {
        double businessValue = businessValue(node.usage());
        Double usage = node.usage().usageScore();
        int transitiveCount = graph.descendants(node.id()).size();
        int recentReleases = recentReleases(node.releases(), context.today());
        double complexity = complexity(transitiveCount, recentReleases);
        Double health = assessHealth(node, context).score();

        double overall = weights.businessValue() * businessValue
            + weights.usage() * Scores.orNeutral(usage, NEUTRAL)
            + weights.complexity() * complexity
            + weights.health() * (1.0 - Scores.orNeutral(health, NEUTRAL));
        // Unrounded so any change in health moves the score
        overall = Scores.clamp(overall);

        return new DependencyImpact(node.name(), node.ecosystem(), node.versionConstraint(),
            Scores.round(businessValue), usage, Scores.round(complexity), health, overall,
            bucket(Scores.round(overall)),
            transitiveCount, recentReleases);
    }

    /**
     * Share of the package's features the project exercises; 0.5 when unknown.
     *
     * @param usage usage signals
     * @return business value score
     */
    static double businessValue(UsageSignals usage) {
        if (usage.usedFeatures() == null || usage.unusedFeatures() == null) {
            return NEUTRAL;
        }
        int total = usage.usedFeatures() + usage.unusedFeatures();
        return total == 0 ? NEUTRAL : (double) usage.usedFeatures() / total;
    }

    /**
     * Complexity from transitive weight and release churn; strictly increasing in both.
     *
     * @param transitiveCount number of transitive descendants
     * @param recentReleases releases in the last year
     * @return complexity score in [0, 1)
     */
    static double complexity(int transitiveCount, int recentReleases) {
        return 0.6 * transitiveCount / (transitiveCount + 10.0) + 0.4 * recentReleases / (recentReleases + 6.0);
    }

    static String bucket(double overall) {
        if (overall >= HIGH_IMPACT) {
            return "high";
        }
        if (overall >= MEDIUM_IMPACT) {
            return "medium";
        }
        return "low";
    }

    private static int recentReleases(List<ReleaseRecord> releases, LocalDate today) {
        LocalDate windowStart = today.minusDays(CHURN_WINDOW_DAYS);
        return (int) releases.stream()
            .filter(release -> !release.releaseDate().isBefore(windowStart) && !release.releaseDate().isAfter(today))
            .count();
    }

    @SuppressWarnings("unchecked")
    private static ImpactWeights weightsOverride(Map<String, Object> configuration, ImpactWeights defaults) {
        Object raw = configuration.get("weights");
        if (raw == null) {
            return defaults;
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new InvalidConfigurationException("Configuration 'weights' must be a map");
        }
        Map<String, Object> map = (Map<String, Object>) raw;
        return new ImpactWeights(
            AnalysisContext.readDouble(map, "business_value", defaults.businessValue()),
            AnalysisContext.readDouble(map, "usage", defaults.usage()),
            AnalysisContext.readDouble(map, "complexity", defaults.complexity()),
            AnalysisContext.readDouble(map, "health", defaults.health()));
    }

    record DependencyImpact(
        String name,
        String ecosystem,
        String version,
        double businessValueScore,
        Double usageScore,
        double complexityScore,
        Double healthScore,
        double overallScore,
        String impactLevel,
        int transitiveCount,
        int recentReleases
    ) {}

    record ImpactSummary(
        int totalDependencies,
        int highImpactCount,
        int mediumImpactCount,
        int lowImpactCount,
        double averageScore,
        int lowUsageCount,
        int healthIssuesCount,
        Map<String, Double> weights
    ) {}
}
