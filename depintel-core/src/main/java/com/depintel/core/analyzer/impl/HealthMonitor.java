package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.config.EngineConfig.HealthSettings;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.ReleaseRecord;
import com.depintel.core.model.Severity;
import com.depintel.core.util.HealthScoring;
import com.depintel.core.util.HealthScoring.HealthAssessment;
import com.depintel.core.util.HealthStatus;
import com.depintel.core.util.Scores;
import com.depintel.core.util.SemanticVersion;
import com.depintel.core.util.VersionConstraint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the health of every package in the graph and suggests healthier alternatives.
 *
 * <p>Scoring is delegated to {@link HealthScoring}, the same function the impact scorer uses.
 * Unknown scores are bucketed as moderate.
 */
public class HealthMonitor extends AbstractAnalyzer {

    @Override
    public String getId() {
        return "health-monitor";
    }

    @Override
    public String getDisplayName() {
        return "Health Monitor";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.HEALTH_MONITORING;
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        List<DependencyNode> nodes = context.graph().allNodes();
        Map<String, HealthAssessment> assessments = new LinkedHashMap<>();
        for (DependencyNode node : nodes) {
            assessments.put(node.id(), assessHealth(node, context));
        }
        AlternativeFinder alternatives = new AlternativeFinder(context, nodes, assessments);

        List<DependencyHealth> dependencies = new ArrayList<>();
        List<HealthRecommendation> recommendations = new ArrayList<>();
        Map<HealthStatus, Integer> distribution = new EnumMap<>(HealthStatus.class);
        int unknown = 0;
        int deprecated = 0;
        int outdated = 0;
        int vulnerable = 0;
        double scoreSum = 0.0;
        int scored = 0;

        for (DependencyNode node : nodes) {
            HealthAssessment assessment = assessments.get(node.id());
            HealthStatus status = assessment.status();
            distribution.merge(status, 1, Integer::sum);
            if (assessment.isKnown()) {
                scoreSum += assessment.score();
                scored++;
            } else {
                unknown++;
            }
            if (assessment.deprecated()) {
                deprecated++;
            }
            boolean isOutdated = isOutdated(node);
            if (isOutdated) {
                outdated++;
            }
            int vulnerabilities = node.metadata() == null ? 0 : node.metadata().vulnerabilities().size();
            if (vulnerabilities > 0) {
                vulnerable++;
            }

            dependencies.add(new DependencyHealth(node.name(), node.ecosystem(), node.depth(), assessment.score(),
                status.label(), assessment.stalenessScore(), assessment.communityScore(),
                assessment.daysSinceLastRelease(), assessment.deprecated(), isOutdated, vulnerabilities,
                assessment.riskFactors()));

            Optional<Candidate> alternative = status == HealthStatus.HEALTHY
                ? Optional.empty()
                : alternatives.bestFor(node, assessment.score());
            recommendations.add(new HealthRecommendation(node.name(), node.ecosystem(), urgency(status), action(status),
                message(node, assessment, status),
                alternative.map(Candidate::name).orElse(null),
                alternative.map(Candidate::score).orElse(null)));
        }

        Map<String, Integer> distributionLabels = new LinkedHashMap<>();
        for (HealthStatus status : HealthStatus.values()) {
            distributionLabels.put(status.label(), distribution.getOrDefault(status, 0));
        }
        Double average = scored == 0 ? null : Scores.round(scoreSum / scored);
        HealthSummary summary = new HealthSummary(nodes.size(), average, distributionLabels, unknown, deprecated,
            outdated, vulnerable);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependencies", dependencies);
        details.put("recommendations", recommendations);
        return buildResult(summary, details, List.of());
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> out = new ArrayList<>();
        for (Map<String, Object> entry : result.detailEntries("recommendations")) {
            String name = text(entry, "dependency");
            String ecosystem = text(entry, "ecosystem");
            String alternative = text(entry, "alternative");
            String description = text(entry, "message")
                + (alternative == null ? "" : " Consider " + alternative + " as a healthier alternative.");
            switch (String.valueOf(text(entry, "urgency"))) {
                case "high" -> out.add(recommendation(name, ecosystem, "health_improvement", Severity.HIGH,
                    "Replace or remediate unhealthy dependency " + name, description));
                case "medium" -> out.add(recommendation(name, ecosystem, "health_monitoring", Severity.MEDIUM,
                    "Monitor health of " + name, description));
                default -> {
                    // Healthy dependencies need no action
                }
            }
        }
        return out;
    }

    private static boolean isOutdated(DependencyNode node) {
        Optional<SemanticVersion> current = VersionConstraint.parse(node.versionConstraint()).lowestReferenced();
        Optional<SemanticVersion> latest = SemanticVersion.parse(node.latestVersion());
        return current.isPresent() && latest.isPresent() && latest.get().isAfter(current.get());
    }

    private static String urgency(HealthStatus status) {
        return switch (status) {
            case AT_RISK -> "high";
            case MODERATE -> "medium";
            case HEALTHY -> "low";
        };
    }

    private static String action(HealthStatus status) {
        return switch (status) {
            case AT_RISK -> "replace";
            case MODERATE -> "monitor";
            case HEALTHY -> "keep";
        };
    }

    private static String message(DependencyNode node, HealthAssessment assessment, HealthStatus status) {
        String score = assessment.isKnown() ? String.format(Locale.ROOT, "%.2f", assessment.score()) : "unknown";
        String factors = assessment.riskFactors().isEmpty()
            ? "no risk factors"
            : "risk factors: " + String.join(", ", assessment.riskFactors());
        return node.name() + " is " + status.label().replace('_', ' ') + " (health " + score + "; " + factors + ").";
    }

    /**
     * Picks the healthiest same-category package, from the graph or from metadata alternatives.
     */
    private static final class AlternativeFinder {

        private final AnalysisContext context;
        private final List<DependencyNode> nodes;
        private final Map<String, HealthAssessment> assessments;
        private final Map<String, Optional<Candidate>> externalCache = new HashMap<>();

        private AlternativeFinder(AnalysisContext context, List<DependencyNode> nodes,
                                  Map<String, HealthAssessment> assessments) {
            this.context = context;
            this.nodes = nodes;
            this.assessments = assessments;
        }

        private Optional<Candidate> bestFor(DependencyNode node, Double currentScore) {
            List<Candidate> candidates = new ArrayList<>();
            String category = node.category();
            if (category != null) {
                for (DependencyNode peer : nodes) {
                    if (!peer.id().equals(node.id()) && category.equalsIgnoreCase(peer.category())) {
                        Double score = assessments.get(peer.id()).score();
                        if (score != null) {
                            candidates.add(new Candidate(peer.name(), score));
                        }
                    }
                }
            }
            if (node.metadata() != null) {
                for (String name : node.metadata().alternatives()) {
                    if (!name.equals(node.name())) {
                        external(name, node.ecosystem()).ifPresent(candidates::add);
                    }
                }
            }
            return candidates.stream()
                .filter(candidate -> currentScore == null || candidate.score() > currentScore)
                .max(Comparator.comparingDouble(Candidate::score)
                    .thenComparing(Candidate::name, Comparator.reverseOrder()));
        }

        private Optional<Candidate> external(String name, String ecosystem) {
            return externalCache.computeIfAbsent(ecosystem + ":" + name, key -> {
                Optional<PackageMetadata> metadata = context.metadataProvider().lookup(name, ecosystem);
                if (metadata.isEmpty()) {
                    return Optional.empty();
                }
                List<ReleaseRecord> history = context.metadataProvider().versionHistory(name, ecosystem);
                HealthSettings weights = context.engineConfig().health();
                Double score = HealthScoring.assess(metadata.get(), history, context.today(),
                    weights.stalenessWeight(), weights.communityWeight()).score();
                return score == null ? Optional.empty() : Optional.of(new Candidate(name, score));
            });
        }
    }

    private record Candidate(String name, double score) {}

    record DependencyHealth(
        String name,
        String ecosystem,
        int depth,
        Double healthScore,
        String status,
        Double stalenessScore,
        Double communityScore,
        Long daysSinceLastRelease,
        boolean deprecated,
        boolean outdated,
        int vulnerabilityCount,
        List<String> riskFactors
    ) {}

    record HealthRecommendation(
        String dependency,
        String ecosystem,
        String urgency,
        String action,
        String message,
        String alternative,
        Double alternativeHealthScore
    ) {}

    record HealthSummary(
        int dependencyCount,
        Double averageHealthScore,
        Map<String, Integer> healthDistribution,
        int unknownCount,
        int deprecatedCount,
        int outdatedCount,
        int vulnerableCount
    ) {}
}
