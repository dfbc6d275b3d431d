package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyGraph;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
import com.depintel.core.util.Scores;
import com.depintel.core.util.SemanticVersion;
import com.depintel.core.util.VersionConstraint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds ways to shrink the dependency tree without losing functionality.
 *
 * <p>Three independent passes:
 * <ol>
 *   <li><b>Duplicate functionality</b>: direct dependencies sharing a category. The member with
 *       the most used features is kept (then higher health, then name); the others are removal
 *       candidates.</li>
 *   <li><b>Version inconsistency</b>: packages requested with several constraints. The highest
 *       requested version satisfying every constraint is recommended; when none does, the
 *       highest requested version is recommended and the constraints it breaks are flagged.</li>
 *   <li><b>Transitive bloat</b>: packages below depth 1 pulled in by more than
 *       {@code transitive_threshold} direct dependencies, with their shortest chain.</li>
 * </ol>
 */
public class ConsolidationAnalyzer extends AbstractAnalyzer {

    private static final double UNKNOWN_HEALTH = 0.5;

    @Override
    public String getId() {
        return "consolidation-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Consolidation Analyzer";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.DEPENDENCY_CONSOLIDATION;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        if (AnalysisContext.readInt(configuration, "transitive_threshold", 1) <= 0) {
            throw new InvalidConfigurationException("transitive_threshold must be positive");
        }
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        DependencyGraph graph = context.graph();
        int threshold = context.getInt("transitive_threshold",
            context.engineConfig().consolidation().transitiveThreshold());

        List<DuplicateGroup> duplicates = duplicateGroups(graph, context);
        List<VersionInconsistency> inconsistencies = versionInconsistencies(graph);
        List<TransitiveBloat> bloat = transitiveBloat(graph, threshold);

        int removals = duplicates.stream().mapToInt(group -> group.remove().size()).sum();
        int total = graph.size();
        double reductionPercent = total == 0 ? 0.0 : Scores.round(100.0 * removals / total, 1);

        ConsolidationSummary summary = new ConsolidationSummary(total, graph.directDependencies().size(),
            graph.transitiveDependencies().size(), duplicates.size(), removals, removals,
            inconsistencies.size(), bloat.size(), reductionPercent, graph.ecosystemCounts());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duplicate_groups", duplicates);
        details.put("version_inconsistencies", inconsistencies);
        details.put("transitive_bloat", bloat);
        return buildResult(summary, details, List.of());
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map<String, Object> group : result.detailEntries("duplicate_groups")) {
            String keep = text(group, "keep");
            String category = text(group, "category");
            Map<String, String> ecosystems = new HashMap<>();
            for (Map<String, Object> member : entries(group, "members")) {
                ecosystems.put(text(member, "name"), text(member, "ecosystem"));
            }
            for (String removed : strings(group, "remove")) {
                recommendations.add(recommendation(removed, ecosystems.get(removed), "consolidation", Severity.MEDIUM,
                    "Consolidate " + removed + " into " + keep,
                    removed + " duplicates the " + category + " functionality already provided by " + keep
                        + ". Migrate its usages to " + keep + " and remove it."));
            }
        }
        for (Map<String, Object> entry : result.detailEntries("version_inconsistencies")) {
            String name = text(entry, "name");
            List<String> unsatisfied = strings(entry, "unsatisfied_constraints");
            String target = text(entry, "recommended_version");
            String description = unsatisfied.isEmpty()
                ? "All requesters of " + name + " accept " + target + "."
                : "No single version of " + name + " satisfies every requester; " + target
                    + " breaks " + String.join(", ", unsatisfied) + ".";
            String from = String.join(" | ", section(entry, "versions_in_use").keySet());
            recommendations.add(new Recommendation("Align versions of " + name + " on " + target, description,
                getType(), "version_alignment", unsatisfied.isEmpty() ? Severity.LOW : Severity.MEDIUM, name,
                text(entry, "ecosystem"),
                new Recommendation.VersionTransition(from, target)));
        }
        for (Map<String, Object> entry : result.detailEntries("transitive_bloat")) {
            String name = text(entry, "name");
            recommendations.add(recommendation(name, text(entry, "ecosystem"), "transitive_bloat", Severity.LOW,
                "Reduce transitive fan-in of " + name,
                name + " is pulled in by " + strings(entry, "referenced_by").size()
                    + " direct dependencies (shortest chain: " + String.join(" -> ", strings(entry, "chain")) + ")."));
        }
        return recommendations;
    }

    private List<DuplicateGroup> duplicateGroups(DependencyGraph graph, AnalysisContext context) {
        Map<String, List<Member>> byCategory = new TreeMap<>();
        for (DependencyNode node : graph.directDependencies()) {
            String category = node.category();
            if (category == null || category.isBlank()) {
                continue;
            }
            Member member = new Member(node.name(), node.ecosystem(), node.usage().usedFeatures(), assessHealth(node, context).score());
            byCategory.computeIfAbsent(category.trim().toLowerCase(Locale.ROOT), c -> new ArrayList<>()).add(member);
        }

        Comparator<Member> preference = Comparator
            .comparingInt((Member m) -> m.usedFeatures() == null ? -1 : m.usedFeatures()).reversed()
            .thenComparing(Comparator.comparingDouble(
                (Member m) -> Scores.orNeutral(m.healthScore(), UNKNOWN_HEALTH)).reversed())
            .thenComparing(Member::name);

        List<DuplicateGroup> groups = new ArrayList<>();
        byCategory.forEach((category, members) -> {
            if (members.size() < 2) {
                return;
            }
            members.sort(preference);
            Member keep = members.get(0);
            List<String> remove = members.subList(1, members.size()).stream().map(Member::name).toList();
            groups.add(new DuplicateGroup(category, keep.name(), remove, List.copyOf(members),
                keep.name() + " is the most used " + category + " package"));
        });
        return groups;
    }

    private List<VersionInconsistency> versionInconsistencies(DependencyGraph graph) {
        List<VersionInconsistency> result = new ArrayList<>();
        for (DependencyNode node : graph.allNodes()) {
            Map<String, Set<String>> usage = node.versionUsage();
            if (usage.size() < 2) {
                continue;
            }
            List<VersionConstraint> constraints = usage.keySet().stream().map(VersionConstraint::parse).toList();
            TreeSet<SemanticVersion> candidates = new TreeSet<>();
            constraints.forEach(constraint -> candidates.addAll(constraint.referencedVersions()));
            if (candidates.isEmpty()) {
                continue;
            }

            Optional<SemanticVersion> satisfyingAll = candidates.descendingSet().stream()
                .filter(candidate -> constraints.stream().allMatch(c -> c.isSatisfiedBy(candidate)))
                .findFirst();
            SemanticVersion recommended = satisfyingAll.orElse(candidates.last());
            List<String> unsatisfied = constraints.stream()
                .filter(constraint -> !constraint.isSatisfiedBy(recommended))
                .map(VersionConstraint::toString)
                .toList();

            Map<String, List<String>> inUse = new TreeMap<>();
            usage.forEach((constraint, parents) -> inUse.put(constraint, parents.stream().map(this::displayName).toList()));
            result.add(new VersionInconsistency(node.name(), node.ecosystem(), inUse, recommended.toString(),
                satisfyingAll.isPresent(), unsatisfied));
        }
        return result;
    }

    private List<TransitiveBloat> transitiveBloat(DependencyGraph graph, int threshold) {
        List<TransitiveBloat> result = new ArrayList<>();
        for (DependencyNode node : graph.allNodes()) {
            if (node.depth() <= 1) {
                continue;
            }
            List<String> referencedBy = graph.directAncestors(node.id()).stream().map(this::displayName).toList();
            if (referencedBy.size() > threshold) {
                List<String> chain = graph.shortestPathFromRoot(node.id()).stream().map(this::displayName).toList();
                result.add(new TransitiveBloat(node.name(), node.ecosystem(), node.depth(), referencedBy,
                    referencedBy.size(), chain));
            }
        }
        return result;
    }

    // Node ids are "ecosystem:name"; documents use bare names.
    private String displayName(String nodeId) {
        int separator = nodeId.indexOf(':');
        return separator < 0 ? nodeId : nodeId.substring(separator + 1);
    }

    record Member(String name, String ecosystem, Integer usedFeatures, Double healthScore) {}

    record DuplicateGroup(
        String category,
        String keep,
        List<String> remove,
        List<Member> members,
        String reason
    ) {}

    record VersionInconsistency(
        String name,
        String ecosystem,
        Map<String, List<String>> versionsInUse,
        String recommendedVersion,
        boolean satisfiesAll,
        List<String> unsatisfiedConstraints
    ) {}

    record TransitiveBloat(
        String name,
        String ecosystem,
        int depth,
        List<String> referencedBy,
        int referenceCount,
        List<String> chain
    ) {}

    record ConsolidationSummary(
        int totalDependencies,
        int directDependencies,
        int transitiveDependencies,
        int duplicateGroups,
        int duplicateRemovals,
        int potentialRemovals,
        int versionInconsistencies,
        int chainReduction,
        double reductionPercent,
        Map<String, Integer> ecosystemCounts
    ) {}
}
