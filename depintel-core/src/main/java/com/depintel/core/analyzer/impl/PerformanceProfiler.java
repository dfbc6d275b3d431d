package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata.RuntimeMetrics;
import com.depintel.core.model.PackageMetadata.SizeMetrics;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
import com.depintel.core.util.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Profiles what dependencies cost in bundle size or at runtime.
 *
 * <p>Option {@code profile_type}:
 * <ul>
 *   <li>{@code bundle_size} (default): every package in the graph. Sizes are summed and each
 *       package's share of the minified total is classed large (&gt;10%), medium (5-10%) or
 *       small (&lt;5%).</li>
 *   <li>{@code runtime}: direct dependencies only, since transitive runtime cost cannot be
 *       attributed from static metadata. Impact is high above 10 ms, medium above 5 ms.</li>
 * </ul>
 */
public class PerformanceProfiler extends AbstractAnalyzer {

    static final String BUNDLE_SIZE = "bundle_size";
    static final String RUNTIME = "runtime";

    /** Gzipped project total above which a project-wide recommendation is emitted. */
    static final long LARGE_BUNDLE_BYTES = 1024L * 1024L;

    static final double LARGE_SHARE = 10.0;
    static final double MEDIUM_SHARE = 5.0;
    static final double HIGH_RUNTIME_MS = 10.0;
    static final double MEDIUM_RUNTIME_MS = 5.0;

    private static final int LARGEST_LIMIT = 10;
    private static final Set<String> PROFILES = Set.of(BUNDLE_SIZE, RUNTIME);

    @Override
    public String getId() {
        return "performance-profiler";
    }

    @Override
    public String getDisplayName() {
        return "Performance Profiler";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.PERFORMANCE_PROFILING;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        String profile = AnalysisContext.readString(configuration, "profile_type", null);
        if (profile != null) {
            requireKnownProfile(profile);
        }
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        String profile = requireKnownProfile(
            context.getString("profile_type", context.engineConfig().performance().defaultProfile()));
        return RUNTIME.equals(profile) ? runtimeProfile(context) : bundleProfile(context);
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map<String, Object> entry : result.detailEntries("dependencies")) {
            String name = text(entry, "name");
            String ecosystem = text(entry, "ecosystem");
            if ("large".equals(text(entry, "size_class"))) {
                recommendations.add(recommendation(name, ecosystem, "performance_optimization", Severity.MEDIUM,
                    "Reduce bundle cost of " + name,
                    String.format(Locale.ROOT, "%s accounts for %.1f%% of the minified bundle. Consider "
                        + "tree-shaking, lazy loading or a lighter alternative.", name,
                        number(entry, "percentage_of_total"))));
            }
            if ("high".equals(text(entry, "impact_level"))) {
                recommendations.add(recommendation(name, ecosystem, "performance_optimization", Severity.MEDIUM,
                    "Reduce runtime overhead of " + name,
                    String.format(Locale.ROOT, "%s adds %.1f ms of runtime overhead. Consider deferring its "
                        + "initialization or replacing it.", name, number(entry, "impact_ms"))));
            }
        }
        Double gzipped = number(result.summary(), "total_gzipped_bytes");
        if (gzipped != null && gzipped > LARGE_BUNDLE_BYTES) {
            recommendations.add(Recommendation.projectWide(getType(), "performance_optimization", Severity.MEDIUM,
                "Reduce total bundle size",
                String.format(Locale.ROOT, "Dependencies add %.2f MB gzipped to the bundle. Review the largest "
                    + "packages for removal or code splitting.", gzipped / LARGE_BUNDLE_BYTES)));
        }
        return recommendations;
    }

    private AnalysisResult bundleProfile(AnalysisContext context) {
        List<DependencyNode> nodes = context.graph().allNodes();
        long totalMinified = 0;
        long totalGzipped = 0;
        long directMinified = 0;
        long directGzipped = 0;
        int measured = 0;
        for (DependencyNode node : nodes) {
            SizeMetrics size = sizeOf(node);
            if (size == null) {
                continue;
            }
            long minified = size.minifiedBytes() == null ? 0 : size.minifiedBytes();
            long gzipped = size.gzippedBytes() == null ? 0 : size.gzippedBytes();
            totalMinified += minified;
            totalGzipped += gzipped;
            if (node.isDirect()) {
                directMinified += minified;
                directGzipped += gzipped;
            }
            measured++;
        }

        Map<String, Integer> classCounts = new LinkedHashMap<>();
        for (String sizeClass : List.of("large", "medium", "small", "unknown")) {
            classCounts.put(sizeClass, 0);
        }
        List<BundleEntry> entries = new ArrayList<>();
        for (DependencyNode node : nodes) {
            SizeMetrics size = sizeOf(node);
            Long minified = size == null ? null : size.minifiedBytes();
            Long gzipped = size == null ? null : size.gzippedBytes();
            Double share = minified == null || totalMinified == 0
                ? null
                : Scores.round(100.0 * minified / totalMinified, 1);
            String sizeClass = sizeClass(minified == null ? null : 100.0 * minified / Math.max(1, totalMinified));
            classCounts.merge(sizeClass, 1, Integer::sum);
            entries.add(new BundleEntry(node.name(), node.ecosystem(), node.isDirect(), minified, gzipped, share,
                sizeClass));
        }
        entries.sort(Comparator
            .comparingLong((BundleEntry e) -> e.minifiedBytes() == null ? -1L : e.minifiedBytes()).reversed()
            .thenComparing(BundleEntry::name)
            .thenComparing(BundleEntry::ecosystem));
        List<BundleEntry> largest = entries.stream()
            .filter(entry -> entry.minifiedBytes() != null)
            .limit(LARGEST_LIMIT)
            .toList();

        BundleSummary summary = new BundleSummary(BUNDLE_SIZE, nodes.size(), measured, totalMinified, totalGzipped,
            directMinified, directGzipped, classCounts);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependencies", entries);
        details.put("largest", largest);
        return buildResult(summary, details, List.of());
    }

    private AnalysisResult runtimeProfile(AnalysisContext context) {
        List<DependencyNode> direct = context.graph().directDependencies();
        Map<String, Integer> impactCounts = new LinkedHashMap<>();
        for (String level : List.of("high", "medium", "low", "unknown")) {
            impactCounts.put(level, 0);
        }
        Totals startup = new Totals();
        Totals runtime = new Totals();
        Totals memory = new Totals();
        List<RuntimeEntry> entries = new ArrayList<>();

        for (DependencyNode node : direct) {
            RuntimeMetrics metrics = node.metadata() == null ? null : node.metadata().runtime();
            Double startupMs = metrics == null ? null : metrics.startupMs();
            Double runtimeMs = metrics == null ? null : metrics.runtimeMs();
            Double memoryMb = metrics == null ? null : metrics.memoryMb();
            startup.add(startupMs);
            runtime.add(runtimeMs);
            memory.add(memoryMb);

            Double impactMs = runtimeMs != null ? runtimeMs : startupMs;
            String level = impactLevel(impactMs);
            impactCounts.merge(level, 1, Integer::sum);
            entries.add(new RuntimeEntry(node.name(), node.ecosystem(), startupMs, runtimeMs, memoryMb, impactMs,
                level));
        }
        entries.sort(Comparator
            .comparingDouble((RuntimeEntry e) -> e.impactMs() == null ? -1.0 : e.impactMs()).reversed()
            .thenComparing(RuntimeEntry::name)
            .thenComparing(RuntimeEntry::ecosystem));

        RuntimeSummary summary = new RuntimeSummary(RUNTIME, direct.size(), runtime.count,
            startup.total(), runtime.total(), memory.total(),
            startup.average(), runtime.average(), memory.average(), impactCounts);
        return buildResult(summary, Map.of("dependencies", entries), List.of());
    }

    private static SizeMetrics sizeOf(DependencyNode node) {
        if (node.metadata() == null || node.metadata().size() == null) {
            return null;
        }
        SizeMetrics size = node.metadata().size();
        return size.minifiedBytes() == null && size.gzippedBytes() == null ? null : size;
    }

    static String sizeClass(Double percentage) {
        if (percentage == null) {
            return "unknown";
        }
        if (percentage > LARGE_SHARE) {
            return "large";
        }
        if (percentage >= MEDIUM_SHARE) {
            return "medium";
        }
        return "small";
    }

    static String impactLevel(Double milliseconds) {
        if (milliseconds == null) {
            return "unknown";
        }
        if (milliseconds > HIGH_RUNTIME_MS) {
            return "high";
        }
        if (milliseconds > MEDIUM_RUNTIME_MS) {
            return "medium";
        }
        return "low";
    }

    private static String requireKnownProfile(String profile) {
        String normalized = profile.trim().toLowerCase(Locale.ROOT);
        if (!PROFILES.contains(normalized)) {
            throw new InvalidConfigurationException("Unknown profile_type '" + profile
                + "', expected one of " + BUNDLE_SIZE + ", " + RUNTIME);
        }
        return normalized;
    }

    private static final class Totals {
        private double sum;
        private int count;

        void add(Double value) {
            if (value != null) {
                sum += value;
                count++;
            }
        }

        Double total() {
            return count == 0 ? null : Scores.round(sum, 2);
        }

        Double average() {
            return count == 0 ? null : Scores.round(sum / count, 2);
        }
    }

    record BundleEntry(
        String name,
        String ecosystem,
        boolean direct,
        Long minifiedBytes,
        Long gzippedBytes,
        Double percentageOfTotal,
        String sizeClass
    ) {}

    record BundleSummary(
        String profileType,
        int totalDependencies,
        int measuredDependencies,
        long totalMinifiedBytes,
        long totalGzippedBytes,
        long directMinifiedBytes,
        long directGzippedBytes,
        Map<String, Integer> sizeClassCounts
    ) {}

    record RuntimeEntry(
        String name,
        String ecosystem,
        Double startupMs,
        Double runtimeMs,
        Double memoryMb,
        Double impactMs,
        String impactLevel
    ) {}

    record RuntimeSummary(
        String profileType,
        int totalDependencies,
        int measuredDependencies,
        Double totalStartupMs,
        Double totalRuntimeMs,
        Double totalMemoryMb,
        Double averageStartupMs,
        Double averageRuntimeMs,
        Double averageMemoryMb,
        Map<String, Integer> impactCounts
    ) {}
}
