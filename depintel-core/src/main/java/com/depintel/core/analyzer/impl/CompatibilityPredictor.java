package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.config.EngineConfig.CompatibilitySettings;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata.BreakingChange;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.ReleaseRecord;
import com.depintel.core.model.RiskLevel;
import com.depintel.core.model.Severity;
import com.depintel.core.util.Scores;
import com.depintel.core.util.SemanticVersion;
import com.depintel.core.util.UpgradeCompatibility;
import com.depintel.core.util.VersionConstraint;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Forecasts compatibility events from release cadence and builds a dated timeline.
 *
 * <p>Per dependency:
 * <ul>
 *   <li><b>predicted_release</b>: last release date plus the mean interval of the last N releases,
 *       kept when it falls inside the horizon; major when the package historically ships more
 *       major versions per year than the threshold</li>
 *   <li><b>deprecation</b> (dated today): the declared version trails latest by more than two minor
 *       versions or by a major version, or the registry flags the package deprecated</li>
 *   <li><b>breaking_change</b>: yanked releases and announced breaking changes, at their release date</li>
 * </ul>
 *
 * <p>Cadence, major-bump rate and the fallback latest version consider stable releases only.
 * Each dependency issue also carries the {@link UpgradeCompatibility} score of moving from the
 * declared version to the latest one.
 *
 * <p>Options: {@code time_horizon} (days), {@code history_window}, {@code major_bumps_per_year},
 * {@code include_transitive}.
 */
public class CompatibilityPredictor extends AbstractAnalyzer {

    static final String PREDICTED_RELEASE = "predicted_release";
    static final String DEPRECATION = "deprecation";
    static final String BREAKING_CHANGE = "breaking_change";

    static final int MAX_MINORS_BEHIND = 2;
    static final double DEFAULT_COMPATIBILITY = 0.5;

    private static final double DAYS_PER_YEAR = 365.25;

    @Override
    public String getId() {
        return "compatibility-predictor";
    }

    @Override
    public String getDisplayName() {
        return "Compatibility Predictor";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.COMPATIBILITY_PREDICTION;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        if (AnalysisContext.readInt(configuration, "time_horizon", 1) <= 0) {
            throw new InvalidConfigurationException("time_horizon must be a positive number of days");
        }
        if (AnalysisContext.readInt(configuration, "history_window", 2) < 2) {
            throw new InvalidConfigurationException("history_window must be at least 2");
        }
        if (AnalysisContext.readDouble(configuration, "major_bumps_per_year", 0.0) < 0) {
            throw new InvalidConfigurationException("major_bumps_per_year must not be negative");
        }
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        CompatibilitySettings defaults = context.engineConfig().compatibility();
        Options options = new Options(
            context.getInt("time_horizon", defaults.timeHorizonDays()),
            context.getInt("history_window", defaults.historyWindow()),
            context.getDouble("major_bumps_per_year", defaults.majorBumpsPerYear()),
            context.getBoolean("include_transitive", false));
        LocalDate today = context.today();
        LocalDate horizonEnd = today.plusDays(options.horizonDays());

        List<DependencyNode> scope = options.includeTransitive()
            ? context.graph().allNodes()
            : context.graph().directDependencies();

        TreeMap<LocalDate, List<TimelineEvent>> timeline = new TreeMap<>();
        List<DependencyIssue> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        int predictedMajors = 0;

        for (DependencyNode node : scope) {
            String current = currentVersion(node).map(SemanticVersion::toString).orElse(node.versionConstraint());
            String latest = latestVersion(node).map(SemanticVersion::toString).orElse(null);
            List<ReleaseRecord> history = node.releases().stream()
                .sorted(Comparator.comparing(ReleaseRecord::releaseDate))
                .toList();

            Optional<UpgradeCompatibility.Assessment> upgrade = upgrade(node);

            if (history.isEmpty()) {
                issues.add(new DependencyIssue(node.name(), node.ecosystem(), current, latest,
                    RiskLevel.UNKNOWN.label(), null, null, List.of("no release history available"),
                    upgrade.orElse(null)));
                counts.merge(RiskLevel.UNKNOWN, 1, Integer::sum);
                continue;
            }

            List<TimelineEvent> events = new ArrayList<>();
            Cadence cadence = cadence(history, options);
            if (cadence != null && !cadence.predictedDate().isAfter(horizonEnd)) {
                LocalDate date = cadence.predictedDate().isBefore(today) ? today : cadence.predictedDate();
                String predictedVersion = latestVersion(node)
                    .map(v -> cadence.major() ? v.nextMajor() : v.nextMinor())
                    .map(SemanticVersion::toString)
                    .orElse(null);
                events.add(new TimelineEvent(date, node.name(), node.ecosystem(), PREDICTED_RELEASE,
                    predictedVersion, cadence.major(), null,
                    (cadence.major() ? "Major" : "Minor") + " release expected based on a "
                        + Math.round(cadence.meanIntervalDays()) + "-day release cadence"));
                if (cadence.major()) {
                    predictedMajors++;
                }
            }

            deprecation(node, today).ifPresent(events::add);
            events.addAll(breakingChanges(node, history, warnings));

            RiskLevel severity = severity(events);
            counts.merge(severity, 1, Integer::sum);
            for (TimelineEvent event : events) {
                timeline.computeIfAbsent(event.date(), d -> new ArrayList<>()).add(event);
            }
            issues.add(new DependencyIssue(node.name(), node.ecosystem(), current, latest, severity.label(),
                cadence == null ? null : cadence.predictedDate(),
                cadence == null ? null : Scores.round(cadence.meanIntervalDays(), 1),
                events.stream().map(TimelineEvent::description).toList(), upgrade.orElse(null)));
        }

        Comparator<TimelineEvent> withinDay = Comparator.comparing(TimelineEvent::dependency)
            .thenComparing(TimelineEvent::ecosystem)
            .thenComparing(TimelineEvent::eventType);
        Map<String, List<TimelineEvent>> materialized = new LinkedHashMap<>();
        timeline.forEach((date, events) -> {
            events.sort(withinDay);
            materialized.put(date.toString(), events);
        });

        Map<String, Integer> issueCounts = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            issueCounts.put(level.label(), counts.getOrDefault(level, 0));
        }
        int eventCount = timeline.values().stream().mapToInt(List::size).sum();
        int affected = counts.getOrDefault(RiskLevel.HIGH, 0) + counts.getOrDefault(RiskLevel.MEDIUM, 0);

        CompatibilitySummary summary = new CompatibilitySummary(scope.size(), affected, issueCounts,
            options.horizonDays(), eventCount, predictedMajors);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timeline", materialized);
        details.put("dependency_issues", issues);
        return buildResult(summary, details, warnings);
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map<String, Object> issue : result.detailEntries("dependency_issues")) {
            String name = text(issue, "name");
            String ecosystem = text(issue, "ecosystem");
            String severity = text(issue, "severity");
            Recommendation.VersionTransition transition = text(issue, "latest_version") == null
                ? null
                : new Recommendation.VersionTransition(text(issue, "current_version"), text(issue, "latest_version"));
            String findings = String.join("; ", strings(issue, "issues"));
            if (RiskLevel.HIGH.label().equals(severity)) {
                recommendations.add(new Recommendation("Plan for breaking changes in " + name, findings,
                    getType(), "breaking_change_planning", Severity.HIGH, name, ecosystem, transition));
            } else if (RiskLevel.MEDIUM.label().equals(severity)) {
                recommendations.add(new Recommendation("Upgrade " + name, findings,
                    getType(), "upgrade", Severity.MEDIUM, name, ecosystem, transition));
            }
        }
        return recommendations;
    }

    private Cadence cadence(List<ReleaseRecord> history, Options options) {
        List<ReleaseRecord> published = history.stream()
            .filter(r -> !r.yanked() && isStable(r))
            .toList();
        if (published.size() < 2) {
            return null;
        }
        List<ReleaseRecord> window = published.subList(Math.max(0, published.size() - options.historyWindow()),
            published.size());
        long span = ChronoUnit.DAYS.between(window.get(0).releaseDate(), window.get(window.size() - 1).releaseDate());
        double meanInterval = (double) span / (window.size() - 1);
        LocalDate last = window.get(window.size() - 1).releaseDate();
        LocalDate predicted = last.plusDays(Math.max(1L, Math.round(meanInterval)));
        return new Cadence(meanInterval, predicted, majorBumpsPerYear(published) > options.majorBumpsPerYear());
    }

    // Major bumps over the stable history, per year of history (at least one year).
    static double majorBumpsPerYear(List<ReleaseRecord> history) {
        List<ReleaseRecord> stable = history.stream().filter(CompatibilityPredictor::isStable).toList();
        if (stable.isEmpty()) {
            return 0.0;
        }
        int bumps = 0;
        Integer previousMajor = null;
        for (ReleaseRecord release : stable) {
            Optional<SemanticVersion> version = SemanticVersion.parse(release.version());
            if (version.isEmpty()) {
                continue;
            }
            int major = version.get().major();
            if (previousMajor != null && major > previousMajor) {
                bumps++;
            }
            previousMajor = previousMajor == null ? major : Math.max(previousMajor, major);
        }
        long spanDays = ChronoUnit.DAYS.between(stable.get(0).releaseDate(),
            stable.get(stable.size() - 1).releaseDate());
        double years = Math.max(1.0, spanDays / DAYS_PER_YEAR);
        return bumps / years;
    }

    private Optional<TimelineEvent> deprecation(DependencyNode node, LocalDate today) {
        List<String> reasons = new ArrayList<>();
        Optional<SemanticVersion> current = currentVersion(node);
        Optional<SemanticVersion> latest = latestVersion(node);
        if (current.isPresent() && latest.isPresent()) {
            int behind = current.get().minorsBehind(latest.get());
            if (behind == Integer.MAX_VALUE) {
                reasons.add("declared version " + current.get() + " is a major version behind " + latest.get());
            } else if (behind > MAX_MINORS_BEHIND) {
                reasons.add("declared version " + current.get() + " is " + behind + " minor versions behind "
                    + latest.get());
            }
        }
        if (node.isDeprecated()) {
            String message = node.metadata().deprecationMessage();
            reasons.add(message == null || message.isBlank() ? "package is deprecated" : "deprecated: " + message);
        }
        if (reasons.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TimelineEvent(today, node.name(), node.ecosystem(), DEPRECATION,
            latest.map(SemanticVersion::toString).orElse(null), null, null, String.join("; ", reasons)));
    }

    private List<TimelineEvent> breakingChanges(DependencyNode node, List<ReleaseRecord> history,
                                                List<String> warnings) {
        Map<String, ReleaseRecord> byVersion = new LinkedHashMap<>();
        history.forEach(release -> byVersion.putIfAbsent(release.version(), release));
        Map<String, BreakingChange> announced = new LinkedHashMap<>();
        if (node.metadata() != null) {
            node.metadata().breakingChanges().forEach(change -> announced.putIfAbsent(change.version(), change));
        }

        Set<String> versions = new LinkedHashSet<>();
        history.stream().filter(ReleaseRecord::yanked).forEach(release -> versions.add(release.version()));
        versions.addAll(announced.keySet());

        List<TimelineEvent> events = new ArrayList<>();
        for (String version : versions) {
            ReleaseRecord release = byVersion.get(version);
            if (release == null) {
                warnings.add("No release date for breaking change " + node.name() + "@" + version);
                continue;
            }
            BreakingChange change = announced.get(version);
            double score = change == null || change.compatibilityScore() == null
                ? DEFAULT_COMPATIBILITY
                : Scores.clamp(change.compatibilityScore());
            String description = change != null && change.description() != null
                ? "Breaking change in " + version + ": " + change.description()
                : "Release " + version + " was yanked";
            events.add(new TimelineEvent(release.releaseDate(), node.name(), node.ecosystem(), BREAKING_CHANGE,
                version, null, score, description));
        }
        return events;
    }

    private static RiskLevel severity(List<TimelineEvent> events) {
        if (events.stream().anyMatch(e -> BREAKING_CHANGE.equals(e.eventType()))) {
            return RiskLevel.HIGH;
        }
        if (events.stream().anyMatch(e -> DEPRECATION.equals(e.eventType()))) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static Optional<SemanticVersion> currentVersion(DependencyNode node) {
        return VersionConstraint.parse(node.versionConstraint()).lowestReferenced();
    }

    private static Optional<SemanticVersion> latestVersion(DependencyNode node) {
        Optional<SemanticVersion> declared = SemanticVersion.parse(node.latestVersion());
        if (declared.isPresent()) {
            return declared;
        }
        return node.releases().stream()
            .filter(r -> !r.yanked())
            .map(r -> SemanticVersion.parse(r.version()))
            .flatMap(Optional::stream)
            .filter(version -> !version.isPreRelease())
            .max(Comparator.naturalOrder());
    }

    private static Optional<UpgradeCompatibility.Assessment> upgrade(DependencyNode node) {
        Optional<SemanticVersion> current = currentVersion(node);
        Optional<SemanticVersion> latest = latestVersion(node);
        if (current.isEmpty() || latest.isEmpty()) {
            return Optional.empty();
        }
        List<BreakingChange> announced = node.metadata() == null ? List.of() : node.metadata().breakingChanges();
        return Optional.of(UpgradeCompatibility.assess(current.get(), latest.get(), announced));
    }

    // Unparseable versions count as stable
    private static boolean isStable(ReleaseRecord release) {
        return SemanticVersion.parse(release.version()).map(v -> !v.isPreRelease()).orElse(true);
    }

    private record Options(int horizonDays, int historyWindow, double majorBumpsPerYear, boolean includeTransitive) {}

    private record Cadence(double meanIntervalDays, LocalDate predictedDate, boolean major) {}

    record TimelineEvent(
        LocalDate date,
        String dependency,
        String ecosystem,
        String eventType,
        String version,
        Boolean isMajor,
        Double compatibilityScore,
        String description
    ) {}

    record DependencyIssue(
        String name,
        String ecosystem,
        String currentVersion,
        String latestVersion,
        String severity,
        LocalDate predictedRelease,
        Double meanReleaseIntervalDays,
        List<String> issues,
        String versionChange,
        Double compatibilityScore,
        Double confidence,
        String upgradeAction
    ) {
        DependencyIssue(String name, String ecosystem, String currentVersion, String latestVersion, String severity,
                        LocalDate predictedRelease, Double meanReleaseIntervalDays, List<String> issues,
                        UpgradeCompatibility.Assessment upgrade) {
            this(name, ecosystem, currentVersion, latestVersion, severity, predictedRelease, meanReleaseIntervalDays,
                issues,
                upgrade == null ? null : upgrade.change().label(),
                upgrade == null ? null : upgrade.score(),
                upgrade == null ? null : upgrade.confidence(),
                upgrade == null ? null : upgrade.action());
        }
    }

    record CompatibilitySummary(
        int totalDependencies,
        int affectedDependencies,
        Map<String, Integer> issueCounts,
        int timeHorizonDays,
        int timelineEventCount,
        int predictedMajorReleases
    ) {}
}
