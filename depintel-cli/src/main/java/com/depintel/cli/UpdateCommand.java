package com.depintel.cli;

import com.depintel.core.exception.DependencyIntelligenceException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.JobStatus;
import com.depintel.core.orchestrator.AnalysisJob;
import com.depintel.core.util.JsonDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to list available updates with their compatibility scores.
 *
 * <p>Reads the compatibility prediction of the snapshot and reports, for every direct
 * dependency whose declared version trails the latest release, the kind of version change,
 * the compatibility score, the confidence in that score and the suggested action. Manifests
 * are never modified.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * depintel update snapshot.yaml
 * depintel update snapshot.yaml -d react -o build/updates.json
 * }</pre>
 */
@Command(
    name = "update",
    description = "Check for dependency updates and score their compatibility",
    mixinStandardHelpOptions = true
)
public class UpdateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UpdateCommand.class);

    private static final Set<String> UPGRADES = Set.of("major", "minor", "patch");

    @Parameters(index = "0", description = "Project snapshot (.yaml, .yml or .json)")
    private Path snapshotPath;

    @Option(
        names = {"-c", "--config"},
        description = "Engine configuration file (default: depintel.yaml)"
    )
    private Path configPath = Paths.get("depintel.yaml");

    @Option(
        names = {"-d", "--dependency"},
        description = "Only check this dependency"
    )
    private String dependency;

    @Option(
        names = {"-o", "--output"},
        description = "Write the update check to this JSON file"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        try (EngineSession session = EngineSession.open(snapshotPath, configPath)) {
            AnalysisJob job = session.run(List.of(AnalysisType.COMPATIBILITY_PREDICTION), Map.of())
                .get(AnalysisType.COMPATIBILITY_PREDICTION);
            if (job.status() != JobStatus.COMPLETED) {
                System.err.println("✗ Compatibility prediction failed: " + job.errorMessage());
                return 1;
            }

            List<Map<String, Object>> issues = job.result().detailEntries("dependency_issues");
            if (dependency != null && issues.stream().noneMatch(issue -> dependency.equals(issue.get("name")))) {
                System.err.println("✗ Dependency '" + dependency + "' not found in project " + session.projectId());
                return 1;
            }
            List<Map<String, Object>> updates = availableUpdates(job.result(), dependency);

            System.out.println("Available updates for " + session.projectId() + " (" + updates.size() + "):");
            System.out.println();
            for (Map<String, Object> update : updates) {
                System.out.printf(Locale.ROOT, "  %-24s %s -> %s  [%s] compatibility %.2f (confidence %.2f): %s%n",
                    update.get("name"), update.get("current_version"), update.get("latest_version"),
                    update.get("version_change"), decimal(update.get("compatibility_score")),
                    decimal(update.get("confidence")), update.get("upgrade_action"));
            }

            if (outputFile != null) {
                Path parent = outputFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(outputFile, JsonDocuments.toJson(updates), StandardCharsets.UTF_8);
                System.out.println();
                System.out.println("✓ Update check written to: " + outputFile.toAbsolutePath());
            }
            return 0;
        } catch (DependencyIntelligenceException e) {
            log.error("Update check rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Update check failed", e);
            System.err.println("✗ Update check failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Selects dependency issues describing an upgrade, in result order.
     *
     * @param result compatibility prediction result
     * @param dependency dependency name filter, {@code null} for all
     * @return one entry per available update
     */
    static List<Map<String, Object>> availableUpdates(AnalysisResult result, String dependency) {
        return result.detailEntries("dependency_issues").stream()
            .filter(issue -> dependency == null || dependency.equals(issue.get("name")))
            .filter(issue -> UPGRADES.contains(String.valueOf(issue.get("version_change"))))
            .map(UpdateCommand::toUpdate)
            .toList();
    }

    private static double decimal(Object value) {
        return value instanceof Number n ? n.doubleValue() : Double.NaN;
    }

    private static Map<String, Object> toUpdate(Map<String, Object> issue) {
        Map<String, Object> update = new LinkedHashMap<>();
        for (String key : List.of("name", "ecosystem", "current_version", "latest_version", "version_change",
            "compatibility_score", "confidence", "upgrade_action")) {
            update.put(key, issue.get(key));
        }
        return update;
    }
}
