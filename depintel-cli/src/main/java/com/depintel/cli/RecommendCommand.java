package com.depintel.cli;

import com.depintel.core.exception.DependencyIntelligenceException;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.JobStatus;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.Severity;
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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to run every analysis and print the ranked recommendations.
 */
@Command(
    name = "recommend",
    description = "Run all analyses and print ranked recommendations",
    mixinStandardHelpOptions = true
)
public class RecommendCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RecommendCommand.class);

    @Parameters(index = "0", description = "Project snapshot (.yaml, .yml or .json)")
    private Path snapshotPath;

    @Option(
        names = {"-c", "--config"},
        description = "Engine configuration file (default: depintel.yaml)"
    )
    private Path configPath = Paths.get("depintel.yaml");

    @Option(
        names = {"-s", "--min-severity"},
        description = "Lowest severity to print: ${COMPLETION-CANDIDATES} (default: LOW)"
    )
    private Severity minSeverity = Severity.LOW;

    @Option(
        names = {"-o", "--output"},
        description = "Write the recommendations to this JSON file"
    )
    private Path outputFile;

    @Option(
        names = {"--set"},
        description = "Job option as key=value, repeatable"
    )
    private Map<String, String> options = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try (EngineSession session = EngineSession.open(snapshotPath, configPath)) {
            Map<AnalysisType, AnalysisJob> jobs = session.run(Arrays.asList(AnalysisType.values()),
                new LinkedHashMap<>(options));
            jobs.values().stream()
                .filter(job -> job.status() != JobStatus.COMPLETED)
                .forEach(job -> System.out.println("! " + job.type().id() + " skipped: " + job.errorMessage()));

            List<Recommendation> recommendations = session.recommendations().stream()
                .filter(recommendation -> recommendation.severity().rank() >= minSeverity.rank())
                .toList();

            System.out.println("Recommendations for " + session.projectId() + " (" + recommendations.size() + "):");
            System.out.println();
            for (Recommendation recommendation : recommendations) {
                System.out.printf("  [%s] %s%n", recommendation.severity(), recommendation.title());
                System.out.printf("    %s%n", recommendation.description());
                if (recommendation.versionTransition() != null) {
                    System.out.printf("    %s -> %s%n", recommendation.versionTransition().from(),
                        recommendation.versionTransition().to());
                }
            }

            if (outputFile != null) {
                Path parent = outputFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(outputFile, JsonDocuments.toJson(recommendations), StandardCharsets.UTF_8);
                System.out.println();
                System.out.println("✓ Recommendations written to: " + outputFile.toAbsolutePath());
            }
            return 0;
        } catch (DependencyIntelligenceException e) {
            log.error("Recommendation run rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Recommendation run failed", e);
            System.err.println("✗ Recommendation run failed: " + e.getMessage());
            return 1;
        }
    }
}
