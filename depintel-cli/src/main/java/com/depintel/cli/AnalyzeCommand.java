package com.depintel.cli;

import com.depintel.core.exception.DependencyIntelligenceException;
import com.depintel.core.exception.InvalidConfigurationException;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to run analyses over a project snapshot.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All six analyses
 * depintel analyze snapshot.yaml
 *
 * # Selected analyses with job options
 * depintel analyze snapshot.yaml -t compatibility_prediction,health_monitoring --set time_horizon=90
 *
 * # Write one JSON document per analysis
 * depintel analyze snapshot.yaml -o build/depintel
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Run dependency analyses over a project snapshot",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "Project snapshot (.yaml, .yml or .json)")
    private Path snapshotPath;

    @Option(
        names = {"-t", "--type"},
        split = ",",
        description = "Analysis types to run, comma separated (default: all)"
    )
    private List<String> types = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Engine configuration file (default: depintel.yaml)"
    )
    private Path configPath = Paths.get("depintel.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Directory receiving one <analysis_type>.json result per analysis"
    )
    private Path outputDir;

    @Option(
        names = {"--set"},
        description = "Job option as key=value, repeatable (e.g. target_license=Apache-2.0)"
    )
    private Map<String, String> options = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try {
            List<AnalysisType> selected = resolveTypes(types);
            try (EngineSession session = EngineSession.open(snapshotPath, configPath)) {
                System.out.println("Analyzing project: " + session.projectId());
                System.out.println();

                Map<AnalysisType, AnalysisJob> jobs = session.run(selected, new LinkedHashMap<>(options));
                boolean allCompleted = true;
                for (AnalysisJob job : jobs.values()) {
                    if (job.status() == JobStatus.COMPLETED) {
                        printResult(job.type(), job.result());
                        if (outputDir != null) {
                            writeResult(session.projectId(), job.type(), job.result());
                        }
                    } else {
                        allCompleted = false;
                        System.out.println("✗ " + job.type().id() + " failed: " + job.errorMessage());
                    }
                    System.out.println();
                }
                if (outputDir != null) {
                    System.out.println("✓ Results written to: " + outputDir.toAbsolutePath());
                }
                return allCompleted ? 0 : 1;
            }
        } catch (DependencyIntelligenceException e) {
            log.error("Analysis rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    static List<AnalysisType> resolveTypes(List<String> typeIds) {
        if (typeIds == null || typeIds.isEmpty()) {
            return Arrays.asList(AnalysisType.values());
        }
        List<AnalysisType> resolved = new ArrayList<>();
        for (String typeId : typeIds) {
            AnalysisType type = AnalysisType.fromId(typeId)
                .orElseThrow(() -> new InvalidConfigurationException("Unknown analysis type: " + typeId));
            if (!resolved.contains(type)) {
                resolved.add(type);
            }
        }
        return resolved;
    }

    private void printResult(AnalysisType type, AnalysisResult result) {
        System.out.println("✓ " + type.id());
        result.summary().forEach((key, value) -> System.out.printf("    %s: %s%n", key, value));
        for (String warning : result.warnings()) {
            System.out.println("    ! " + warning);
        }
    }

    private void writeResult(String projectId, AnalysisType type, AnalysisResult result) throws IOException {
        Files.createDirectories(outputDir);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("project_id", projectId);
        document.put("analysis_type", type.id());
        document.put("summary", result.summary());
        document.put("details", result.details());
        document.put("warnings", result.warnings());
        Path target = outputDir.resolve(type.id() + ".json");
        Files.writeString(target, JsonDocuments.toJson(document), StandardCharsets.UTF_8);
        log.debug("Wrote {}", target);
    }
}
