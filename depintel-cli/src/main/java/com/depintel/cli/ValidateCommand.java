package com.depintel.cli;

import com.depintel.core.config.ConfigLoader;
import com.depintel.core.config.EngineConfig;
import com.depintel.core.exception.DependencyIntelligenceException;
import com.depintel.core.graph.DependencyGraphBuilder;
import com.depintel.core.metadata.InMemoryMetadataProvider;
import com.depintel.core.metadata.ProjectSnapshot;
import com.depintel.core.metadata.SnapshotLoader;
import com.depintel.core.model.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to check that a snapshot resolves into a dependency graph.
 *
 * <p>The graph is built strictly: every direct dependency must have registry metadata.
 */
@Command(
    name = "validate",
    description = "Validate a project snapshot and build its dependency graph",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Project snapshot (.yaml, .yml or .json)")
    private Path snapshotPath;

    @Option(
        names = {"-c", "--config"},
        description = "Engine configuration file (default: depintel.yaml)"
    )
    private Path configPath = Paths.get("depintel.yaml");

    @Override
    public Integer call() {
        log.info("Validating snapshot: {}", snapshotPath);
        try {
            EngineConfig config = ConfigLoader.load(configPath);
            ProjectSnapshot snapshot = SnapshotLoader.load(snapshotPath);
            DependencyGraph graph = DependencyGraphBuilder.fromConfig(config.graph())
                .withPartialMetadata(false)
                .build(snapshot.dependencies(), InMemoryMetadataProvider.fromSnapshot(snapshot));

            System.out.println("✓ Snapshot is valid: " + snapshot.projectId());
            System.out.printf("    Direct dependencies: %d%n", graph.directDependencies().size());
            System.out.printf("    Transitive dependencies: %d%n", graph.transitiveDependencies().size());
            System.out.printf("    Edges: %d%n", graph.edgeCount());
            System.out.printf("    Ecosystems: %s%n", graph.ecosystemCounts());
            if (!graph.discardedEdges().isEmpty()) {
                System.out.printf("    Discarded cyclic edges: %d%n", graph.discardedEdges().size());
            }
            return 0;
        } catch (DependencyIntelligenceException e) {
            log.error("Validation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Cannot read snapshot", e);
            System.err.println("✗ Cannot read snapshot: " + e.getMessage());
            return 1;
        }
    }
}
