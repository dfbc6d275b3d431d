package com.depintel.cli;

import com.depintel.core.analyzer.AnalyzerRegistry;
import com.depintel.core.config.ConfigLoader;
import com.depintel.core.config.EngineConfig;
import com.depintel.core.metadata.InMemoryMetadataProvider;
import com.depintel.core.metadata.ProjectSnapshot;
import com.depintel.core.metadata.SnapshotLoader;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.Recommendation;
import com.depintel.core.orchestrator.AnalysisJob;
import com.depintel.core.orchestrator.AnalysisOrchestrator;
import com.depintel.core.recommendation.RecommendationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the engine for one CLI invocation: snapshot, configuration, installed analyzers
 * and an orchestrator over them.
 */
final class EngineSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineSession.class);

    private final ProjectSnapshot snapshot;
    private final AnalyzerRegistry registry;
    private final AnalysisOrchestrator orchestrator;

    private EngineSession(ProjectSnapshot snapshot, EngineConfig config) {
        this.snapshot = snapshot;
        this.registry = AnalyzerRegistry.loadInstalled();
        this.orchestrator = new AnalysisOrchestrator(registry, InMemoryMetadataProvider.fromSnapshot(snapshot),
            projectId -> snapshot.dependencies(), config);
    }

    static EngineSession open(Path snapshotPath, Path configPath) throws IOException {
        EngineConfig config = ConfigLoader.load(configPath);
        ProjectSnapshot snapshot = SnapshotLoader.load(snapshotPath);
        log.debug("Loaded snapshot {} with {} declared dependencies", snapshot.projectId(),
            snapshot.dependencies().size());
        return new EngineSession(snapshot, config);
    }

    String projectId() {
        return snapshot.projectId();
    }

    AnalyzerRegistry registry() {
        return registry;
    }

    /**
     * Runs analyses one after another and waits for each to finish.
     *
     * <p>Jobs run sequentially because a project may not exceed its active job limit.
     *
     * @param types analyses to run
     * @param configuration job configuration shared by every analysis
     * @return terminal job per type, in the given order
     */
    Map<AnalysisType, AnalysisJob> run(List<AnalysisType> types, Map<String, Object> configuration) {
        Map<AnalysisType, AnalysisJob> finished = new LinkedHashMap<>();
        for (AnalysisType type : types) {
            String jobId = orchestrator.submit(snapshot.projectId(), type, configuration);
            finished.put(type, orchestrator.whenFinished(jobId).join());
        }
        return finished;
    }

    List<Recommendation> recommendations() {
        return new RecommendationGenerator(registry, orchestrator).generate(snapshot.projectId());
    }

    @Override
    public void close() {
        orchestrator.close();
    }
}
