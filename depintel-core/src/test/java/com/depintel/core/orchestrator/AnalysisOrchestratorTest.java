package com.depintel.core.orchestrator;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.AnalyzerRegistry;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.analyzer.impl.LicenseComplianceChecker;
import com.depintel.core.config.EngineConfig;
import com.depintel.core.config.EngineConfig.EngineSettings;
import com.depintel.core.exception.ConcurrencyLimitExceededException;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.exception.JobNotFoundException;
import com.depintel.core.metadata.InMemoryMetadataProvider;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DeclaredDependency;
import com.depintel.core.model.JobStatus;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.Recommendation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final String PROJECT = "storefront";

    private GatedAnalyzer gated;
    private InMemoryMetadataProvider provider;
    private Map<String, List<DeclaredDependency>> manifests;
    private final List<AnalysisOrchestrator> orchestrators = new ArrayList<>();

    @BeforeEach
    void setUp() {
        gated = new GatedAnalyzer();
        provider = InMemoryMetadataProvider.builder()
            .add(PackageMetadata.basic("express", "npm", "4.19.2", List.of("MIT")), List.of())
            .add(PackageMetadata.basic("readline-sync", "npm", "1.4.10", List.of("GPL-3.0")), List.of())
            .build();
        manifests = Map.of(
            PROJECT, List.of(DeclaredDependency.of("express", "npm", "^4.18.0"),
                DeclaredDependency.of("readline-sync", "npm", "^1.4.0")),
            "checkout", List.of(DeclaredDependency.of("express", "npm", "^4.18.0")),
            "broken", List.of(DeclaredDependency.of("left-pad", "npm", "^1.3.0")));
    }

    @AfterEach
    void tearDown() {
        gated.release();
        orchestrators.forEach(AnalysisOrchestrator::close);
    }

    @Test
    void submit_runsJobToCompletion() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        String jobId = orchestrator.submit(PROJECT, "license_compliance", Map.of("target_license", "MIT"));
        AnalysisJob finished = orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS);

        assertThat(finished.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.startedAt()).isNotNull();
        assertThat(finished.completedAt()).isNotNull();

        JobResult result = orchestrator.getResult(jobId);
        assertThat(result.isReady()).isTrue();
        assertThat(result.result().type()).isEqualTo(AnalysisType.LICENSE_COMPLIANCE);
        assertThat(result.result().summaryValue("overall_risk_level")).isEqualTo("high");
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();
        assertThat(orchestrator.latestCompletedResults(PROJECT)).containsOnlyKeys(AnalysisType.LICENSE_COMPLIANCE);
    }

    @Test
    void getResult_whileRunning_isNotReady() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        String jobId = orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, null);
        gated.awaitStarted();

        JobResult result = orchestrator.getResult(jobId);
        assertThat(result.status()).isEqualTo(JobResult.Status.NOT_READY);
        assertThat(result.reason()).isEqualTo("RUNNING");
        assertThat(orchestrator.getStatus(jobId).status()).isEqualTo(JobStatus.RUNNING);

        gated.release();
        assertThat(orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void submit_overProjectLimit_isRejectedWithoutCreatingJob() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            jobIds.add(orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of()));
        }

        assertThatThrownBy(() -> orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of()))
            .isInstanceOf(ConcurrencyLimitExceededException.class)
            .hasMessageContaining(PROJECT);
        assertThat(orchestrator.jobsFor(PROJECT)).hasSize(5);
        assertThat(orchestrator.activeJobCount(PROJECT)).isEqualTo(5);

        // Other projects have their own budget
        String other = orchestrator.submit("checkout", AnalysisType.IMPACT_SCORING, Map.of());

        gated.release();
        for (String jobId : jobIds) {
            assertThat(orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS).status())
                .isEqualTo(JobStatus.COMPLETED);
        }
        orchestrator.whenFinished(other).get(5, TimeUnit.SECONDS);
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();
        assertThat(orchestrator.activeJobCount("checkout")).isZero();

        // Capacity is available again
        orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of());
    }

    @Test
    void submit_invalidConfiguration_isRejectedBeforeJobCreation() {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        assertThatThrownBy(() -> orchestrator.submit(PROJECT, "license_compliance", Map.of("target_license", "Nope")))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> orchestrator.submit(PROJECT, "astrology", Map.of()))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> orchestrator.submit(PROJECT, AnalysisType.HEALTH_MONITORING, Map.of()))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("No analyzer installed");

        assertThat(orchestrator.jobsFor(PROJECT)).isEmpty();
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();
    }

    @Test
    void run_exceedingTimeout_failsWithTimeoutMessage() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(new EngineConfig(new EngineSettings(5, 1L, 2),
            null, null, null, null, null, null, null));

        String jobId = orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of());
        AnalysisJob finished = orchestrator.whenFinished(jobId).get(10, TimeUnit.SECONDS);

        assertThat(finished.status()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.errorMessage()).isEqualTo("Analysis job " + jobId + " exceeded its timeout of 1s");
        assertThat(orchestrator.getResult(jobId).status()).isEqualTo(JobResult.Status.FAILED);
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();

        // A late result does not revive the job
        gated.release();
        assertThat(orchestrator.getStatus(jobId).status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void run_timedOutJob_freesWorkerForQueuedJob() throws Exception {
        // Given a single worker occupied by a run that never finishes on its own
        AnalysisOrchestrator orchestrator = orchestrator(new EngineConfig(new EngineSettings(5, 1L, 1),
            null, null, null, null, null, null, null));
        String hung = orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of());
        gated.awaitStarted();

        // When a fast job queues behind it
        String queued = orchestrator.submit("checkout", "license_compliance", Map.of("target_license", "MIT"));

        // Then only the hung run times out and the queued job gets the worker
        AnalysisJob timedOut = orchestrator.whenFinished(hung).get(10, TimeUnit.SECONDS);
        assertThat(timedOut.status()).isEqualTo(JobStatus.FAILED);
        assertThat(timedOut.errorMessage()).contains("exceeded its timeout of 1s");

        AnalysisJob finished = orchestrator.whenFinished(queued).get(10, TimeUnit.SECONDS);
        assertThat(finished.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(orchestrator.activeJobCount("checkout")).isZero();
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();
    }

    @Test
    void cancel_runningJob_discardsResultAndFails() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());
        String jobId = orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of());
        gated.awaitStarted();

        assertThat(orchestrator.cancel(jobId)).isTrue();
        gated.release();
        AnalysisJob finished = orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS);

        assertThat(finished.status()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.errorMessage()).isEqualTo("cancelled");
        assertThat(orchestrator.cancel(jobId)).isFalse();
        assertThat(orchestrator.activeJobCount(PROJECT)).isZero();
    }

    @Test
    void run_analyzerThrows_failsWithItsMessage() throws Exception {
        gated.failWith(new IllegalStateException("registry offline"));
        gated.release();
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        String jobId = orchestrator.submit(PROJECT, AnalysisType.IMPACT_SCORING, Map.of());
        AnalysisJob finished = orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS);

        assertThat(finished.status()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.errorMessage()).isEqualTo("registry offline");
        assertThat(orchestrator.getResult(jobId).reason()).isEqualTo("registry offline");
    }

    @Test
    void run_unresolvableDeclaredDependency_failsJob() throws Exception {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        String jobId = orchestrator.submit("broken", "license_compliance", Map.of());
        AnalysisJob finished = orchestrator.whenFinished(jobId).get(5, TimeUnit.SECONDS);

        assertThat(finished.status()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.errorMessage()).contains("npm:left-pad");
    }

    @Test
    void queries_unknownJob_throwJobNotFound() {
        AnalysisOrchestrator orchestrator = orchestrator(EngineConfig.defaults());

        assertThatThrownBy(() -> orchestrator.getStatus("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.getResult("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.cancel("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.whenFinished("missing")).isInstanceOf(JobNotFoundException.class);
    }

    private AnalysisOrchestrator orchestrator(EngineConfig config) {
        AnalyzerRegistry registry = new AnalyzerRegistry(List.of(gated, new LicenseComplianceChecker()));
        AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(registry, provider,
            projectId -> manifests.getOrDefault(projectId, List.of()), config, CLOCK);
        orchestrators.add(orchestrator);
        return orchestrator;
    }

    /**
     * Impact-scoring stand-in that blocks until released, so tests control when runs finish.
     */
    private static final class GatedAnalyzer extends AbstractAnalyzer {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch gate = new CountDownLatch(1);
        private volatile RuntimeException failure;

        @Override
        public String getId() {
            return "gated";
        }

        @Override
        public String getDisplayName() {
            return "Gated";
        }

        @Override
        public AnalysisType getType() {
            return AnalysisType.IMPACT_SCORING;
        }

        @Override
        protected AnalysisResult doAnalyze(AnalysisContext context) {
            started.countDown();
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            if (failure != null) {
                throw failure;
            }
            return buildResult(Map.of("nodes", context.graph().size()), Map.of(), List.of());
        }

        @Override
        public List<Recommendation> recommend(AnalysisResult result) {
            return List.of();
        }

        void release() {
            gate.countDown();
        }

        void failWith(RuntimeException exception) {
            this.failure = exception;
        }

        void awaitStarted() throws InterruptedException {
            assertThat(started.await(5, TimeUnit.SECONDS)).as("analyzer started").isTrue();
        }
    }
}
