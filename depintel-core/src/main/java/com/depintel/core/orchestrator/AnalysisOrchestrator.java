package com.depintel.core.orchestrator;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.Analyzer;
import com.depintel.core.analyzer.AnalyzerRegistry;
import com.depintel.core.config.EngineConfig;
import com.depintel.core.exception.AnalysisTimeoutException;
import com.depintel.core.exception.ConcurrencyLimitExceededException;
import com.depintel.core.exception.JobNotFoundException;
import com.depintel.core.graph.DependencyGraphBuilder;
import com.depintel.core.metadata.MetadataProvider;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyGraph;
import com.depintel.core.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the analysis job lifecycle.
 *
 * <p>Jobs are immutable {@link AnalysisJob} records swapped atomically inside a
 * {@link ConcurrentHashMap}; status and result queries read the current record and never
 * block. Each project has an explicit active-job counter updated by compare-and-set, so a
 * submission over the limit is rejected without creating a job.
 *
 * <p>A run (graph build plus analyzer) executes on the worker pool and is bounded by the
 * configured job timeout, measured from the moment the job starts running. When the timeout
 * expires the job fails and its worker is interrupted so the thread returns to the pool.
 * Timeouts, analyzer exceptions and honored cancellations all end in {@link JobStatus#FAILED}
 * with a readable message.
 *
 * <p>Job records and their completion futures are kept in memory for the lifetime of the
 * orchestrator.
 */
public final class AnalysisOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    static final String CANCELLED = "cancelled";

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final AnalyzerRegistry registry;
    private final MetadataProvider metadataProvider;
    private final ProjectDependencySource dependencySource;
    private final EngineConfig config;
    private final DependencyGraphBuilder graphBuilder;
    private final Clock clock;
    private final ExecutorService executor;
    private final ScheduledExecutorService watchdog;

    private final ConcurrentMap<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<AnalysisJob>> completions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Future<?>> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicInteger> activeJobs = new ConcurrentHashMap<>();

    public AnalysisOrchestrator(AnalyzerRegistry registry, MetadataProvider metadataProvider,
                                ProjectDependencySource dependencySource, EngineConfig config) {
        this(registry, metadataProvider, dependencySource, config, Clock.systemUTC());
    }

    public AnalysisOrchestrator(AnalyzerRegistry registry, MetadataProvider metadataProvider,
                                ProjectDependencySource dependencySource, EngineConfig config, Clock clock) {
        this(registry, metadataProvider, dependencySource, config, clock,
            DependencyGraphBuilder.fromConfig(Objects.requireNonNull(config, "config must not be null").graph()));
    }

    /**
     * Creates an orchestrator with an explicit graph builder.
     *
     * @param registry analyzer dispatch table
     * @param metadataProvider package metadata source
     * @param dependencySource declared dependencies per project
     * @param config engine configuration (limits, timeout, worker threads)
     * @param clock clock for job timestamps and time-based analyses
     * @param graphBuilder graph builder used for every run
     */
    public AnalysisOrchestrator(AnalyzerRegistry registry, MetadataProvider metadataProvider,
                                ProjectDependencySource dependencySource, EngineConfig config, Clock clock,
                                DependencyGraphBuilder graphBuilder) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.metadataProvider = Objects.requireNonNull(metadataProvider, "metadataProvider must not be null");
        this.dependencySource = Objects.requireNonNull(dependencySource, "dependencySource must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder must not be null");
        this.executor = Executors.newFixedThreadPool(config.engine().workerThreads(),
            daemonThreadFactory("depintel-worker-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("depintel-watchdog-"));
    }

    // ==================== Submission ====================

    /**
     * Submits an analysis by wire identifier ({@code license_compliance}, ...).
     *
     * @see #submit(String, AnalysisType, Map)
     */
    public String submit(String projectId, String typeId, Map<String, Object> configuration) {
        return submit(projectId, registry.require(typeId).getType(), configuration);
    }

    /**
     * Validates and enqueues an analysis job.
     *
     * @param projectId project to analyze
     * @param type analysis type
     * @param configuration job configuration, may be {@code null}
     * @return job id
     * @throws com.depintel.core.exception.InvalidConfigurationException when no analyzer handles the
     *         type or the configuration is malformed
     * @throws ConcurrencyLimitExceededException when the project already has the maximum number
     *         of active jobs
     */
    public String submit(String projectId, AnalysisType type, Map<String, Object> configuration) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Map<String, Object> jobConfig = configuration == null ? Map.of() : configuration;

        Analyzer analyzer = registry.require(type);
        analyzer.validateConfiguration(jobConfig);
        acquireSlot(projectId);

        String jobId = UUID.randomUUID().toString();
        AnalysisJob job = AnalysisJob.pending(jobId, projectId, type, jobConfig, clock.instant());
        jobs.put(jobId, job);
        completions.put(jobId, new CompletableFuture<>());
        log.info("Submitted {} job {} for project {}", type.id(), jobId, projectId);

        FutureTask<Void> run = new FutureTask<>(() -> runJob(jobId, analyzer), null);
        runs.put(jobId, run);
        try {
            executor.execute(run);
        } catch (RejectedExecutionException e) {
            jobs.remove(jobId);
            completions.remove(jobId);
            runs.remove(jobId);
            releaseSlot(projectId);
            throw new IllegalStateException("Orchestrator is shut down; job " + jobId + " was not started", e);
        }
        return jobId;
    }

    // ==================== Queries ====================

    /**
     * @throws JobNotFoundException for unknown ids
     */
    public AnalysisJob getStatus(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Returns the result of a job without blocking.
     *
     * @param jobId job id
     * @return {@code READY} with the document, {@code NOT_READY} while pending or running,
     *         {@code FAILED} with the error message
     * @throws JobNotFoundException for unknown ids
     */
    public JobResult getResult(String jobId) {
        AnalysisJob job = getStatus(jobId);
        return switch (job.status()) {
            case COMPLETED -> JobResult.ready(job.result());
            case FAILED -> JobResult.failed(job.errorMessage());
            case PENDING, RUNNING -> JobResult.notReady(job.status().name());
        };
    }

    /**
     * Returns a future completed with the terminal job record.
     *
     * @throws JobNotFoundException for unknown ids
     */
    public CompletableFuture<AnalysisJob> whenFinished(String jobId) {
        CompletableFuture<AnalysisJob> completion = completions.get(jobId);
        if (completion == null) {
            throw new JobNotFoundException(jobId);
        }
        return completion.copy();
    }

    /**
     * @return jobs of a project, oldest first
     */
    public List<AnalysisJob> jobsFor(String projectId) {
        return jobs.values().stream()
            .filter(job -> job.projectId().equals(projectId))
            .sorted(Comparator.comparing(AnalysisJob::createdAt).thenComparing(AnalysisJob::id))
            .toList();
    }

    /**
     * @return number of pending or running jobs of a project
     */
    public int activeJobCount(String projectId) {
        AtomicInteger counter = activeJobs.get(projectId);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Returns the most recently completed result of each analysis type for a project.
     *
     * @param projectId project id
     * @return results in {@link AnalysisType} order, empty when nothing has completed
     */
    public Map<AnalysisType, AnalysisResult> latestCompletedResults(String projectId) {
        Map<AnalysisType, AnalysisJob> latest = new EnumMap<>(AnalysisType.class);
        for (AnalysisJob job : jobs.values()) {
            if (!job.projectId().equals(projectId) || job.status() != JobStatus.COMPLETED) {
                continue;
            }
            latest.merge(job.type(), job, (a, b) -> isLater(b, a) ? b : a);
        }
        Map<AnalysisType, AnalysisResult> results = new EnumMap<>(AnalysisType.class);
        latest.forEach((type, job) -> results.put(type, job.result()));
        return results;
    }

    // ==================== Cancellation ====================

    /**
     * Requests cancellation. The run is not interrupted; its result is discarded and the job
     * fails with reason {@value #CANCELLED}.
     *
     * @param jobId job id
     * @return true when the request was recorded, false when the job had already finished
     * @throws JobNotFoundException for unknown ids
     */
    public boolean cancel(String jobId) {
        AnalysisJob updated = jobs.computeIfPresent(jobId, (id, job) -> job.requestCancel());
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        if (updated.status().isTerminal()) {
            return false;
        }
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    // ==================== Execution ====================

    private void runJob(String jobId, Analyzer analyzer) {
        AnalysisJob job = jobs.computeIfPresent(jobId, (id, current) ->
            current.status() == JobStatus.PENDING && !current.cancelRequested()
                ? current.start(clock.instant())
                : current);
        if (job == null || job.status() != JobStatus.RUNNING) {
            runs.remove(jobId);
            finish(jobId, null, null);
            return;
        }
        Duration timeout = config.engine().jobTimeout();
        ScheduledFuture<?> deadline = watchdog.schedule(() -> expire(jobId), timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            finish(jobId, execute(job, analyzer), null);
        } catch (RuntimeException e) {
            finish(jobId, null, e);
        } finally {
            deadline.cancel(false);
            runs.remove(jobId);
            // Terminal already unless the run ended with an Error
            finish(jobId, null, null);
        }
    }

    private AnalysisResult execute(AnalysisJob job, Analyzer analyzer) {
        log.debug("Running job {} ({}) on {}", job.id(), job.type().id(), Thread.currentThread().getName());
        DependencyGraph graph = graphBuilder.build(dependencySource.declaredDependencies(job.projectId()),
            metadataProvider);
        AnalysisContext context = new AnalysisContext(job.projectId(), graph, metadataProvider,
            job.configuration(), config, clock);
        return analyzer.analyze(context);
    }

    private void expire(String jobId) {
        finish(jobId, null, new TimeoutException());
        Future<?> run = runs.remove(jobId);
        if (run != null) {
            run.cancel(true);
        }
    }

    private void finish(String jobId, AnalysisResult result, Throwable error) {
        Instant now = clock.instant();
        AtomicBoolean terminated = new AtomicBoolean();
        AnalysisJob finished = jobs.computeIfPresent(jobId, (id, job) -> {
            if (job.status().isTerminal()) {
                return job;
            }
            terminated.set(true);
            if (job.cancelRequested()) {
                return job.fail(CANCELLED, now);
            }
            if (error != null) {
                return job.fail(describeFailure(jobId, error), now);
            }
            if (result == null) {
                return job.fail("Analyzer produced no result", now);
            }
            return job.complete(result, now);
        });
        if (finished == null || !terminated.get()) {
            return;
        }
        releaseSlot(finished.projectId());
        if (finished.status() == JobStatus.COMPLETED) {
            log.info("Job {} ({}) completed for project {}", jobId, finished.type().id(), finished.projectId());
        } else if (error != null) {
            log.error("Job {} ({}) failed for project {}: {}", jobId, finished.type().id(), finished.projectId(),
                finished.errorMessage(), unwrap(error));
        } else {
            log.warn("Job {} ({}) failed for project {}: {}", jobId, finished.type().id(), finished.projectId(),
                finished.errorMessage());
        }
        CompletableFuture<AnalysisJob> completion = completions.get(jobId);
        if (completion != null) {
            completion.complete(finished);
        }
    }

    private String describeFailure(String jobId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return new AnalysisTimeoutException(jobId, config.engine().jobTimeout()).getMessage();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank()
            ? cause.getClass().getSimpleName()
            : message;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isLater(AnalysisJob candidate, AnalysisJob current) {
        int byCompletion = candidate.completedAt().compareTo(current.completedAt());
        return byCompletion != 0 ? byCompletion > 0 : candidate.createdAt().isAfter(current.createdAt());
    }

    // ==================== Concurrency Limit ====================

    private void acquireSlot(String projectId) {
        int limit = config.engine().maxConcurrentJobsPerProject();
        AtomicInteger counter = activeJobs.computeIfAbsent(projectId, id -> new AtomicInteger());
        while (true) {
            int active = counter.get();
            if (active >= limit) {
                log.warn("Rejected submission for project {}: {} jobs already active", projectId, active);
                throw new ConcurrencyLimitExceededException(projectId, limit);
            }
            if (counter.compareAndSet(active, active + 1)) {
                return;
            }
        }
    }

    private void releaseSlot(String projectId) {
        AtomicInteger counter = activeJobs.get(projectId);
        if (counter != null) {
            counter.decrementAndGet();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Stops accepting work and waits briefly for running jobs.
     */
    @Override
    public void close() {
        watchdog.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Analysis workers did not stop within {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
