package com.depintel.core.orchestrator;

import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.JobStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one analysis job.
 *
 * <p>Every status change produces a new record through {@link JobStateMachine}, so a
 * reader never observes a completed job without a result or a failed job without an
 * error message.
 *
 * @param id job identifier
 * @param projectId project the job analyzes
 * @param type analysis type
 * @param status lifecycle status
 * @param configuration job configuration (read-only)
 * @param createdAt submission time
 * @param startedAt dispatch time, {@code null} until running
 * @param completedAt time the job reached a terminal status
 * @param result result document, only for {@link JobStatus#COMPLETED}
 * @param errorMessage human-readable failure reason, only for {@link JobStatus#FAILED}
 * @param cancelRequested whether a caller asked for cancellation
 */
public record AnalysisJob(
    String id,
    String projectId,
    AnalysisType type,
    JobStatus status,
    Map<String, Object> configuration,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    AnalysisResult result,
    String errorMessage,
    boolean cancelRequested
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisJob {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        configuration = configuration == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        if (status == JobStatus.COMPLETED && result == null) {
            throw new IllegalArgumentException("A completed job must carry a result");
        }
        if (status == JobStatus.FAILED && (errorMessage == null || result != null)) {
            throw new IllegalArgumentException("A failed job must carry an error message and no result");
        }
    }

    /**
     * Creates a freshly submitted job.
     */
    public static AnalysisJob pending(String id, String projectId, AnalysisType type,
                                      Map<String, Object> configuration, Instant now) {
        return new AnalysisJob(id, projectId, type, JobStatus.PENDING, configuration, now,
            null, null, null, null, false);
    }

    public AnalysisJob start(Instant now) {
        return new AnalysisJob(id, projectId, type, JobStateMachine.transition(status, JobStatus.RUNNING),
            configuration, createdAt, now, null, null, null, cancelRequested);
    }

    public AnalysisJob complete(AnalysisResult analysisResult, Instant now) {
        return new AnalysisJob(id, projectId, type, JobStateMachine.transition(status, JobStatus.COMPLETED),
            configuration, createdAt, startedAt, now, analysisResult, null, cancelRequested);
    }

    public AnalysisJob fail(String message, Instant now) {
        return new AnalysisJob(id, projectId, type, JobStateMachine.transition(status, JobStatus.FAILED),
            configuration, createdAt, startedAt, now, null, message, cancelRequested);
    }

    /**
     * Marks the job as cancel-requested. Terminal jobs are returned unchanged.
     */
    public AnalysisJob requestCancel() {
        if (status.isTerminal() || cancelRequested) {
            return this;
        }
        return new AnalysisJob(id, projectId, type, status, configuration, createdAt, startedAt,
            completedAt, result, errorMessage, true);
    }
}
