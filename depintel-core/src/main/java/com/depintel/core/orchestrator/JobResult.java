package com.depintel.core.orchestrator;

import com.depintel.core.model.AnalysisResult;

import java.util.Objects;

/**
 * Outcome of a result query: the document when ready, otherwise why not.
 *
 * @param status outcome kind
 * @param result result document, only when {@link Status#READY}
 * @param reason failure reason for {@link Status#FAILED}, current job status for {@link Status#NOT_READY}
 */
public record JobResult(Status status, AnalysisResult result, String reason) {

    public enum Status {
        READY,
        NOT_READY,
        FAILED
    }

    /**
     * Compact constructor with validation.
     */
    public JobResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.READY) {
            Objects.requireNonNull(result, "result must not be null when ready");
        }
    }

    public static JobResult ready(AnalysisResult result) {
        return new JobResult(Status.READY, result, null);
    }

    public static JobResult notReady(String currentStatus) {
        return new JobResult(Status.NOT_READY, null, currentStatus);
    }

    public static JobResult failed(String reason) {
        return new JobResult(Status.FAILED, null, reason);
    }

    public boolean isReady() {
        return status == Status.READY;
    }
}
