package com.depintel.core.model;

/**
 * Lifecycle status of an analysis job.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /**
     * @return true for statuses a job never leaves
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
