package com.depintel.core.exception;

/**
 * Thrown when a project already runs the maximum number of active jobs.
 */
public class ConcurrencyLimitExceededException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    private final String projectId;
    private final int limit;

    public ConcurrencyLimitExceededException(String projectId, int limit) {
        super("Project " + projectId + " already has " + limit + " active analysis jobs",
            "CONCURRENCY_LIMIT_EXCEEDED");
        this.projectId = projectId;
        this.limit = limit;
    }

    public String getProjectId() {
        return projectId;
    }

    public int getLimit() {
        return limit;
    }
}
