package com.depintel.core.exception;

/**
 * Thrown when a job id is not known to the orchestrator.
 */
public class JobNotFoundException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    public JobNotFoundException(String jobId) {
        super("Unknown analysis job: " + jobId, "JOB_NOT_FOUND");
    }
}
