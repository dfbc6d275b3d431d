package com.depintel.core.exception;

/**
 * Thrown when a job status change is not an edge of the job lifecycle.
 */
public class IllegalJobTransitionException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    public IllegalJobTransitionException(String message) {
        super(message, "INVALID_JOB_TRANSITION");
    }
}
