package com.depintel.core.exception;

import java.time.Duration;

/**
 * Thrown when an analysis run exceeds its time budget.
 */
public class AnalysisTimeoutException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    public AnalysisTimeoutException(String jobId, Duration timeout) {
        super("Analysis job " + jobId + " exceeded its timeout of " + timeout.toSeconds() + "s",
            "ANALYSIS_TIMEOUT");
    }
}
