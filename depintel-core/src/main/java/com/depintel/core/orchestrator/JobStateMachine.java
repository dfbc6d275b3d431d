package com.depintel.core.orchestrator;

import com.depintel.core.exception.IllegalJobTransitionException;
import com.depintel.core.model.JobStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid analysis job status transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   PENDING → RUNNING, FAILED
 *   RUNNING → COMPLETED, FAILED
 * </pre>
 *
 * <p>{@code PENDING → FAILED} covers jobs cancelled or timed out before a worker picked
 * them up. {@code COMPLETED} and {@code FAILED} are terminal.</p>
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(JobStatus.class);
        TRANSITIONS.put(JobStatus.PENDING,   EnumSet.of(JobStatus.RUNNING, JobStatus.FAILED));
        TRANSITIONS.put(JobStatus.RUNNING,   EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED));
        TRANSITIONS.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(JobStatus.FAILED,    EnumSet.noneOf(JobStatus.class));
    }

    private JobStateMachine() {
        // Utility class
    }

    /**
     * Validates a status transition and returns the target status if it is permitted.
     *
     * @param from the current job status
     * @param to the desired target status
     * @return {@code to} when the transition is valid
     * @throws IllegalJobTransitionException when the transition is not an edge of the lifecycle
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static JobStatus transition(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        Set<JobStatus> allowed = TRANSITIONS.getOrDefault(from, EnumSet.noneOf(JobStatus.class));
        if (!allowed.contains(to)) {
            throw new IllegalJobTransitionException("Invalid job transition: " + from + " -> " + to);
        }
        return to;
    }

    /**
     * @return true when {@code from → to} is an edge of the lifecycle
     */
    public static boolean canTransition(JobStatus from, JobStatus to) {
        return from != null && to != null && TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }
}
