package com.docanalyzer.shared.repository;

import com.docanalyzer.shared.model.AnalysisJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of analysis jobs. Single source of truth for job state.
 * Every {@code mark*} method is a compare-and-set on the current status and returns
 * {@code false} when the job was not in the expected state (or does not exist).
 */
public interface JobStore {

    /**
     * Persists a newly submitted job in PENDING state.
     */
    AnalysisJob create(AnalysisJob job);

    Optional<AnalysisJob> findById(UUID jobId);

    /**
     * PENDING to PROCESSING. Only one caller can win this transition for a given job.
     */
    boolean markProcessing(UUID jobId);

    /**
     * PROCESSING to COMPLETED, storing the report and clearing any error.
     */
    boolean markCompleted(UUID jobId, String resultText);

    /**
     * PROCESSING to FAILED, storing the error description.
     */
    boolean markFailed(UUID jobId, String errorMessage);

    /**
     * PENDING to FAILED, used when a job could not be handed to the queue at all.
     */
    boolean markEnqueueFailed(UUID jobId, String errorMessage);

    /**
     * Jobs still PROCESSING whose last transition is older than the cutoff.
     */
    List<AnalysisJob> findStuckProcessing(Instant cutoff);

    /**
     * Jobs still PENDING that were created or last touched before the cutoff.
     * A queue message may have been lost for these.
     */
    List<AnalysisJob> findStalePending(Instant cutoff);

    /**
     * Refreshes updated_at of a job that is still PENDING, before it is handed to the queue again.
     */
    boolean touchPending(UUID jobId);

    long countPending();
}
