package com.docanalyzer.shared.repository;

import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for AnalysisJob entities.
 * Status changes go through the conditional updates below so that each transition
 * is a single-row compare-and-set.
 */
@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {

    /**
     * Moves a job into {@code next} only while it is still in {@code expected}, stamping started_at.
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.status = :next, j.startedAt = :now, j.updatedAt = :now " +
           "WHERE j.id = :id AND j.status = :expected")
    int startIfInStatus(@Param("id") UUID id,
                        @Param("expected") JobStatus expected,
                        @Param("next") JobStatus next,
                        @Param("now") Instant now);

    /**
     * Moves a job into a terminal status only while it is still in {@code expected}.
     * Writes the result and error columns together so exactly one of them is set.
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.status = :terminal, j.resultText = :resultText, " +
           "j.errorMessage = :errorMessage, j.completedAt = :now, j.updatedAt = :now " +
           "WHERE j.id = :id AND j.status = :expected")
    int finishIfInStatus(@Param("id") UUID id,
                         @Param("expected") JobStatus expected,
                         @Param("terminal") JobStatus terminal,
                         @Param("resultText") String resultText,
                         @Param("errorMessage") String errorMessage,
                         @Param("now") Instant now);

    /**
     * Bumps updated_at while the job is still in {@code status}.
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.updatedAt = :now WHERE j.id = :id AND j.status = :status")
    int touchIfInStatus(@Param("id") UUID id,
                        @Param("status") JobStatus status,
                        @Param("now") Instant now);

    /**
     * Find jobs in the given status whose last transition happened before the cutoff.
     */
    List<AnalysisJob> findByStatusAndUpdatedAtBefore(JobStatus status, Instant cutoff);

    long countByStatus(JobStatus status);
}
