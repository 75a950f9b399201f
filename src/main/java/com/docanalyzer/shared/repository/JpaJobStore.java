package com.docanalyzer.shared.repository;

import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JobStore backed by the analysis_jobs table.
 * Each transition runs in its own short transaction so that status reads from the
 * gateway observe PROCESSING while a long analysis is still running.
 */
@Service
public class JpaJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaJobStore.class);

    private final AnalysisJobRepository analysisJobRepository;

    public JpaJobStore(AnalysisJobRepository analysisJobRepository) {
        this.analysisJobRepository = analysisJobRepository;
    }

    @Override
    @Transactional
    public AnalysisJob create(AnalysisJob job) {
        if (job.getStatus() != JobStatus.PENDING) {
            throw new IllegalArgumentException("New jobs must start PENDING, got " + job.getStatus());
        }
        if (analysisJobRepository.existsById(job.getId())) {
            throw new IllegalStateException("Job id already in use: " + job.getId());
        }
        return analysisJobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisJob> findById(UUID jobId) {
        return analysisJobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public boolean markProcessing(UUID jobId) {
        int updated = analysisJobRepository.startIfInStatus(
                jobId, JobStatus.PENDING, JobStatus.PROCESSING, Instant.now());
        if (updated == 0) {
            logger.debug("Could not claim job {} (not PENDING)", jobId);
            return false;
        }
        logger.debug("Claimed job {}", jobId);
        return true;
    }

    @Override
    @Transactional
    public boolean markCompleted(UUID jobId, String resultText) {
        return finish(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, resultText, null);
    }

    @Override
    @Transactional
    public boolean markFailed(UUID jobId, String errorMessage) {
        return finish(jobId, JobStatus.PROCESSING, JobStatus.FAILED, null, errorMessage);
    }

    @Override
    @Transactional
    public boolean markEnqueueFailed(UUID jobId, String errorMessage) {
        return finish(jobId, JobStatus.PENDING, JobStatus.FAILED, null, errorMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnalysisJob> findStuckProcessing(Instant cutoff) {
        return analysisJobRepository.findByStatusAndUpdatedAtBefore(JobStatus.PROCESSING, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnalysisJob> findStalePending(Instant cutoff) {
        return analysisJobRepository.findByStatusAndUpdatedAtBefore(JobStatus.PENDING, cutoff);
    }

    @Override
    @Transactional
    public boolean touchPending(UUID jobId) {
        return analysisJobRepository.touchIfInStatus(jobId, JobStatus.PENDING, Instant.now()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public long countPending() {
        return analysisJobRepository.countByStatus(JobStatus.PENDING);
    }

    private boolean finish(UUID jobId, JobStatus expected, JobStatus terminal,
                           String resultText, String errorMessage) {
        int updated = analysisJobRepository.finishIfInStatus(
                jobId, expected, terminal, resultText, errorMessage, Instant.now());
        if (updated == 0) {
            logger.warn("Job {} was not {} when recording {}, leaving it unchanged", jobId, expected, terminal);
            return false;
        }
        return true;
    }
}
