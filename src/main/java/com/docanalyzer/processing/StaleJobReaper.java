package com.docanalyzer.processing;

import com.docanalyzer.api.messaging.JobMessage;
import com.docanalyzer.api.messaging.JobQueue;
import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.TracingServiceInterface;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic recovery of jobs that no worker is going to finish:
 * <ul>
 *   <li>PROCESSING jobs left behind by a worker that died mid-analysis are failed and their files removed.</li>
 *   <li>PENDING jobs whose queue message was lost are handed to the queue again. If the queue
 *       refuses them they are failed and their files removed.</li>
 * </ul>
 */
@Service
public class StaleJobReaper {

    private static final Logger logger = LoggerFactory.getLogger(StaleJobReaper.class);

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final InputFileCleaner inputFileCleaner;
    private final TracingServiceInterface tracingService;
    private final Duration staleAfter;

    public StaleJobReaper(JobStore jobStore,
                          JobQueue jobQueue,
                          InputFileCleaner inputFileCleaner,
                          TracingServiceInterface tracingService,
                          AnalyzerProperties properties) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.inputFileCleaner = inputFileCleaner;
        this.tracingService = tracingService;
        this.staleAfter = Duration.ofMinutes(properties.job().staleAfterMinutes());
    }

    @Scheduled(fixedDelayString = "${analyzer.job.reaper-interval-ms:60000}",
            initialDelayString = "${analyzer.job.reaper-interval-ms:60000}")
    public void reapStaleJobs() {
        try {
            int reaped = tracingService.trace("job.reap", () -> reap(Instant.now()));
            if (reaped > 0) {
                logger.info("Marked {} stale PROCESSING job(s) as FAILED", reaped);
            }
        } catch (RuntimeException e) {
            logger.error("Error during job reaping", e);
        }
        try {
            int requeued = tracingService.trace("job.requeue", () -> requeueStalePending(Instant.now()));
            if (requeued > 0) {
                logger.info("Re-enqueued {} stale PENDING job(s)", requeued);
            }
        } catch (RuntimeException e) {
            logger.error("Error during stale pending job recovery", e);
        }
    }

    /**
     * @return number of jobs moved to FAILED
     */
    int reap(Instant now) {
        List<AnalysisJob> staleJobs = jobStore.findStuckProcessing(now.minus(staleAfter));
        int reaped = 0;
        for (AnalysisJob job : staleJobs) {
            String message = "Processing timed out: no result after " + staleAfter.toMinutes() + " minutes";
            if (jobStore.markFailed(job.getId(), message)) {
                logger.warn("Marked stale job {} as FAILED (processing since {})", job.getId(), job.getStartedAt());
                inputFileCleaner.deleteQuietly(job.getFilePath());
                reaped++;
            }
        }
        return reaped;
    }

    /**
     * @return number of jobs handed to the queue again
     */
    int requeueStalePending(Instant now) {
        List<AnalysisJob> staleJobs = jobStore.findStalePending(now.minus(staleAfter));
        int requeued = 0;
        for (AnalysisJob job : staleJobs) {
            // Claiming the retry by bumping updated_at keeps concurrent reapers from piling up messages.
            if (!jobStore.touchPending(job.getId())) {
                continue;
            }
            try {
                jobQueue.enqueue(new JobMessage(job.getId(), job.getFilePath(), job.getQuery(), job.getOriginalFilename()));
                logger.warn("Job {} was still PENDING since {}, re-enqueued", job.getId(), job.getUpdatedAt());
                requeued++;
            } catch (QueueUnavailableException e) {
                logger.error("Could not re-enqueue stale job {}: {}", job.getId(), e.getMessage());
                if (jobStore.markEnqueueFailed(job.getId(), "Failed to enqueue: " + e.getMessage())) {
                    inputFileCleaner.deleteQuietly(job.getFilePath());
                }
            }
        }
        return requeued;
    }
}
