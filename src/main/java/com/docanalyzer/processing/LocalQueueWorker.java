package com.docanalyzer.processing;

import com.docanalyzer.api.messaging.JobMessage;
import com.docanalyzer.api.messaging.PollableJobQueue;
import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.repository.JobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Consumes the in-process job queue with a fixed pool of worker threads.
 * Only loads when analyzer.queue.mode=local (or when property is missing, as it's the default).
 *
 * <p>The in-process queue does not survive a restart, so PENDING jobs found in the store at
 * startup are enqueued again.
 */
@Service
@ConditionalOnProperty(name = "analyzer.queue.mode", havingValue = "local", matchIfMissing = true)
public class LocalQueueWorker {

    private static final Logger logger = LoggerFactory.getLogger(LocalQueueWorker.class);

    private final PollableJobQueue jobQueue;
    private final JobOrchestrator jobOrchestrator;
    private final JobStore jobStore;
    private final int workerThreads;
    private final Duration pollTimeout;

    private ExecutorService workers;
    private volatile boolean running;

    public LocalQueueWorker(PollableJobQueue jobQueue,
                            JobOrchestrator jobOrchestrator,
                            JobStore jobStore,
                            AnalyzerProperties properties) {
        this.jobQueue = jobQueue;
        this.jobOrchestrator = jobOrchestrator;
        this.jobStore = jobStore;
        this.workerThreads = properties.queue().workerThreads();
        this.pollTimeout = Duration.ofMillis(properties.queue().pollTimeoutMs());
    }

    @PostConstruct
    public void start() {
        running = true;
        workers = Executors.newFixedThreadPool(workerThreads, new CustomizableThreadFactory("local-worker-"));
        for (int i = 0; i < workerThreads; i++) {
            workers.submit(this::consume);
        }
        logger.info("Local queue worker started with {} thread(s)", workerThreads);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recoverPendingJobs();
    }

    /**
     * @return number of PENDING jobs put back on the queue
     */
    int recoverPendingJobs() {
        List<AnalysisJob> pending;
        try {
            pending = jobStore.findStalePending(Instant.now());
        } catch (RuntimeException e) {
            logger.error("Could not load PENDING jobs at startup, leaving them to the stale job reaper", e);
            return 0;
        }
        int recovered = 0;
        for (AnalysisJob job : pending) {
            try {
                jobQueue.enqueue(new JobMessage(job.getId(), job.getFilePath(), job.getQuery(), job.getOriginalFilename()));
                recovered++;
            } catch (QueueUnavailableException e) {
                logger.warn("Queue refused recovered job {} ({}), leaving the rest to the stale job reaper",
                        job.getId(), e.getMessage());
                break;
            }
        }
        if (recovered > 0) {
            logger.info("Re-enqueued {} PENDING job(s) left from a previous run", recovered);
        }
        return recovered;
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Local queue worker threads did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Local queue worker stopped");
    }

    private void consume() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Optional<JobMessage> message;
            try {
                message = jobQueue.dequeue(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            message.ifPresent(this::handle);
        }
    }

    void handle(JobMessage message) {
        try {
            ProcessOutcome outcome = jobOrchestrator.process(message.jobId());
            logger.debug("Job {} delivery finished with outcome {}", message.jobId(), outcome);
        } catch (RuntimeException e) {
            // The in-process queue cannot redeliver; the stale job reaper enqueues or fails the job later.
            logger.error("Error processing job: {}", message.jobId(), e);
        }
    }
}
