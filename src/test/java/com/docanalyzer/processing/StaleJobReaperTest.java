package com.docanalyzer.processing;

import com.docanalyzer.api.messaging.InMemoryJobQueue;
import com.docanalyzer.api.messaging.JobMessage;
import com.docanalyzer.api.messaging.JobQueue;
import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.api.storage.LocalStorageService;
import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.JobMetrics;
import com.docanalyzer.observability.TracingServiceStub;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.model.JobStatus;
import com.docanalyzer.support.InMemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * Tests for the reaper that fails jobs stuck in PROCESSING and recovers PENDING jobs
 * whose queue message was lost.
 */
class StaleJobReaperTest {

    @TempDir
    Path uploadDir;

    private InMemoryJobStore jobStore;
    private LocalStorageService storageService;
    private InMemoryJobQueue queue;
    private InputFileCleaner cleaner;
    private AnalyzerProperties properties;
    private StaleJobReaper reaper;

    @BeforeEach
    void setUp() {
        properties = new AnalyzerProperties(null, null,
                new AnalyzerProperties.Storage(uploadDir.toString()), null, null, null,
                new AnalyzerProperties.Job(300, 30));
        jobStore = new InMemoryJobStore();
        storageService = new LocalStorageService(properties);
        queue = new InMemoryJobQueue(10);
        cleaner = new InputFileCleaner(storageService, new JobMetrics(new SimpleMeterRegistry(), jobStore));
        reaper = new StaleJobReaper(jobStore, queue, cleaner, new TracingServiceStub(), properties);
    }

    @Test
    void testStaleProcessingJobIsFailedAndFileRemoved() throws IOException {
        // Given: A job that has been PROCESSING for an hour
        AnalysisJob job = job(JobStatus.PROCESSING, Instant.now().minus(Duration.ofHours(1)));

        // When: Reaper runs
        int reaped = reaper.reap(Instant.now());

        // Then: Job is FAILED and its file is gone
        assertThat(reaped).isEqualTo(1);
        AnalysisJob updated = jobStore.findById(job.getId()).orElseThrow();
        assertThat(updated.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(updated.getErrorMessage()).startsWith("Processing timed out");
        assertThat(Paths.get(job.getFilePath())).doesNotExist();
    }

    @Test
    void testRecentProcessingJobIsLeftRunning() throws IOException {
        AnalysisJob job = job(JobStatus.PROCESSING, Instant.now().minus(Duration.ofMinutes(5)));

        int reaped = reaper.reap(Instant.now());

        assertThat(reaped).isZero();
        assertThat(jobStore.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(Paths.get(job.getFilePath())).exists();
    }

    @Test
    void testTerminalJobsAreNeverTouched() throws IOException {
        AnalysisJob completed = job(JobStatus.COMPLETED, Instant.now().minus(Duration.ofDays(1)));
        completed.setResultText("done");

        reaper.reapStaleJobs();

        AnalysisJob stored = jobStore.findById(completed.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.getResultText()).isEqualTo("done");
        assertThat(queue.size()).isZero();
    }

    @Test
    void testStalePendingJobIsEnqueuedAgain() throws Exception {
        // Given: A PENDING job whose queue message was lost a week ago
        AnalysisJob job = job(JobStatus.PENDING, Instant.now().minus(Duration.ofDays(7)));

        // When: Reaper runs
        int requeued = reaper.requeueStalePending(Instant.now());

        // Then: The job is back on the queue with its file intact, and not picked again right away
        assertThat(requeued).isEqualTo(1);
        Optional<JobMessage> message = queue.dequeue(Duration.ofMillis(100));
        assertThat(message).isPresent();
        assertThat(message.get().jobId()).isEqualTo(job.getId());
        assertThat(message.get().filePath()).isEqualTo(job.getFilePath());
        assertThat(jobStore.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(Paths.get(job.getFilePath())).exists();
        assertThat(reaper.requeueStalePending(Instant.now())).isZero();
    }

    @Test
    void testRecentPendingJobIsLeftOnQueue() throws IOException {
        AnalysisJob job = job(JobStatus.PENDING, Instant.now().minus(Duration.ofMinutes(1)));

        int requeued = reaper.requeueStalePending(Instant.now());

        assertThat(requeued).isZero();
        assertThat(queue.size()).isZero();
        assertThat(jobStore.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void testStalePendingJobIsFailedWhenQueueRefusesIt() throws IOException {
        // Given: A lost PENDING job and a queue that is down
        JobQueue unavailableQueue = mock(JobQueue.class);
        doThrow(new QueueUnavailableException("Job queue is full")).when(unavailableQueue).enqueue(any(JobMessage.class));
        StaleJobReaper failingReaper = new StaleJobReaper(jobStore, unavailableQueue, cleaner, new TracingServiceStub(), properties);
        AnalysisJob job = job(JobStatus.PENDING, Instant.now().minus(Duration.ofDays(7)));

        // When
        int requeued = failingReaper.requeueStalePending(Instant.now());

        // Then: The job ends FAILED and its upload is gone
        assertThat(requeued).isZero();
        AnalysisJob stored = jobStore.findById(job.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("Failed to enqueue: Job queue is full");
        assertThat(Paths.get(job.getFilePath())).doesNotExist();
    }

    private AnalysisJob job(JobStatus status, Instant updatedAt) throws IOException {
        UUID jobId = UUID.randomUUID();
        String path = storageService.storeUpload(jobId,
                new ByteArrayInputStream("%PDF-1.4".getBytes(StandardCharsets.US_ASCII)));
        AnalysisJob job = new AnalysisJob(jobId);
        job.setStatus(status);
        job.setFilePath(path);
        job.setOriginalFilename("report.pdf");
        job.setQuery("query");
        job.setCreatedAt(updatedAt);
        job.setUpdatedAt(updatedAt);
        job.setStartedAt(status == JobStatus.PROCESSING ? updatedAt : null);
        return jobStore.put(job);
    }
}
