package com.docanalyzer.processing;

import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.JobMetrics;
import com.docanalyzer.observability.TracingServiceInterface;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.repository.JobStore;
import com.docanalyzer.util.Strings;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs one delivered job from PENDING to a terminal state.
 *
 * <p>Safe to invoke more than once for the same job id: deliveries that find the job
 * terminal, or lose the PENDING to PROCESSING claim, return {@link ProcessOutcome#SKIPPED}
 * without touching the job or its file. The winning delivery always removes the input
 * file once the outcome has been persisted, whether analysis succeeded or not.
 *
 * <p>Analysis failures end the job as FAILED and are not thrown. Only job store failures
 * escape, so the broker can redeliver.
 */
@Service
public class JobOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(JobOrchestrator.class);

    static final String JOB_ID_MDC_KEY = "job_id";

    private final JobStore jobStore;
    private final DocumentAnalysisService documentAnalysisService;
    private final InputFileCleaner inputFileCleaner;
    private final JobMetrics jobMetrics;
    private final TracingServiceInterface tracingService;
    private final String defaultQuery;

    public JobOrchestrator(JobStore jobStore,
                           DocumentAnalysisService documentAnalysisService,
                           InputFileCleaner inputFileCleaner,
                           JobMetrics jobMetrics,
                           TracingServiceInterface tracingService,
                           AnalyzerProperties properties) {
        this.jobStore = jobStore;
        this.documentAnalysisService = documentAnalysisService;
        this.inputFileCleaner = inputFileCleaner;
        this.jobMetrics = jobMetrics;
        this.tracingService = tracingService;
        this.defaultQuery = properties.defaultQuery();
    }

    public ProcessOutcome process(UUID jobId) {
        MDC.put(JOB_ID_MDC_KEY, jobId.toString());
        Span span = tracingService.spanBuilder("job.process")
                .setAttribute("job_id", jobId.toString())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            ProcessOutcome outcome = processDelivery(jobId);
            span.setAttribute("job.outcome", outcome.name());
            return outcome;
        } catch (RuntimeException e) {
            tracingService.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
            MDC.remove(JOB_ID_MDC_KEY);
        }
    }

    private ProcessOutcome processDelivery(UUID jobId) {
        Optional<AnalysisJob> found = jobStore.findById(jobId);
        if (found.isEmpty()) {
            logger.warn("Job not found: {}", jobId);
            return ProcessOutcome.NOT_FOUND;
        }

        AnalysisJob job = found.get();
        if (job.getStatus().isTerminal()) {
            logger.info("Job {} is already in final state {}, skipping", jobId, job.getStatus());
            jobMetrics.recordSkipped();
            return ProcessOutcome.SKIPPED;
        }

        if (!jobStore.markProcessing(jobId)) {
            // Another delivery owns the job (and its file) now.
            logger.info("Job {} was claimed by another worker, skipping", jobId);
            jobMetrics.recordSkipped();
            return ProcessOutcome.SKIPPED;
        }
        logger.info("Claimed job {} for processing", jobId);

        long startedAt = System.currentTimeMillis();
        try {
            return runClaimed(job, startedAt);
        } finally {
            inputFileCleaner.deleteQuietly(job.getFilePath());
        }
    }

    private ProcessOutcome runClaimed(AnalysisJob job, long startedAt) {
        UUID jobId = job.getId();

        Path inputFile = resolveInputFile(job.getFilePath());
        if (inputFile == null || !Files.isRegularFile(inputFile)) {
            return fail(jobId, "Input file not found: " + job.getFilePath(), startedAt);
        }

        String query = Strings.safe(job.getQuery(), defaultQuery);
        String report;
        try {
            report = documentAnalysisService.analyzeAsync(query, inputFile).get();
        } catch (ExecutionException e) {
            return fail(jobId, describeFailure(e.getCause()), startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(jobId, "Processing was interrupted", startedAt);
        } catch (RuntimeException e) {
            logger.error("Unexpected error while analyzing job {}", jobId, e);
            return fail(jobId, "Unexpected error: " + Strings.safe(e.getMessage(), e.getClass().getSimpleName()), startedAt);
        }

        long durationMs = System.currentTimeMillis() - startedAt;
        if (!jobStore.markCompleted(jobId, report)) {
            logger.warn("Job {} was finalized elsewhere before its report could be stored", jobId);
            return ProcessOutcome.SKIPPED;
        }
        jobMetrics.recordCompleted(durationMs);
        logger.info("Job {} completed in {} ms ({} chars of analysis)", jobId, durationMs, report.length());
        return ProcessOutcome.COMPLETED;
    }

    private ProcessOutcome fail(UUID jobId, String errorMessage, long startedAt) {
        long durationMs = System.currentTimeMillis() - startedAt;
        if (!jobStore.markFailed(jobId, errorMessage)) {
            logger.warn("Job {} was finalized elsewhere before its failure could be stored", jobId);
            return ProcessOutcome.SKIPPED;
        }
        jobMetrics.recordFailed(durationMs);
        logger.warn("Job {} failed after {} ms: {}", jobId, durationMs, errorMessage);
        return ProcessOutcome.FAILED;
    }

    private String describeFailure(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Analysis timed out after " + documentAnalysisService.getAnalysisTimeoutSeconds() + "s";
        }
        if (cause instanceof AnalysisFailureException) {
            return cause.getMessage();
        }
        if (cause instanceof IOException) {
            return "Failed to read document: " + Strings.safe(cause.getMessage(), cause.getClass().getSimpleName());
        }
        logger.error("Unexpected analysis error", cause);
        return "Unexpected error: " + Strings.safe(cause.getMessage(), cause.getClass().getSimpleName());
    }

    private static Path resolveInputFile(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return null;
        }
        try {
            return Paths.get(filePath);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
