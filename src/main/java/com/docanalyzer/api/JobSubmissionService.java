package com.docanalyzer.api;

import com.docanalyzer.api.messaging.JobMessage;
import com.docanalyzer.api.messaging.JobQueue;
import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.api.storage.StorageService;
import com.docanalyzer.api.validation.PdfValidator;
import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.JobMetrics;
import com.docanalyzer.observability.TracingServiceInterface;
import com.docanalyzer.processing.DocumentAnalysisService;
import com.docanalyzer.processing.InputFileCleaner;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.model.JobStatus;
import com.docanalyzer.shared.repository.JobStore;
import com.docanalyzer.util.Strings;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Gateway side of the analysis flow: validates uploads, stores them, records jobs and
 * hands them to the queue. Also serves the synchronous path, which skips the job store.
 */
@Service
public class JobSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(JobSubmissionService.class);
    private static final String JOB_ID_MDC_KEY = "job_id";

    private final PdfValidator pdfValidator;
    private final StorageService storageService;
    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final DocumentAnalysisService documentAnalysisService;
    private final InputFileCleaner inputFileCleaner;
    private final JobMetrics jobMetrics;
    private final TracingServiceInterface tracingService;
    private final String defaultQuery;

    public JobSubmissionService(PdfValidator pdfValidator,
                                StorageService storageService,
                                JobStore jobStore,
                                JobQueue jobQueue,
                                DocumentAnalysisService documentAnalysisService,
                                InputFileCleaner inputFileCleaner,
                                JobMetrics jobMetrics,
                                TracingServiceInterface tracingService,
                                AnalyzerProperties properties) {
        this.pdfValidator = pdfValidator;
        this.storageService = storageService;
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.documentAnalysisService = documentAnalysisService;
        this.inputFileCleaner = inputFileCleaner;
        this.jobMetrics = jobMetrics;
        this.tracingService = tracingService;
        this.defaultQuery = properties.defaultQuery();
    }

    /**
     * Stores the upload, records a PENDING job and enqueues it.
     * Validation failures leave nothing behind. If the queue refuses the job, the job is
     * marked FAILED, its file removed, and the {@link QueueUnavailableException} rethrown.
     */
    public AnalysisJob submit(MultipartFile file, String query) throws IOException {
        pdfValidator.validateUpload(file);

        UUID jobId = UUID.randomUUID();
        MDC.put(JOB_ID_MDC_KEY, jobId.toString());
        Span span = tracingService.spanBuilder("job.submit")
                .setAttribute("job_id", jobId.toString())
                .setAttribute("file_size_bytes", file.getSize())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            String storedPath = store(jobId, file);

            AnalysisJob job = new AnalysisJob(jobId);
            job.setStatus(JobStatus.PENDING);
            job.setFilePath(storedPath);
            job.setOriginalFilename(Strings.abbreviate(Strings.safe(file.getOriginalFilename(), "document.pdf"), 256));
            job.setQuery(resolveQuery(query));
            try {
                job = jobStore.create(job);
            } catch (RuntimeException e) {
                inputFileCleaner.deleteQuietly(storedPath);
                throw e;
            }
            logger.info("Job record created: jobId={}, file={}", jobId, job.getOriginalFilename());

            try {
                jobQueue.enqueue(new JobMessage(jobId, storedPath, job.getQuery(), job.getOriginalFilename()));
            } catch (QueueUnavailableException e) {
                logger.error("Failed to enqueue job {}: {}", jobId, e.getMessage());
                try {
                    jobStore.markEnqueueFailed(jobId, "Failed to enqueue: " + e.getMessage());
                } catch (RuntimeException storeError) {
                    // The client still needs the queue error; the reaper retries the PENDING row later.
                    logger.error("Could not record enqueue failure for job {}", jobId, storeError);
                    e.addSuppressed(storeError);
                } finally {
                    inputFileCleaner.deleteQuietly(storedPath);
                }
                tracingService.recordFailure(span, e);
                throw e;
            }

            jobMetrics.recordSubmitted();
            logger.info("Job {} queued for analysis", jobId);
            return job;
        } finally {
            span.end();
            MDC.remove(JOB_ID_MDC_KEY);
        }
    }

    /**
     * Analyzes an upload without creating a job. The stored file is removed once the
     * returned future settles, whichever way it settles.
     */
    public CompletableFuture<String> analyzeNow(MultipartFile file, String query) throws IOException {
        pdfValidator.validateUpload(file);

        UUID requestId = UUID.randomUUID();
        String storedPath = store(requestId, file);
        logger.info("Running synchronous analysis {} for {}", requestId, file.getOriginalFilename());

        CompletableFuture<String> analysis;
        try {
            analysis = documentAnalysisService.analyzeAsync(resolveQuery(query), Paths.get(storedPath));
        } catch (RuntimeException e) {
            inputFileCleaner.deleteQuietly(storedPath);
            throw e;
        }
        return analysis.whenComplete((report, error) -> inputFileCleaner.deleteQuietly(storedPath));
    }

    public AnalysisJob getJob(UUID jobId) {
        return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public String resolveQuery(String query) {
        return query == null || query.isBlank() ? defaultQuery : query.strip();
    }

    private String store(UUID id, MultipartFile file) throws IOException {
        try (InputStream content = file.getInputStream()) {
            return storageService.storeUpload(id, content);
        }
    }
}
