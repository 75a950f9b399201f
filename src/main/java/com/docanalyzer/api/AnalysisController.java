package com.docanalyzer.api;

import com.docanalyzer.processing.AnalysisFailureException;
import com.docanalyzer.shared.dto.ErrorResponse;
import com.docanalyzer.shared.dto.JobStatusResponse;
import com.docanalyzer.shared.dto.JobSubmissionResponse;
import com.docanalyzer.shared.dto.SyncAnalysisResponse;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.util.CorrelationIdFilter;
import com.docanalyzer.util.Strings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

@RestController
@Tag(name = "Analysis", description = "Financial document analysis endpoints")
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final JobSubmissionService jobSubmissionService;

    public AnalysisController(JobSubmissionService jobSubmissionService) {
        this.jobSubmissionService = jobSubmissionService;
    }

    @GetMapping("/")
    @Operation(summary = "Service banner")
    public Map<String, String> root() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("message", "Financial Document Analyzer API is running");
        response.put("docs", "/swagger-ui.html");
        return response;
    }

    @PostMapping(path = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit a PDF for queued analysis",
               description = "Stores the document, records a pending job and returns its id immediately")
    public ResponseEntity<JobSubmissionResponse> submit(
            @Parameter(description = "PDF file to analyze")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "What to look for in the document")
            @RequestParam(value = "query", required = false) String query) throws IOException {

        logger.info("Received analysis request: filename={}, size={}", file.getOriginalFilename(), file.getSize());
        AnalysisJob job = jobSubmissionService.submit(file, query);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new JobSubmissionResponse(
                job.getId(),
                job.getStatus().wireValue(),
                "Analysis job queued. Poll /analyze/" + job.getId() + " for the result."));
    }

    @GetMapping("/analyze/{jobId}")
    @Operation(summary = "Get job status and, once finished, its result")
    public JobStatusResponse status(@PathVariable("jobId") String jobId) {
        UUID id;
        try {
            id = UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return JobStatusResponse.from(jobSubmissionService.getJob(id));
    }

    @PostMapping(path = "/analyze/sync", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyze a PDF and wait for the result",
               description = "Runs the analysis within the request; no job is recorded")
    public CompletableFuture<ResponseEntity<Object>> analyzeSync(
            @Parameter(description = "PDF file to analyze")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "What to look for in the document")
            @RequestParam(value = "query", required = false) String query) throws IOException {

        String resolvedQuery = jobSubmissionService.resolveQuery(query);
        String filename = Strings.safe(file.getOriginalFilename(), "document.pdf");
        // Completion runs on an analysis thread, so capture the request id now.
        String traceId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);

        return jobSubmissionService.analyzeNow(file, resolvedQuery)
                .handle((report, error) -> {
                    if (error == null) {
                        return ResponseEntity.<Object>ok(new SyncAnalysisResponse(resolvedQuery, report, filename));
                    }
                    return syncFailure(error, traceId);
                });
    }

    private static ResponseEntity<Object> syncFailure(Throwable error, String traceId) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            logger.warn("Synchronous analysis timed out");
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(new ErrorResponse("AnalysisTimeout", "Analysis did not finish in time", traceId));
        }
        String message = cause instanceof AnalysisFailureException
                ? cause.getMessage()
                : "Error processing financial document: " + Strings.safe(cause.getMessage(), cause.getClass().getSimpleName());
        logger.error("Synchronous analysis failed: {}", message, cause);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("AnalysisFailed", message, traceId));
    }
}
