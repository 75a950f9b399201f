package com.docanalyzer.api;

import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.api.validation.InvalidDocumentException;
import com.docanalyzer.processing.AnalysisFailureException;
import com.docanalyzer.shared.model.AnalysisJob;
import com.docanalyzer.shared.model.JobStatus;
import com.docanalyzer.util.CorrelationIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the analysis endpoints, with the gateway service mocked.
 */
@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    private static final MockMultipartFile PDF =
            new MockMultipartFile("file", "q3.pdf", "application/pdf", "%PDF-1.4".getBytes());

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobSubmissionService jobSubmissionService;

    @Test
    void testRootBanner() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Financial Document Analyzer API is running"));
    }

    @Test
    void testSubmitReturnsAcceptedWithJobId() throws Exception {
        AnalysisJob job = job(JobStatus.PENDING);
        when(jobSubmissionService.submit(any(), eq("Summarize"))).thenReturn(job);

        mockMvc.perform(multipart("/analyze").file(PDF).param("query", "Summarize"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value(job.getId().toString()))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void testSubmitRejectsInvalidDocument() throws Exception {
        when(jobSubmissionService.submit(any(), any()))
                .thenThrow(new InvalidDocumentException("Uploaded file is not a valid PDF document."));

        mockMvc.perform(multipart("/analyze").file(PDF))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidDocument"))
                .andExpect(jsonPath("$.message").value("Uploaded file is not a valid PDF document."));
    }

    @Test
    void testSubmitWithoutFileIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/analyze").param("query", "Summarize"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("A PDF file is required."));
    }

    @Test
    void testSubmitReportsUnavailableQueue() throws Exception {
        when(jobSubmissionService.submit(any(), any())).thenThrow(new QueueUnavailableException("Job queue is full"));

        mockMvc.perform(multipart("/analyze").file(PDF).header(CorrelationIdFilter.REQUEST_ID_HEADER, "client-7"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("QueueUnavailable"))
                .andExpect(jsonPath("$.message").value(containsString("/analyze/sync")))
                .andExpect(jsonPath("$.traceId").value("client-7"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testStatusOfCompletedJobIncludesAnalysisOnly() throws Exception {
        AnalysisJob job = job(JobStatus.COMPLETED);
        job.setResultText("Revenue up 8%");
        when(jobSubmissionService.getJob(job.getId())).thenReturn(job);

        mockMvc.perform(get("/analyze/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.analysis").value("Revenue up 8%"))
                .andExpect(jsonPath("$.file_processed").value("q3.pdf"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void testStatusOfFailedJobIncludesError() throws Exception {
        AnalysisJob job = job(JobStatus.FAILED);
        job.setErrorMessage("Input file not found: /tmp/q3.pdf");
        when(jobSubmissionService.getJob(job.getId())).thenReturn(job);

        mockMvc.perform(get("/analyze/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("Input file not found: /tmp/q3.pdf"))
                .andExpect(jsonPath("$.analysis").doesNotExist());
    }

    @Test
    void testStatusOfPendingJobHasNoPayload() throws Exception {
        AnalysisJob job = job(JobStatus.PENDING);
        when(jobSubmissionService.getJob(job.getId())).thenReturn(job);

        mockMvc.perform(get("/analyze/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.analysis").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void testStatusOfUnknownJobIsNotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobSubmissionService.getJob(jobId)).thenThrow(new JobNotFoundException(jobId));

        mockMvc.perform(get("/analyze/{id}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("JobNotFound"));
    }

    @Test
    void testMalformedJobIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/analyze/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSyncAnalysisReturnsReport() throws Exception {
        when(jobSubmissionService.resolveQuery(any())).thenReturn("Summarize");
        when(jobSubmissionService.analyzeNow(any(), eq("Summarize")))
                .thenReturn(CompletableFuture.completedFuture("Sync report"));

        MvcResult pending = mockMvc.perform(multipart("/analyze/sync").file(PDF).param("query", "Summarize"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.query").value("Summarize"))
                .andExpect(jsonPath("$.analysis").value("Sync report"))
                .andExpect(jsonPath("$.file_processed").value("q3.pdf"));
    }

    @Test
    void testSyncAnalysisFailureIsServerError() throws Exception {
        when(jobSubmissionService.resolveQuery(any())).thenReturn("q");
        when(jobSubmissionService.analyzeNow(any(), any())).thenReturn(
                CompletableFuture.failedFuture(new AnalysisFailureException("analysis failed at step 2: quota")));

        MvcResult pending = mockMvc.perform(multipart("/analyze/sync").file(PDF))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("analysis failed at step 2: quota"));
    }

    @Test
    void testSyncAnalysisTimeoutIsGatewayTimeout() throws Exception {
        when(jobSubmissionService.resolveQuery(any())).thenReturn("q");
        when(jobSubmissionService.analyzeNow(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException()));

        MvcResult pending = mockMvc.perform(multipart("/analyze/sync").file(PDF))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("AnalysisTimeout"));
    }

    @Test
    void testRequestIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/").header(CorrelationIdFilter.REQUEST_ID_HEADER, "client-42"))
                .andExpect(header().string(CorrelationIdFilter.REQUEST_ID_HEADER, "client-42"));

        mockMvc.perform(get("/"))
                .andExpect(header().string(CorrelationIdFilter.REQUEST_ID_HEADER, not(emptyOrNullString())));
    }

    private static AnalysisJob job(JobStatus status) {
        AnalysisJob job = new AnalysisJob(UUID.randomUUID());
        job.setStatus(status);
        job.setQuery("Summarize");
        job.setOriginalFilename("q3.pdf");
        job.setFilePath("/tmp/q3.pdf");
        job.setCreatedAt(Instant.now());
        job.setUpdatedAt(Instant.now());
        return job;
    }
}
