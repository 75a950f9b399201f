package com.docanalyzer.shared.dto;

import com.docanalyzer.shared.model.AnalysisJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO for job status response. {@code analysis} is only present for completed jobs,
 * {@code error} only for failed ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    @JsonProperty("job_id")
    private UUID jobId;
    private String status;
    private String query;
    @JsonProperty("file_processed")
    private String fileProcessed;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;
    private String analysis;
    private String error;

    public JobStatusResponse() {
    }

    public static JobStatusResponse from(AnalysisJob job) {
        JobStatusResponse response = new JobStatusResponse();
        response.jobId = job.getId();
        response.status = job.getStatus().wireValue();
        response.query = job.getQuery();
        response.fileProcessed = job.getOriginalFilename();
        response.createdAt = job.getCreatedAt();
        response.updatedAt = job.getUpdatedAt();
        switch (job.getStatus()) {
            case COMPLETED -> response.analysis = job.getResultText();
            case FAILED -> response.error = job.getErrorMessage();
            default -> {
                // no payload while the job is in flight
            }
        }
        return response;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getStatus() {
        return status;
    }

    public String getQuery() {
        return query;
    }

    public String getFileProcessed() {
        return fileProcessed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getAnalysis() {
        return analysis;
    }

    public String getError() {
        return error;
    }
}
