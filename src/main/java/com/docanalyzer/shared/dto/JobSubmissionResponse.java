package com.docanalyzer.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Returned when a document has been accepted for queued analysis.
 */
public class JobSubmissionResponse {

    @JsonProperty("job_id")
    private UUID jobId;
    private String status;
    private String message;

    public JobSubmissionResponse() {
    }

    public JobSubmissionResponse(UUID jobId, String status, String message) {
        this.jobId = jobId;
        this.status = status;
        this.message = message;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
