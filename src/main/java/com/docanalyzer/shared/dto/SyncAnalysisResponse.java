package com.docanalyzer.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a synchronous analysis request.
 */
public class SyncAnalysisResponse {

    private String status;
    private String query;
    private String analysis;
    @JsonProperty("file_processed")
    private String fileProcessed;

    public SyncAnalysisResponse() {
    }

    public SyncAnalysisResponse(String query, String analysis, String fileProcessed) {
        this.status = "success";
        this.query = query;
        this.analysis = analysis;
        this.fileProcessed = fileProcessed;
    }

    public String getStatus() {
        return status;
    }

    public String getQuery() {
        return query;
    }

    public String getAnalysis() {
        return analysis;
    }

    public String getFileProcessed() {
        return fileProcessed;
    }
}
