package com.docanalyzer.api.messaging;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Queue payload referencing a submitted job. Workers trust only {@code jobId}
 * and read everything else from the job store.
 */
public record JobMessage(
        @JsonProperty("job_id") UUID jobId,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("query") String query,
        @JsonProperty("original_filename") String originalFilename
) {
}
