package com.docanalyzer.api;

import java.util.UUID;

/**
 * Raised when a status lookup names a job id that was never created.
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }
}
