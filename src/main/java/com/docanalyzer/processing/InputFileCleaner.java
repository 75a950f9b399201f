package com.docanalyzer.processing;

import com.docanalyzer.api.storage.StorageService;
import com.docanalyzer.observability.JobMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Removes a job's temporary input file. Failures are logged and counted, never thrown:
 * a file that cannot be deleted must not change how the job ended.
 */
@Component
public class InputFileCleaner {

    private static final Logger logger = LoggerFactory.getLogger(InputFileCleaner.class);

    private final StorageService storageService;
    private final JobMetrics jobMetrics;

    public InputFileCleaner(StorageService storageService, JobMetrics jobMetrics) {
        this.storageService = storageService;
        this.jobMetrics = jobMetrics;
    }

    /**
     * @return true if a file was removed
     */
    public boolean deleteQuietly(String filePath) {
        try {
            boolean deleted = storageService.delete(filePath);
            if (deleted) {
                logger.info("Removed temporary file {}", filePath);
            }
            return deleted;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to delete temporary file {}: {}", filePath, e.getMessage());
            jobMetrics.recordCleanupFailure();
            return false;
        }
    }
}
