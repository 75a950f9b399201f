package com.docanalyzer.api.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Interface for storing the ephemeral input document of a job.
 * The stored file is owned by exactly one job and removed once that job is finished.
 */
public interface StorageService {

    /**
     * Writes the uploaded document for a job.
     *
     * @param jobId   Job UUID
     * @param content File content input stream
     * @return absolute path of the stored file
     * @throws IOException if the file cannot be written
     */
    String storeUpload(UUID jobId, InputStream content) throws IOException;

    /**
     * Deletes a stored document if it still exists.
     *
     * @param storagePath path returned from {@link #storeUpload}
     * @return true if a file was removed, false if there was nothing to remove
     * @throws IOException if the file exists but cannot be removed
     */
    boolean delete(String storagePath) throws IOException;
}
