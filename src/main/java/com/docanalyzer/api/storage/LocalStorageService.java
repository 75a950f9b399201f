package com.docanalyzer.api.storage;

import com.docanalyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Stores uploads on the local filesystem under the configured upload directory.
 * Files are named {@code financial_document_<jobId>.pdf}.
 */
@Service
public class LocalStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageService.class);
    private static final String FILE_PREFIX = "financial_document_";
    private static final String FILE_SUFFIX = ".pdf";

    private final Path storageRoot;

    public LocalStorageService(AnalyzerProperties properties) {
        this.storageRoot = Paths.get(properties.storage().uploadDir()).toAbsolutePath().normalize();

        try {
            Files.createDirectories(storageRoot);
            logger.info("Local storage service initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create upload directory: " + storageRoot, e);
        }
    }

    @Override
    public String storeUpload(UUID jobId, InputStream content) throws IOException {
        Path filePath = storageRoot.resolve(FILE_PREFIX + jobId + FILE_SUFFIX);
        logger.debug("Writing upload to local storage: {}", filePath);

        try {
            Files.copy(content, filePath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to write upload to local storage: {}", filePath, e);
            Files.deleteIfExists(filePath);
            throw new IOException("Failed to save file: " + e.getMessage(), e);
        }
        logger.info("Stored upload for job {} at {}", jobId, filePath);
        return filePath.toString();
    }

    @Override
    public boolean delete(String storagePath) throws IOException {
        if (storagePath == null || storagePath.isBlank()) {
            return false;
        }
        Path filePath = Paths.get(storagePath).toAbsolutePath().normalize();
        if (!filePath.startsWith(storageRoot)) {
            throw new IllegalArgumentException("Path is outside the upload directory: " + storagePath);
        }
        boolean deleted = Files.deleteIfExists(filePath);
        if (deleted) {
            logger.debug("Deleted stored upload: {}", filePath);
        }
        return deleted;
    }

    public Path getStorageRoot() {
        return storageRoot;
    }
}
