package com.docanalyzer.api.validation;

import com.docanalyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Validates uploads before a job is created: presence, size, .pdf extension and the %PDF signature.
 */
@Component
public class PdfValidator {

    private static final Logger logger = LoggerFactory.getLogger(PdfValidator.class);
    private static final byte[] PDF_MAGIC_BYTES = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final int MAGIC_BYTES_LENGTH = 4;
    private static final String PDF_EXTENSION = ".pdf";

    private final long maxUploadBytes;

    public PdfValidator(AnalyzerProperties properties) {
        this.maxUploadBytes = properties.maxUploadBytes();
        logger.info("PdfValidator initialized: maxUploadBytes={}", maxUploadBytes);
    }

    /**
     * Rejects anything that is not a non-empty PDF within the size limit.
     *
     * @throws InvalidDocumentException describing the first failed check
     * @throws IOException if the upload cannot be read
     */
    public void validateUpload(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new InvalidDocumentException("A PDF file is required.");
        }
        if (!hasPdfExtension(file.getOriginalFilename())) {
            logger.warn("Rejected upload with filename {}", file.getOriginalFilename());
            throw new InvalidDocumentException("A PDF file is required.");
        }
        if (file.getSize() > maxUploadBytes) {
            throw new InvalidDocumentException(
                    String.format("File size (%d bytes) exceeds maximum allowed size (%d bytes)",
                            file.getSize(), maxUploadBytes));
        }
        try (InputStream in = new BufferedInputStream(file.getInputStream())) {
            if (!validateMagicBytes(in)) {
                throw new InvalidDocumentException("Uploaded file is not a valid PDF document.");
            }
        }
    }

    public boolean hasPdfExtension(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    /**
     * Checks that the stream starts with the %PDF signature. The stream is reset afterwards.
     *
     * @param inputStream stream supporting mark/reset
     * @return true if the signature matches
     */
    public boolean validateMagicBytes(InputStream inputStream) throws IOException {
        if (inputStream == null) {
            logger.warn("PDF validation failed: input stream is null");
            return false;
        }
        if (!inputStream.markSupported()) {
            logger.warn("PDF validation: input stream does not support mark/reset, cannot validate magic bytes");
            return false;
        }

        inputStream.mark(MAGIC_BYTES_LENGTH + 1);
        try {
            byte[] header = inputStream.readNBytes(MAGIC_BYTES_LENGTH);
            if (header.length < MAGIC_BYTES_LENGTH) {
                logger.warn("PDF validation failed: file too short (read {} bytes)", header.length);
                return false;
            }
            for (int i = 0; i < MAGIC_BYTES_LENGTH; i++) {
                if (header[i] != PDF_MAGIC_BYTES[i]) {
                    logger.warn("PDF validation failed: magic bytes mismatch at position {}", i);
                    return false;
                }
            }
            return true;
        } finally {
            inputStream.reset();
        }
    }
}
