package com.docanalyzer.config;

import com.docanalyzer.api.JobNotFoundException;
import com.docanalyzer.api.messaging.QueueUnavailableException;
import com.docanalyzer.api.validation.InvalidDocumentException;
import com.docanalyzer.shared.dto.ErrorResponse;
import com.docanalyzer.util.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("Unhandled error", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred";
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(), message);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIoException(IOException ex) {
        logger.error("I/O error while handling request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "StorageError", ex.getMessage());
    }

    @ExceptionHandler(InvalidDocumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDocument(InvalidDocumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "InvalidDocument", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingFile(MissingServletRequestPartException ex) {
        return respond(HttpStatus.BAD_REQUEST, "InvalidDocument", "A PDF file is required.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSizeException(MaxUploadSizeExceededException ex) {
        return respond(HttpStatus.BAD_REQUEST, "FileSizeExceeded", "File size exceeds the maximum allowed upload size");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "IllegalArgument", ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "JobNotFound", ex.getMessage());
    }

    @ExceptionHandler(QueueUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleQueueUnavailable(QueueUnavailableException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "QueueUnavailable",
                "Analysis queue is unavailable (" + ex.getMessage() + "). Retry later or use /analyze/sync.");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        String traceId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
        return ResponseEntity.status(status).body(new ErrorResponse(error, message, traceId));
    }
}
