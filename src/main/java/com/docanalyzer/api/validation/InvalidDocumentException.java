package com.docanalyzer.api.validation;

/**
 * Thrown when an upload is not an acceptable document. Reported to the submitter as a client error.
 */
public class InvalidDocumentException extends RuntimeException {

    public InvalidDocumentException(String message) {
        super(message);
    }
}
