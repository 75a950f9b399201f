package com.docanalyzer.api.messaging;

/**
 * The job queue could not accept a message. Reported to the submitter synchronously.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message) {
        super(message);
    }

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
