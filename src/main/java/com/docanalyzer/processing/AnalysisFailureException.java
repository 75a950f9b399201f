package com.docanalyzer.processing;

/**
 * Any failure of the analysis engine: backend error, timeout, or unusable response.
 * The message is the human-readable reason stored on a FAILED job.
 */
public class AnalysisFailureException extends Exception {

    public AnalysisFailureException(String reason) {
        super(reason);
    }

    public AnalysisFailureException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
