package com.docanalyzer.processing;

/**
 * Produces textual reports from extracted document text. Implementations do not retry;
 * every failure surfaces as a single {@link AnalysisFailureException}.
 */
public interface AnalysisEngine {

    /**
     * Checks that the text looks like a financial document and describes it.
     */
    String verify(String extractedText) throws AnalysisFailureException;

    /**
     * Answers the user's request about the document.
     */
    String analyze(String query, String extractedText) throws AnalysisFailureException;
}
