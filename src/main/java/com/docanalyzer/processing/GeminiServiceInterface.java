package com.docanalyzer.processing;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface for Gemini service to support both real and stub implementations.
 */
public interface GeminiServiceInterface {

    /**
     * Sends a single prompt and returns the generated text.
     *
     * @param prompt   full prompt text
     * @param taskType label for logs and spans (e.g. "verification", "analysis")
     * @throws IOException      if the call fails or returns no text
     * @throws TimeoutException if the call exceeds the configured per-call timeout
     */
    String generateContent(String prompt, String taskType) throws IOException, TimeoutException;
}
