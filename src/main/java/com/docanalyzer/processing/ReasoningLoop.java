package com.docanalyzer.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs a task as a bounded sequence of model calls. Each step sees the transcript of the
 * previous ones; the loop ends at the first tagged result or at the step cap, in which
 * case the last step's output is the answer.
 */
@Component
public class ReasoningLoop {

    private static final Logger logger = LoggerFactory.getLogger(ReasoningLoop.class);

    private final GeminiServiceInterface geminiService;

    public ReasoningLoop(GeminiServiceInterface geminiService) {
        this.geminiService = geminiService;
    }

    public String run(String taskType, String task, int maxSteps) throws AnalysisFailureException {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }

        StringBuilder transcript = new StringBuilder();
        String lastOutput = null;
        for (int step = 1; step <= maxSteps; step++) {
            String response = callModel(taskType, AnalysisPrompts.step(task, transcript, step, maxSteps), step);

            Optional<String> result = ResponseParser.extractResult(response);
            if (result.isPresent()) {
                logger.info("{} finished after {} step(s)", taskType, step);
                return result.get();
            }

            lastOutput = response.strip();
            transcript.append("Step ").append(step).append(":\n").append(lastOutput).append("\n\n");
        }

        logger.warn("{} reached its limit of {} step(s) without a tagged result, using the last step output",
                taskType, maxSteps);
        return lastOutput;
    }

    private String callModel(String taskType, String prompt, int step) throws AnalysisFailureException {
        String response;
        try {
            response = geminiService.generateContent(prompt, taskType);
        } catch (TimeoutException e) {
            throw new AnalysisFailureException(taskType + " timed out at step " + step + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AnalysisFailureException(taskType + " failed at step " + step + ": " + e.getMessage(), e);
        }
        if (response == null || response.isBlank()) {
            throw new AnalysisFailureException(taskType + " returned an empty response at step " + step);
        }
        return response;
    }
}
