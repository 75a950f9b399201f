package com.docanalyzer.processing;

import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.TracingServiceInterface;
import com.google.genai.Client;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls Gemini on Vertex AI through the Google Gen AI SDK.
 * Runs in stub mode when analyzer.engine.enabled=false, returning deterministic
 * tagged answers so the whole pipeline can run without network access.
 */
@Service
public class GeminiService implements GeminiServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(GeminiService.class);

    private final boolean enabled;
    private final String projectId;
    private final String location;
    private final String model;
    private final int callTimeoutSeconds;
    private final TracingServiceInterface tracingService;
    private Client client;

    public GeminiService(AnalyzerProperties properties, TracingServiceInterface tracingService) {
        AnalyzerProperties.Engine engine = properties.engine();
        this.enabled = engine.enabled();
        this.projectId = engine.projectId();
        this.location = engine.location();
        this.model = engine.model();
        this.callTimeoutSeconds = engine.callTimeoutSeconds();
        this.tracingService = tracingService;

        logger.info("GeminiService initialized: enabled={}, projectId={}, location={}, model={}",
                enabled, projectId, location, model);

        if (!enabled) {
            logger.info("Gemini disabled, responses will come from the stub");
        } else if ("local-project".equals(projectId)) {
            throw new IllegalStateException(
                    "analyzer.engine.enabled=true requires analyzer.engine.project-id to name a Google Cloud project");
        } else {
            this.client = initializeClient();
        }
    }

    private Client initializeClient() {
        try {
            Client clientInstance = Client.builder()
                    .project(projectId)
                    .location(location)
                    .vertexAI(true)
                    .httpOptions(HttpOptions.builder().apiVersion("v1").build())
                    .build();
            logger.info("Google Gen AI SDK client initialized with Vertex AI enabled");
            return clientInstance;
        } catch (RuntimeException e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    @Override
    public String generateContent(String prompt, String taskType) throws IOException, TimeoutException {
        logger.debug("Calling Gemini: enabled={}, model={}, promptLength={}, taskType={}",
                enabled, model, prompt.length(), taskType);

        long startTime = System.currentTimeMillis();
        Span llmSpan = tracingService.spanBuilder("llm.call")
                .setAttribute("provider", "gemini")
                .setAttribute("model", model)
                .setAttribute("task_type", taskType)
                .setAttribute("prompt_length", prompt.length())
                .startSpan();

        try (Scope scope = llmSpan.makeCurrent()) {
            String responseText = enabled ? callModel(prompt) : stubResponse(taskType);
            llmSpan.setStatus(StatusCode.OK);
            llmSpan.setAttribute("response_length", responseText.length());
            logger.debug("Gemini call finished in {}ms, responseLength={}",
                    System.currentTimeMillis() - startTime, responseText.length());
            return responseText;
        } catch (IOException | TimeoutException e) {
            logger.warn("Gemini call failed after {}ms: {}", System.currentTimeMillis() - startTime, e.getMessage());
            llmSpan.setStatus(StatusCode.ERROR);
            tracingService.recordFailure(llmSpan, e);
            throw e;
        } finally {
            llmSpan.end();
        }
    }

    private String callModel(String prompt) throws IOException, TimeoutException {
        if (client == null) {
            throw new IOException("Gemini is enabled but the client was not initialized");
        }

        CompletableFuture<GenerateContentResponse> call =
                CompletableFuture.supplyAsync(() -> client.models.generateContent(model, prompt, null));
        GenerateContentResponse response;
        try {
            response = call.get(callTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TimeoutException("Gemini call timed out after " + callTimeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException("Gemini API call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for Gemini", e);
        }

        String responseText = response.text();
        if (responseText == null || responseText.isBlank()) {
            throw new IOException("Gemini API returned empty or null response");
        }
        return responseText;
    }

    private String stubResponse(String taskType) {
        if (AnalysisPrompts.VERIFICATION_TASK.equals(taskType)) {
            return "<result>Document type: financial report. The text contains financial disclosures "
                    + "and is suitable for analysis.</result>";
        }
        return "<result>1) Document summary: financial report (stub analysis).\n"
                + "2) Key metrics and highlights: see the source document.\n"
                + "3) Investment insights and risks: none identified by the stub engine.\n"
                + "4) Recommendations: none; enable the Gemini backend for a real analysis.</result>";
    }
}
