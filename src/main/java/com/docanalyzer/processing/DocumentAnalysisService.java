package com.docanalyzer.processing;

import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.processing.model.ExtractedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Extraction followed by analysis, shared by the queued and the synchronous paths.
 */
@Service
public class DocumentAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalysisService.class);

    private final DocumentTextExtractor textExtractor;
    private final AnalysisEngine analysisEngine;
    private final Executor analysisExecutor;
    private final int analysisTimeoutSeconds;

    public DocumentAnalysisService(DocumentTextExtractor textExtractor,
                                   AnalysisEngine analysisEngine,
                                   @Qualifier("analysisExecutor") Executor analysisExecutor,
                                   AnalyzerProperties properties) {
        this.textExtractor = textExtractor;
        this.analysisEngine = analysisEngine;
        this.analysisExecutor = analysisExecutor;
        this.analysisTimeoutSeconds = properties.job().analysisTimeoutSeconds();
    }

    /**
     * Runs extraction and analysis on the calling thread.
     *
     * @throws IOException               if the document cannot be parsed
     * @throws AnalysisFailureException  if the engine fails
     */
    public String analyze(String query, Path document) throws IOException, AnalysisFailureException {
        ExtractedText extracted = textExtractor.extract(document);
        logger.debug("Extraction outcome {} for {}", extracted.getOutcome(), document);
        return analysisEngine.analyze(query, extracted.getText());
    }

    /**
     * Runs {@link #analyze} on the analysis executor, bounded by the configured wall-clock timeout.
     * The future fails with the original IOException, AnalysisFailureException or a TimeoutException.
     */
    public CompletableFuture<String> analyzeAsync(String query, Path document) {
        return CompletableFuture.supplyAsync(() -> {
                    try {
                        return analyze(query, document);
                    } catch (IOException | AnalysisFailureException e) {
                        throw new CompletionException(e);
                    }
                }, analysisExecutor)
                .orTimeout(analysisTimeoutSeconds, TimeUnit.SECONDS);
    }

    public int getAnalysisTimeoutSeconds() {
        return analysisTimeoutSeconds;
    }
}
