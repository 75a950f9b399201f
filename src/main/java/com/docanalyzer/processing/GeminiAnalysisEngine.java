package com.docanalyzer.processing;

import com.docanalyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analysis engine backed by Gemini. Verification runs first and its note is
 * passed into the analysis step.
 */
@Service
public class GeminiAnalysisEngine implements AnalysisEngine {

    private static final Logger logger = LoggerFactory.getLogger(GeminiAnalysisEngine.class);

    private final ReasoningLoop reasoningLoop;
    private final int verifyMaxIterations;
    private final int analyzeMaxIterations;

    public GeminiAnalysisEngine(ReasoningLoop reasoningLoop, AnalyzerProperties properties) {
        this.reasoningLoop = reasoningLoop;
        this.verifyMaxIterations = properties.engine().verifyMaxIterations();
        this.analyzeMaxIterations = properties.engine().analyzeMaxIterations();
        logger.info("GeminiAnalysisEngine initialized: verifyMaxIterations={}, analyzeMaxIterations={}",
                verifyMaxIterations, analyzeMaxIterations);
    }

    @Override
    public String verify(String extractedText) throws AnalysisFailureException {
        return reasoningLoop.run(AnalysisPrompts.VERIFICATION_TASK,
                AnalysisPrompts.verificationTask(extractedText), verifyMaxIterations);
    }

    @Override
    public String analyze(String query, String extractedText) throws AnalysisFailureException {
        String verificationNote = verify(extractedText);
        logger.debug("Verification note: {}", verificationNote);
        return reasoningLoop.run(AnalysisPrompts.ANALYSIS_TASK,
                AnalysisPrompts.analysisTask(query, verificationNote, extractedText), analyzeMaxIterations);
    }
}
