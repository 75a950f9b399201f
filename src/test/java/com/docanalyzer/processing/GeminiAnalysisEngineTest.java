package com.docanalyzer.processing;

import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.observability.TracingServiceStub;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeminiAnalysisEngineTest {

    private static final AnalyzerProperties PROPERTIES = new AnalyzerProperties(null, null, null, null, null,
            new AnalyzerProperties.Engine(false, null, null, null, null, 2, 4), null);

    @Test
    void testAnalyzeRunsVerificationFirstAndPassesItsNote() throws Exception {
        ReasoningLoop loop = mock(ReasoningLoop.class);
        when(loop.run(eq(AnalysisPrompts.VERIFICATION_TASK), anyString(), eq(2))).thenReturn("Looks like a 10-Q");
        when(loop.run(eq(AnalysisPrompts.ANALYSIS_TASK), anyString(), eq(4))).thenReturn("Final analysis");
        GeminiAnalysisEngine engine = new GeminiAnalysisEngine(loop, PROPERTIES);

        String report = engine.analyze("Is the company profitable?", "Net income: 4.1M");

        assertThat(report).isEqualTo("Final analysis");
        ArgumentCaptor<String> analysisPrompt = ArgumentCaptor.forClass(String.class);
        verify(loop).run(eq(AnalysisPrompts.ANALYSIS_TASK), analysisPrompt.capture(), eq(4));
        assertThat(analysisPrompt.getValue())
                .contains("Looks like a 10-Q")
                .contains("User request: Is the company profitable?")
                .contains("Net income: 4.1M");
    }

    @Test
    void testVerificationFailureStopsAnalysis() throws Exception {
        ReasoningLoop loop = mock(ReasoningLoop.class);
        when(loop.run(eq(AnalysisPrompts.VERIFICATION_TASK), anyString(), anyInt()))
                .thenThrow(new AnalysisFailureException("verification failed at step 1: unavailable"));
        GeminiAnalysisEngine engine = new GeminiAnalysisEngine(loop, PROPERTIES);

        assertThatThrownBy(() -> engine.analyze("query", "text"))
                .isInstanceOf(AnalysisFailureException.class)
                .hasMessageContaining("verification failed");
        verify(loop, never()).run(eq(AnalysisPrompts.ANALYSIS_TASK), anyString(), anyInt());
    }

    @Test
    void testStubBackendProducesTaggedAnswers() throws Exception {
        GeminiService stubBackend = new GeminiService(PROPERTIES, new TracingServiceStub());
        GeminiAnalysisEngine engine = new GeminiAnalysisEngine(new ReasoningLoop(stubBackend), PROPERTIES);

        assertThat(engine.verify("Revenue: 1M")).startsWith("Document type: financial report");
        assertThat(engine.analyze("query", "Revenue: 1M")).contains("Document summary");
    }
}
