package com.docanalyzer.processing;

import com.docanalyzer.TestPdfFactory;
import com.docanalyzer.config.AnalyzerProperties;
import com.docanalyzer.processing.model.ExtractedText;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentAnalysisServiceTest {

    @TempDir
    Path tempDir;

    private final AnalysisEngine analysisEngine = mock(AnalysisEngine.class);
    private final DocumentAnalysisService service = new DocumentAnalysisService(
            new DocumentTextExtractor(), analysisEngine, Runnable::run, AnalyzerProperties.defaults());

    @Test
    void testTextlessPdfIsAnalyzedWithSentinel() throws Exception {
        Path pdf = TestPdfFactory.write(tempDir, "scan.pdf", TestPdfFactory.blankPdf());
        when(analysisEngine.analyze("query", ExtractedText.NO_TEXT_SENTINEL)).thenReturn("nothing to analyze");

        assertThat(service.analyze("query", pdf)).isEqualTo("nothing to analyze");
        verify(analysisEngine).analyze(eq("query"), eq(ExtractedText.NO_TEXT_SENTINEL));
    }

    @Test
    void testAsyncFailureCarriesOriginalException() throws Exception {
        Path pdf = TestPdfFactory.write(tempDir, "report.pdf", TestPdfFactory.pdfWithPages("EBITDA: 5M"));
        when(analysisEngine.analyze(eq("query"), anyString()))
                .thenThrow(new AnalysisFailureException("analysis failed at step 1: down"));

        assertThatThrownBy(() -> service.analyzeAsync("query", pdf).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AnalysisFailureException.class);
    }
}
