package com.docanalyzer.processing;

import com.docanalyzer.processing.model.ExtractedText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads the text layer of a PDF with PDFBox (no OCR).
 * Stateless; a missing file is a normal result rather than an exception.
 */
@Service
public class DocumentTextExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTextExtractor.class);
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\n{2,}");

    /**
     * Extracts page text, collapsing runs of empty lines into a single line break.
     *
     * @param path location of the document
     * @return extracted text, or a not-found / no-text result
     * @throws IOException if the file exists but cannot be parsed as a PDF
     */
    public ExtractedText extract(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            logger.warn("Document not found for extraction: {}", path);
            return ExtractedText.notFound(path);
        }

        StringBuilder fullText = new StringBuilder();
        int totalPages;
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            totalPages = document.getNumberOfPages();

            for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                fullText.append(normalize(stripper.getText(document))).append('\n');
            }
        }

        String text = fullText.toString().strip();
        logger.info("Extracted {} characters from {} page(s) of {}", text.length(), totalPages, path.getFileName());
        if (text.isEmpty()) {
            return ExtractedText.noText(totalPages);
        }
        return ExtractedText.extracted(text, totalPages);
    }

    static String normalize(String pageText) {
        if (pageText == null) {
            return "";
        }
        String unixLines = pageText.replace("\r\n", "\n").replace('\r', '\n');
        return BLANK_LINE_RUNS.matcher(unixLines).replaceAll("\n");
    }
}
