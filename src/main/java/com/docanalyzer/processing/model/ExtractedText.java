package com.docanalyzer.processing.model;

import java.nio.file.Path;

/**
 * Outcome of extracting text from a document.
 * The three cases are normal results, not errors: the text is handed to the
 * analysis engine as-is, so a missing file or an empty document still yields
 * a descriptive string.
 */
public final class ExtractedText {

    public static final String NO_TEXT_SENTINEL = "(No text extracted from PDF)";

    public enum Outcome {
        EXTRACTED,
        NOT_FOUND,
        NO_TEXT
    }

    private final Outcome outcome;
    private final String text;
    private final int pageCount;

    private ExtractedText(Outcome outcome, String text, int pageCount) {
        this.outcome = outcome;
        this.text = text;
        this.pageCount = pageCount;
    }

    public static ExtractedText extracted(String text, int pageCount) {
        return new ExtractedText(Outcome.EXTRACTED, text, pageCount);
    }

    public static ExtractedText notFound(Path path) {
        return new ExtractedText(Outcome.NOT_FOUND, "Error: File not found at path: " + path, 0);
    }

    public static ExtractedText noText(int pageCount) {
        return new ExtractedText(Outcome.NO_TEXT, NO_TEXT_SENTINEL, pageCount);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Text to feed downstream. Never empty.
     */
    public String getText() {
        return text;
    }

    public int getPageCount() {
        return pageCount;
    }

    public boolean isFound() {
        return outcome != Outcome.NOT_FOUND;
    }
}
