package com.docanalyzer;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small, deterministic PDF fixtures with Apache PDFBox.
 */
public final class TestPdfFactory {

    private TestPdfFactory() {
    }

    /**
     * One page per argument, each showing a single line of Helvetica text.
     */
    public static byte[] pdfWithPages(String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(font, 12);
                    contentStream.newLineAtOffset(50, 750);
                    contentStream.showText(text);
                    contentStream.endText();
                }
            }
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * A valid PDF whose single page carries no text at all.
     */
    public static byte[] blankPdf() throws IOException {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * Starts with the PDF header but is not parseable.
     */
    public static byte[] corruptPdf() {
        return "%PDF-1.7\nthis is not really a pdf".getBytes(StandardCharsets.US_ASCII);
    }

    public static Path write(Path directory, String fileName, byte[] content) throws IOException {
        return Files.write(directory.resolve(fileName), content);
    }
}
