package com.osman.pdfmerger;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small PDFs for tests. Every page carries one line, {@code "<label> body <n>"}.
 */
public final class PdfFixtures {

    private PdfFixtures() {
    }

    public static Path writePdf(Path path, String label, int pages) throws IOException {
        try (PDDocument doc = createPdf(label, pages)) {
            doc.save(path.toFile());
        }
        return path;
    }

    public static byte[] pdfBytes(String label, int pages) throws IOException {
        try (PDDocument doc = createPdf(label, pages)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    public static Path writeGarbage(Path path) throws IOException {
        Files.write(path, "this is not a PDF".getBytes(StandardCharsets.UTF_8));
        return path;
    }

    public static PDDocument createPdf(String label, int pages) throws IOException {
        PDDocument doc = new PDDocument();
        for (int i = 1; i <= pages; i++) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(doc, page)) {
                stream.beginText();
                stream.setFont(PDType1Font.HELVETICA, 12);
                stream.newLineAtOffset(72, 700);
                stream.showText(label + " body " + i);
                stream.endText();
            }
        }
        return doc;
    }

    public static String pageText(PDDocument doc, int pageNumber) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(doc);
    }
}
