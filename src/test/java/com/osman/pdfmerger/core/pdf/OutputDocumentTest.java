package com.osman.pdfmerger.core.pdf;

import com.osman.pdfmerger.PdfFixtures;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void writesSegmentsInAppendOrder() throws Exception {
        OutputDocument output = new OutputDocument();
        try (PDDocument first = PdfFixtures.createPdf("First", 2);
             PDDocument second = PdfFixtures.createPdf("Second", 1)) {
            output.append("first.pdf", first);
            output.append("second.pdf", second);
        }
        assertEquals(3, output.pageCount());
        assertEquals(2, output.segments().size());

        Path destination = tempDir.resolve("merged.pdf");
        output.writeTo(destination);

        try (PDDocument merged = PDDocument.load(destination.toFile())) {
            assertEquals(3, merged.getNumberOfPages());
            assertTrue(PdfFixtures.pageText(merged, 1).contains("First body 1"));
            assertTrue(PdfFixtures.pageText(merged, 2).contains("First body 2"));
            assertTrue(PdfFixtures.pageText(merged, 3).contains("Second body 1"));
        }
        assertEquals(1, listDirectory().length, "only the merged file should remain");
    }

    @Test
    void emptyDocumentsAreSkipped() throws Exception {
        OutputDocument output = new OutputDocument();
        try (PDDocument empty = new PDDocument()) {
            output.append("empty.pdf", empty);
        }

        assertEquals(0, output.pageCount());
        assertTrue(output.segments().isEmpty());
    }

    @Test
    void writesValidFileWhenNothingWasAppended() throws Exception {
        Path destination = tempDir.resolve("empty.pdf");

        new OutputDocument().writeTo(destination);

        try (PDDocument doc = PDDocument.load(destination.toFile())) {
            assertEquals(0, doc.getNumberOfPages());
        }
    }

    @Test
    void replacesExistingDestination() throws Exception {
        Path destination = PdfFixtures.writePdf(tempDir.resolve("out.pdf"), "Stale", 5);
        OutputDocument output = new OutputDocument();
        output.append(new OutputDocument.Segment("fresh.pdf", 1, PdfFixtures.pdfBytes("Fresh", 1)));

        output.writeTo(destination);

        try (PDDocument doc = PDDocument.load(destination.toFile())) {
            assertEquals(1, doc.getNumberOfPages());
            assertTrue(PdfFixtures.pageText(doc, 1).contains("Fresh body 1"));
        }
    }

    @Test
    void failedWriteLeavesNoTemporaryFile() throws Exception {
        OutputDocument output = new OutputDocument();
        output.append(new OutputDocument.Segment("broken.pdf", 1, "not a pdf".getBytes()));
        Path destination = tempDir.resolve("out.pdf");

        assertThrows(IOException.class, () -> output.writeTo(destination));

        assertFalse(Files.exists(destination));
        assertEquals(0, listDirectory().length);
    }

    @Test
    void rejectsNegativeSegmentSize() {
        assertThrows(IllegalArgumentException.class,
            () -> new OutputDocument.Segment("x.pdf", -1, new byte[0]));
    }

    private Path[] listDirectory() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.toArray(Path[]::new);
        }
    }
}
