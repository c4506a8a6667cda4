package com.osman.pdfmerger.core.pdf;

import com.osman.pdfmerger.logging.AppLogger;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Append-only accumulator of finished pages. Pages are kept as serialized segments so every input
 * document can be closed as soon as its pages are stamped; the segments are merged into one file
 * exactly once by {@link #writeTo(Path)}.
 */
public final class OutputDocument {

    public record Segment(String source, int pageCount, byte[] pdf) {
        public Segment {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(pdf, "pdf");
            if (pageCount < 0) {
                throw new IllegalArgumentException("pageCount must not be negative");
            }
        }
    }

    private final List<Segment> segments = new ArrayList<>();
    private int pageCount;

    /**
     * Appends every page of {@code document}, which stays owned (and open) for the caller.
     */
    public void append(String source, PDDocument document) throws IOException {
        int pages = document.getNumberOfPages();
        if (pages == 0) {
            return;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        append(new Segment(source, pages, out.toByteArray()));
    }

    public void append(Segment segment) {
        segments.add(segment);
        pageCount += segment.pageCount();
    }

    public int pageCount() {
        return pageCount;
    }

    public List<Segment> segments() {
        return Collections.unmodifiableList(segments);
    }

    /**
     * Merges all segments into {@code destination}. The file is first written next to the
     * destination and then moved into place, so a failed write never leaves a partial PDF behind.
     */
    public void writeTo(Path destination) throws IOException {
        Path absolute = destination.toAbsolutePath();
        Path temp = Files.createTempFile(absolute.getParent(), ".pdfmerger-", ".tmp");
        boolean moved = false;
        try {
            if (segments.isEmpty()) {
                try (PDDocument empty = new PDDocument()) {
                    empty.save(temp.toFile());
                }
            } else {
                PDFMergerUtility mu = new PDFMergerUtility();
                mu.setDestinationFileName(temp.toString());
                for (Segment segment : segments) {
                    mu.addSource(new ByteArrayInputStream(segment.pdf()));
                }
                mu.mergeDocuments(MemoryUsageSetting.setupMainMemoryOnly());
            }
            moveIntoPlace(temp, absolute);
            moved = true;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            AppLogger.get().log(Level.FINE, "Could not delete temporary file " + path, ex);
        }
    }
}
