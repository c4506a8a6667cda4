package com.osman.pdfmerger.core.model;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Locator of an input PDF: either a file on disk or an in-memory buffer with a caller-supplied name.
 * Each {@link #open()} loads a fresh document, so a source can be counted and later copied.
 */
public final class DocumentSource {

    private final String name;
    private final Path path;
    private final byte[] bytes;

    private DocumentSource(String name, Path path, byte[] bytes) {
        this.name = name;
        this.path = path;
        this.bytes = bytes;
    }

    public static DocumentSource of(Path path) {
        Objects.requireNonNull(path, "path");
        Path fileName = path.getFileName();
        return new DocumentSource(fileName == null ? path.toString() : fileName.toString(), path, null);
    }

    public static DocumentSource ofBytes(String name, byte[] bytes) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bytes, "bytes");
        return new DocumentSource(name, null, bytes.clone());
    }

    /**
     * Loads the document. The caller owns the result and must close it.
     */
    public PDDocument open() throws IOException {
        if (path != null) {
            if (!Files.isRegularFile(path)) {
                throw new IOException("PDF not found: " + path);
            }
            return PDDocument.load(path.toFile());
        }
        return PDDocument.load(bytes);
    }

    public String name() {
        return name;
    }

    /**
     * Cover title for this source: the file name without directories and without its final extension.
     */
    public String title() {
        String base = name;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    public boolean isFile() {
        return path != null;
    }

    /**
     * @return the backing file, or {@code null} for in-memory sources
     */
    public Path path() {
        return path;
    }

    @Override
    public String toString() {
        return path != null ? path.toString() : name + " (in memory)";
    }
}
