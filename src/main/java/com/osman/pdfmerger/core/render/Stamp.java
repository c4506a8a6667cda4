package com.osman.pdfmerger.core.render;

import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * A freshly rendered single page, either a footer overlay or a complete cover. Stamps live only
 * for one page-processing step and must be closed after use.
 */
public final class Stamp implements AutoCloseable {

    static final PDRectangle PAGE_SIZE = PDRectangle.LETTER;

    @FunctionalInterface
    interface Content {
        void draw(PDPageContentStream stream, PDRectangle pageBox) throws IOException;
    }

    private final PDDocument document;
    private final PDPage page;

    private Stamp(PDDocument document, PDPage page) {
        this.document = document;
        this.page = page;
    }

    static Stamp render(Content content) throws IOException {
        PDDocument document = new PDDocument();
        try {
            PDPage page = new PDPage(PAGE_SIZE);
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                content.draw(stream, page.getMediaBox());
            }
            return new Stamp(document, page);
        } catch (IOException | RuntimeException ex) {
            document.close();
            throw ex;
        }
    }

    public PDRectangle mediaBox() {
        return page.getMediaBox();
    }

    /**
     * Composites this stamp over {@code target}'s existing content. The original content stream is
     * wrapped in a saved graphics state and the stamp is anchored at the media box's lower-left corner.
     */
    public void mergeOnto(PDDocument targetDocument, PDPage target) throws IOException {
        PDFormXObject form = new LayerUtility(targetDocument).importPageAsForm(document, 0);
        PDRectangle box = target.getMediaBox();
        try (PDPageContentStream stream =
                 new PDPageContentStream(targetDocument, target, AppendMode.APPEND, true, true)) {
            stream.saveGraphicsState();
            stream.transform(Matrix.getTranslateInstance(box.getLowerLeftX(), box.getLowerLeftY()));
            stream.drawForm(form);
            stream.restoreGraphicsState();
        }
    }

    /**
     * Serializes the stamp as a standalone one-page PDF, used for cover pages.
     */
    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
