package com.osman.pdfmerger.core.render;

import com.osman.pdfmerger.core.model.FooterSpec;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.io.IOException;

/**
 * Draws the footer band described by a {@link FooterSpec} into an open content stream.
 */
public interface FooterPainter {

    void paintFooter(PDPageContentStream stream, PDRectangle pageBox, FooterSpec spec) throws IOException;
}
