package com.osman.pdfmerger.core.render;

import com.osman.pdfmerger.core.model.FooterSpec;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.awt.Color;
import java.io.IOException;

/**
 * Standard footer: a white band hiding whatever footer the page already had, the report title on the
 * left, a centered "Page N of Total" label and a gray rule separating the band from the body.
 */
public final class FooterBand implements FooterPainter {

    static final float INCH = 72f;
    static final float BAND_HEIGHT = 0.7f * INCH;
    static final float TEXT_BASELINE = 0.25f * INCH;
    static final float SIDE_MARGIN = 0.5f * INCH;
    static final float RULE_Y = 0.5f * INCH;
    static final PDFont FONT = PDType1Font.HELVETICA;
    static final float FONT_SIZE = 10f;

    private static final Color RULE_COLOR = new Color(128, 128, 128);

    @Override
    public void paintFooter(PDPageContentStream stream, PDRectangle pageBox, FooterSpec spec) throws IOException {
        float width = pageBox.getWidth();

        stream.setNonStrokingColor(Color.WHITE);
        stream.addRect(0, 0, width, BAND_HEIGHT);
        stream.fill();

        stream.setNonStrokingColor(Color.BLACK);
        if (spec.hasReportTitle()) {
            PdfText.draw(stream, FONT, FONT_SIZE, spec.reportTitle(), SIDE_MARGIN, TEXT_BASELINE);
        }

        String label = spec.pageLabel();
        float labelWidth = PdfText.width(FONT, FONT_SIZE, label);
        PdfText.draw(stream, FONT, FONT_SIZE, label, (width - labelWidth) / 2f, TEXT_BASELINE);

        stream.setStrokingColor(RULE_COLOR);
        stream.moveTo(SIDE_MARGIN, RULE_Y);
        stream.lineTo(width - SIDE_MARGIN, RULE_Y);
        stream.stroke();
    }
}
