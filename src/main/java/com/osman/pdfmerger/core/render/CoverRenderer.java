package com.osman.pdfmerger.core.render;

import com.osman.pdfmerger.core.model.FooterSpec;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.awt.Color;
import java.io.IOException;
import java.util.Objects;

/**
 * Renders the cover page placed in front of each trial report: the trial title in large bold type at
 * mid-page plus the regular footer.
 */
public class CoverRenderer {

    static final PDFont TITLE_FONT = PDType1Font.HELVETICA_BOLD;
    static final float TITLE_FONT_SIZE = 24f;

    private final FooterPainter footer;

    public CoverRenderer() {
        this(new FooterBand());
    }

    public CoverRenderer(FooterPainter footer) {
        this.footer = Objects.requireNonNull(footer, "footer");
    }

    public Stamp renderCover(String title, FooterSpec spec) throws IOException {
        Objects.requireNonNull(spec, "spec");
        String text = title == null ? "" : title;
        return Stamp.render((stream, box) -> {
            float titleWidth = PdfText.width(TITLE_FONT, TITLE_FONT_SIZE, text);
            float centerX = box.getWidth() / 2f;
            float centerY = box.getHeight() / 2f;
            stream.setNonStrokingColor(Color.BLACK);
            PdfText.draw(stream, TITLE_FONT, TITLE_FONT_SIZE, text, centerX - titleWidth / 2f, centerY);
            footer.paintFooter(stream, box, spec);
        });
    }
}
