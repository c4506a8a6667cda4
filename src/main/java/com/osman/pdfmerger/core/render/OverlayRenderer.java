package com.osman.pdfmerger.core.render;

import com.osman.pdfmerger.core.model.FooterSpec;

import java.io.IOException;
import java.util.Objects;

/**
 * Renders the footer-only stamp merged onto every copied page.
 */
public class OverlayRenderer {

    private final FooterPainter footer;

    public OverlayRenderer() {
        this(new FooterBand());
    }

    public OverlayRenderer(FooterPainter footer) {
        this.footer = Objects.requireNonNull(footer, "footer");
    }

    public Stamp renderFooter(FooterSpec spec) throws IOException {
        Objects.requireNonNull(spec, "spec");
        return Stamp.render((stream, box) -> footer.paintFooter(stream, box, spec));
    }
}
