package com.osman.pdfmerger.core.render;

import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

/**
 * Text helpers shared by the renderers. Standard 14 fonts only cover WinAnsi, so characters outside
 * that encoding are shown as '?' instead of failing the whole page.
 */
final class PdfText {

    private static final String REPLACEMENT = "?";

    private PdfText() {
    }

    static void draw(PDPageContentStream stream, PDFont font, float size, String text, float x, float y)
            throws IOException {
        stream.beginText();
        stream.setFont(font, size);
        stream.newLineAtOffset(x, y);
        stream.showText(encodable(font, text));
        stream.endText();
    }

    static float width(PDFont font, float size, String text) throws IOException {
        return font.getStringWidth(encodable(font, text)) / 1000f * size;
    }

    static String encodable(PDFont font, String text) throws IOException {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            String glyph = new String(Character.toChars(codePoint));
            offset += Character.charCount(codePoint);
            if (Character.isISOControl(codePoint)) {
                sb.append(' ');
                continue;
            }
            try {
                font.encode(glyph);
                sb.append(glyph);
            } catch (IllegalArgumentException unsupported) {
                sb.append(REPLACEMENT);
            }
        }
        return sb.toString();
    }
}
