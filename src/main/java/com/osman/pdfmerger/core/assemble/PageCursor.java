package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.core.model.FooterSpec;

/**
 * Running page number of one run, owned by the assembler for the run's duration. The number only
 * moves forward, and only by the pages actually placed in the output.
 */
final class PageCursor {

    private final int totalPages;
    private final String reportTitle;
    private int current = 1;

    PageCursor(int totalPages, String reportTitle) {
        this.totalPages = totalPages;
        this.reportTitle = reportTitle;
    }

    /**
     * Footer for the page {@code offset} places after the next unplaced one. Does not move the cursor.
     */
    FooterSpec peek(int offset) {
        int number = current + offset;
        // a page beyond the planned total is numbered against itself so the footer stays valid
        return new FooterSpec(number, Math.max(totalPages, number), reportTitle);
    }

    void advance(int pages) {
        if (pages < 0) {
            throw new IllegalArgumentException("Cannot move back by " + (-pages) + " pages");
        }
        current += pages;
    }
}
