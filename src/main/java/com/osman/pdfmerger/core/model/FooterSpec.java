package com.osman.pdfmerger.core.model;

/**
 * Parameters of one rendered footer: the running page number, the frozen run total and the
 * optional report title shown on the left.
 */
public record FooterSpec(int pageNumber, int totalPages, String reportTitle) {

    public FooterSpec {
        if (totalPages < 1) {
            throw new IllegalArgumentException("totalPages must be positive: " + totalPages);
        }
        if (pageNumber < 1 || pageNumber > totalPages) {
            throw new IllegalArgumentException(
                "pageNumber " + pageNumber + " outside 1.." + totalPages);
        }
        reportTitle = (reportTitle == null || reportTitle.isBlank()) ? null : reportTitle;
    }

    public FooterSpec(int pageNumber, int totalPages) {
        this(pageNumber, totalPages, null);
    }

    public boolean hasReportTitle() {
        return reportTitle != null;
    }

    public String pageLabel() {
        return "Page " + pageNumber + " of " + totalPages;
    }
}
