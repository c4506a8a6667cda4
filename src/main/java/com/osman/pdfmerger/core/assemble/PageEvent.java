package com.osman.pdfmerger.core.assemble;

/**
 * One emitted output page.
 *
 * @param sequence   1-based emission order within the run
 * @param sourceName document the page came from (for covers, the trial it introduces)
 * @param kind       main page, cover or trial page
 * @param sourcePage 1-based page index within the source, 0 for covers
 * @param outputPage number printed in the footer
 * @param totalPages total printed in the footer
 */
public record PageEvent(int sequence, String sourceName, PageKind kind, int sourcePage, int outputPage,
                        int totalPages) {
}
