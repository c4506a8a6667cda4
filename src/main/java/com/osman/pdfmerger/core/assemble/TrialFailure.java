package com.osman.pdfmerger.core.assemble;

/**
 * A trial report that could not be processed completely. Its cover page stays in the output, as do
 * the {@code pagesKept} body pages placed before the failure.
 */
public record TrialFailure(int trialIndex, String sourceName, String title, int pagesKept, String message,
                           String exceptionType) {

    static TrialFailure of(int trialIndex, String sourceName, String title, int pagesKept, Exception ex) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new TrialFailure(trialIndex, sourceName, title, pagesKept, message, ex.getClass().getName());
    }
}
