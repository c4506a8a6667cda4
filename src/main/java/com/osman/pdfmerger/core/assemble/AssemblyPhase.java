package com.osman.pdfmerger.core.assemble;

/**
 * Lifecycle of a single merge run. A run only moves forward; failed runs are started over.
 */
public enum AssemblyPhase {
    NOT_STARTED,
    COUNTING_PAGES,
    EMITTING_MAIN,
    EMITTING_TRIALS,
    SERIALIZING,
    SUCCEEDED,
    FAILED_FATAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_FATAL;
    }
}
