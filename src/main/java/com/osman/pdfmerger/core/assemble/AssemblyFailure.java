package com.osman.pdfmerger.core.assemble;

/**
 * Kinds of failure that end a run without output.
 */
public enum AssemblyFailure {
    /** The main report could not be opened or its pages could not be read. */
    FATAL_INPUT,
    /** The merged document could not be written to its destination. */
    FATAL_OUTPUT
}
