package com.osman.pdfmerger.core.assemble;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a run that produced an output file.
 *
 * @param plannedPages total computed before emission and printed on every footer
 * @param emittedPages pages actually written
 */
public record AssemblyResult(Path output, int plannedPages, int emittedPages, List<TrialFailure> trialFailures) {

    public AssemblyResult {
        trialFailures = List.copyOf(trialFailures);
    }

    public boolean hasTrialFailures() {
        return !trialFailures.isEmpty();
    }

    /**
     * The printed total is only trustworthy when every planned page was emitted.
     */
    public boolean isComplete() {
        return plannedPages == emittedPages && trialFailures.isEmpty();
    }
}
