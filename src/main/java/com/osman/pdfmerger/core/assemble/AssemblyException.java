package com.osman.pdfmerger.core.assemble;

import java.util.Objects;

/**
 * Thrown when a run fails fatally. Carries the failure kind, the phase the run was in and, when one
 * document is to blame, that document's name.
 */
public class AssemblyException extends Exception {

    private final AssemblyFailure kind;
    private final AssemblyPhase phase;
    private final String sourceName;

    public AssemblyException(AssemblyFailure kind, AssemblyPhase phase, String sourceName, String message,
                             Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.phase = Objects.requireNonNull(phase, "phase");
        this.sourceName = sourceName;
    }

    public AssemblyFailure kind() {
        return kind;
    }

    public AssemblyPhase phase() {
        return phase;
    }

    /**
     * @return the implicated document, or {@code null} when the failure is not tied to one input
     */
    public String sourceName() {
        return sourceName;
    }
}
