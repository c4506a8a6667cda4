package com.osman.pdfmerger.core.assemble;

/**
 * Receives the events of a merge run. All callbacks happen on the assembling thread, in emission order.
 */
public interface AssemblyListener {

    AssemblyListener NONE = new AssemblyListener() {
    };

    default void onPhase(AssemblyPhase from, AssemblyPhase to) {
    }

    default void onPlan(AssemblyPlan plan) {
    }

    default void onPageEmitted(PageEvent event) {
    }

    default void onTrialFailed(TrialFailure failure) {
    }
}
