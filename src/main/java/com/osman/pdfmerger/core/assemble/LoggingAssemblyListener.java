package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.core.assemble.AssemblyPlan.PlannedDocument;
import com.osman.pdfmerger.logging.AppLogger;
import com.osman.pdfmerger.logging.MergeLogRecord;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forwards run events to the application logger as {@link MergeLogRecord}s, so handlers such as the
 * database handler can store phase and page coordinates apart from the message.
 */
public final class LoggingAssemblyListener implements AssemblyListener {

    private final Logger logger;

    public LoggingAssemblyListener() {
        this(AppLogger.get());
    }

    public LoggingAssemblyListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onPhase(AssemblyPhase from, AssemblyPhase to) {
        Level level = to == AssemblyPhase.FAILED_FATAL ? Level.SEVERE : Level.INFO;
        log(new MergeLogRecord(level, "Phase {0} -> {1}", from, to).phase(to.name()));
    }

    @Override
    public void onPlan(AssemblyPlan plan) {
        for (PlannedDocument doc : plan.documents()) {
            log(new MergeLogRecord(Level.INFO, "Planned {0} {1}: {2,number,#} pages (+{3,number,#} cover)",
                doc.role(), doc.source().name(), doc.countedPages(), doc.coverPages())
                .phase(AssemblyPhase.COUNTING_PAGES.name())
                .source(doc.source().name()));
        }
        log(new MergeLogRecord(Level.INFO, "Total calculated pages: {0,number,#}", plan.totalPages())
            .phase(AssemblyPhase.COUNTING_PAGES.name()));
    }

    @Override
    public void onPageEmitted(PageEvent event) {
        MergeLogRecord record = switch (event.kind()) {
            case COVER -> new MergeLogRecord(Level.INFO,
                "#{0,number,#} Added cover page for {1} as page {2,number,#} of {3,number,#}",
                event.sequence(), event.sourceName(), event.outputPage(), event.totalPages());
            case MAIN_PAGE, TRIAL_PAGE -> new MergeLogRecord(Level.INFO,
                "#{0,number,#} Added {1} page {2,number,#} as page {3,number,#} of {4,number,#}",
                event.sequence(), event.sourceName(), event.sourcePage(), event.outputPage(), event.totalPages());
        };
        log(record.source(event.sourceName())
            .page(event.kind().name(), event.sequence(), event.outputPage(), event.totalPages()));
    }

    @Override
    public void onTrialFailed(TrialFailure failure) {
        log(new MergeLogRecord(Level.WARNING,
            "Error processing trial PDF {0} ({1}): {2} [{3}]; {4,number,#} body pages kept",
            failure.title(), failure.sourceName(), failure.message(), failure.exceptionType(), failure.pagesKept())
            .phase(AssemblyPhase.EMITTING_TRIALS.name())
            .source(failure.sourceName()));
    }

    private void log(MergeLogRecord record) {
        if (!logger.isLoggable(record.getLevel())) {
            return;
        }
        record.setLoggerName(logger.getName());
        logger.log(record);
    }
}
