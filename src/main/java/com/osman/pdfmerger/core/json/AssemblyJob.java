package com.osman.pdfmerger.core.json;

import com.osman.pdfmerger.core.model.DocumentSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one merge: the main report, the trial reports in output order, the optional footer title
 * and the optional destination (when absent the caller picks a default).
 */
public record AssemblyJob(Path main, List<Path> trials, String reportTitle, Path output) {

    public AssemblyJob {
        Objects.requireNonNull(main, "main");
        trials = List.copyOf(trials);
        reportTitle = (reportTitle == null || reportTitle.isBlank()) ? null : reportTitle;
    }

    public DocumentSource mainSource() {
        return DocumentSource.of(main);
    }

    public List<DocumentSource> trialSources() {
        return trials.stream().map(DocumentSource::of).toList();
    }

    public AssemblyJob withReportTitle(String title) {
        return new AssemblyJob(main, trials, title, output);
    }

    public AssemblyJob withOutput(Path destination) {
        return new AssemblyJob(main, trials, reportTitle, destination);
    }
}
