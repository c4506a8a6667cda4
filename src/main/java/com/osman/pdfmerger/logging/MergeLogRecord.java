package com.osman.pdfmerger.logging;

import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Log record of a merge run event. Besides the formatted message it carries the run phase and the
 * page coordinates as separate fields, which {@link DatabaseLogHandler} stores in their own columns.
 */
public final class MergeLogRecord extends LogRecord {

    private static final long serialVersionUID = 1L;

    private String phase;
    private String sourceName;
    private String pageKind;
    private Integer sequence;
    private Integer outputPage;
    private Integer totalPages;

    public MergeLogRecord(Level level, String pattern, Object... params) {
        super(level, pattern);
        setParameters(params);
    }

    public MergeLogRecord phase(String phase) {
        this.phase = phase;
        return this;
    }

    public MergeLogRecord source(String sourceName) {
        this.sourceName = sourceName;
        return this;
    }

    public MergeLogRecord page(String pageKind, int sequence, int outputPage, int totalPages) {
        this.pageKind = pageKind;
        this.sequence = sequence;
        this.outputPage = outputPage;
        this.totalPages = totalPages;
        return this;
    }

    public String getPhase() {
        return phase;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getPageKind() {
        return pageKind;
    }

    public Integer getSequence() {
        return sequence;
    }

    public Integer getOutputPage() {
        return outputPage;
    }

    public Integer getTotalPages() {
        return totalPages;
    }
}
