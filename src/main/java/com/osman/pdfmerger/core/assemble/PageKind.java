package com.osman.pdfmerger.core.assemble;

public enum PageKind {
    MAIN_PAGE,
    COVER,
    TRIAL_PAGE
}
