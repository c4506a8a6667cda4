package com.osman.pdfmerger.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class AppLoggerTest {

    @Test
    void sharesOneNamedLogger() {
        assertSame(AppLogger.get(), AppLogger.get());
        assertEquals(AppLogger.LOGGER_NAME, AppLogger.get().getName());
    }

    @Test
    void rendersParameterizedRecords() {
        LogRecord record = new LogRecord(Level.INFO, "Added {0} page {1,number,#} as page {2,number,#} of {3,number,#}");
        record.setParameters(new Object[]{"main.pdf", 2, 1002, 1200});

        assertEquals("Added main.pdf page 2 as page 1002 of 1200", AppLogger.render(record));
    }

    @Test
    void leavesPlainMessagesUntouched() {
        assertEquals("Writing final PDF to out.pdf",
            AppLogger.render(new LogRecord(Level.INFO, "Writing final PDF to out.pdf")));
    }
}
