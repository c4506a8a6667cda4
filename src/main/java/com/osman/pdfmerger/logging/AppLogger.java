package com.osman.pdfmerger.logging;

import com.osman.pdfmerger.config.ConfigService;

import java.io.IOException;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the application.
 */
public final class AppLogger {
    public static final String LOGGER_NAME = "com.osman.pdfmerger";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return "%s %s%n".formatted(record.getLevel().getName(), render(record));
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (IOException ex) {
            logger.fine("Console handler keeps the platform encoding: " + ex.getMessage());
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        ConfigService config = ConfigService.getInstance();
        config.logFile().ifPresent(path -> attachFileHandler(logger, path, formatter));
        DatabaseLogHandler.JdbcSettings.from(config).ifPresentOrElse(
            settings -> attachDatabaseHandler(logger, settings),
            () -> logger.fine("Central logging disabled: no JDBC URL configured"));
        return logger;
    }

    private static void attachDatabaseHandler(Logger logger, DatabaseLogHandler.JdbcSettings settings) {
        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler(settings);
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (RuntimeException ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
    }

    private static void attachFileHandler(Logger logger, Path logFile, Formatter formatter) {
        try {
            FileHandler fileHandler = new FileHandler(logFile.toAbsolutePath().toString(), true);
            fileHandler.setEncoding(UTF_8.name());
            fileHandler.setFormatter(formatter);
            fileHandler.setLevel(Level.ALL);
            logger.addHandler(fileHandler);
        } catch (IOException | SecurityException ex) {
            logger.warning("Log file " + logFile + " unavailable: " + ex.getMessage());
        }
    }

    static String render(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }
}
