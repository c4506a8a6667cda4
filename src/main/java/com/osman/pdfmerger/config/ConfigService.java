package com.osman.pdfmerger.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * <p>
 * Every key is looked up as a system property first, then as an environment variable (upper case,
 * dots replaced by underscores), then in {@code pdfmerger.properties} on the classpath.
 */
public final class ConfigService {
    public static final String OUTPUT_SUFFIX_KEY = "pdfmerger.output.suffix";
    public static final String COUNT_THREADS_KEY = "pdfmerger.count.threads";
    public static final String LOG_FILE_KEY = "pdfmerger.log.file";

    private static final String PROPERTIES_RESOURCE = "pdfmerger.properties";
    private static final String DEFAULT_OUTPUT_SUFFIX = "_WithCovers";
    private static final String PREF_KEY_REPORT_TITLE = "report.title";

    private static final ConfigService INSTANCE =
        new ConfigService(PreferencesStore.global(), loadFileProperties());

    private final PreferencesStore preferences;
    private final Properties fileProperties;

    ConfigService(PreferencesStore preferences, Properties fileProperties) {
        this.preferences = preferences;
        this.fileProperties = fileProperties;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Creates a service backed by the given preferences instead of the user-wide store.
     */
    public static ConfigService withPreferences(PreferencesStore preferences) {
        return new ConfigService(preferences, loadFileProperties());
    }

    public String outputSuffix() {
        String suffix = resolve(OUTPUT_SUFFIX_KEY);
        return suffix == null ? DEFAULT_OUTPUT_SUFFIX : suffix;
    }

    public int countThreads() {
        return Math.max(1, intValue(COUNT_THREADS_KEY, 1));
    }

    public Optional<Path> logFile() {
        return Optional.ofNullable(resolve(LOG_FILE_KEY)).map(Path::of);
    }

    public Optional<String> lastReportTitle() {
        return preferences.getString(PREF_KEY_REPORT_TITLE);
    }

    public void rememberReportTitle(String reportTitle) {
        if (reportTitle == null || reportTitle.isBlank()) return;
        preferences.putString(PREF_KEY_REPORT_TITLE, reportTitle);
    }

    /**
     * Default destination for a merge: {@code <main>_WithCovers.pdf} next to the main report.
     */
    public Path defaultOutputFor(Path mainPdf) {
        String fileName = mainPdf.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return mainPdf.toAbsolutePath().getParent().resolve(base + outputSuffix() + ".pdf");
    }

    /**
     * Looks up any key with the usual precedence; blank values count as absent.
     */
    public Optional<String> value(String key) {
        return Optional.ofNullable(resolve(key));
    }

    /**
     * Integer variant of {@link #value(String)}; unparsable values fall back to {@code defaultValue}.
     */
    public int intValue(String key, int defaultValue) {
        String raw = resolve(key);
        try {
            return raw == null ? defaultValue : Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private String resolve(String key) {
        return firstNonBlank(
            System.getProperty(key),
            System.getenv(environmentName(key)),
            fileProperties.getProperty(key)
        );
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class
            .getClassLoader()
            .getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unreadable " + PROPERTIES_RESOURCE, ex);
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
