package com.osman.pdfmerger.config;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the merger can remember the last report title
 * between runs.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/osman/pdfmerger";
    private static final Logger LOGGER = Logger.getLogger(PreferencesStore.class.getName());

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public static PreferencesStore forNode(Preferences node) {
        return new PreferencesStore(node);
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.FINE, "Preferences not flushed: " + ex.getMessage(), ex);
        }
    }
}
