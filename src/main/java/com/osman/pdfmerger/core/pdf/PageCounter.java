package com.osman.pdfmerger.core.pdf;

import com.osman.pdfmerger.core.model.DocumentSource;
import com.osman.pdfmerger.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports page counts without keeping documents open. An unreadable source counts as zero pages.
 */
public class PageCounter {

    private static final Logger LOGGER = AppLogger.get();

    public int count(DocumentSource source) {
        try (PDDocument document = source.open()) {
            return document.getNumberOfPages();
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Error getting page count for " + source + ": " + ex.getMessage(), ex);
            return 0;
        }
    }

    /**
     * Counts every source, one task per document when {@code threads > 1}. Counts are returned in
     * input order.
     */
    public List<Integer> countAll(List<DocumentSource> sources, int threads) {
        List<Integer> counts = new ArrayList<>(sources.size());
        if (threads <= 1 || sources.size() <= 1) {
            for (DocumentSource source : sources) {
                counts.add(count(source));
            }
            return counts;
        }

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "PageCount-Worker");
            t.setDaemon(true);
            return t;
        };
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, sources.size()), tf);
        try {
            List<Future<Integer>> futures = new ArrayList<>(sources.size());
            for (DocumentSource source : sources) {
                futures.add(pool.submit(() -> count(source)));
            }
            for (int i = 0; i < futures.size(); i++) {
                counts.add(await(futures.get(i), sources.get(i)));
            }
            return counts;
        } finally {
            pool.shutdownNow();
        }
    }

    private static int await(Future<Integer> future, DocumentSource source) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting " + source, ex);
        } catch (ExecutionException ex) {
            LOGGER.log(Level.WARNING, "Error getting page count for " + source, ex.getCause());
            return 0;
        }
    }
}
