package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.config.ConfigService;
import com.osman.pdfmerger.core.model.DocumentSource;
import com.osman.pdfmerger.core.model.FooterSpec;
import com.osman.pdfmerger.core.pdf.OutputDocument;
import com.osman.pdfmerger.core.pdf.PageCounter;
import com.osman.pdfmerger.core.render.CoverRenderer;
import com.osman.pdfmerger.core.render.OverlayRenderer;
import com.osman.pdfmerger.core.render.Stamp;
import com.osman.pdfmerger.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the final report: the main PDF first, then every trial PDF behind its own cover page, with
 * a "Page N of Total" footer stamped on every output page.
 * <p>
 * A run has two passes. The planner counts every input and freezes the total; emission then walks
 * the inputs in order with a single page cursor. A failing main report aborts the run. A failing
 * trial is recorded and the run goes on; whatever of it was placed before the failure stays.
 */
public class DocumentAssembler {

    private static final Logger LOGGER = AppLogger.get();

    private final AssemblyPlanner planner;
    private final OverlayRenderer overlayRenderer;
    private final CoverRenderer coverRenderer;
    private final AssemblyListener listener;

    public DocumentAssembler() {
        this(new LoggingAssemblyListener());
    }

    public DocumentAssembler(AssemblyListener listener) {
        this(new AssemblyPlanner(new PageCounter(), ConfigService.getInstance().countThreads()),
            new OverlayRenderer(),
            new CoverRenderer(),
            listener);
    }

    public DocumentAssembler(AssemblyPlanner planner,
                             OverlayRenderer overlayRenderer,
                             CoverRenderer coverRenderer,
                             AssemblyListener listener) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.overlayRenderer = Objects.requireNonNull(overlayRenderer, "overlayRenderer");
        this.coverRenderer = Objects.requireNonNull(coverRenderer, "coverRenderer");
        this.listener = listener == null ? AssemblyListener.NONE : listener;
    }

    /**
     * Assembles {@code main} and {@code trials} into {@code destination}.
     *
     * @param reportTitle optional title printed on the left of every footer
     * @return the written file together with any trial that had to be skipped
     * @throws AssemblyException if the main report cannot be read or the output cannot be written;
     *                           nothing is left at {@code destination} in that case
     */
    public AssemblyResult assemble(DocumentSource main,
                                   List<DocumentSource> trials,
                                   String reportTitle,
                                   Path destination) throws AssemblyException {
        Objects.requireNonNull(main, "main");
        Objects.requireNonNull(destination, "destination");
        List<DocumentSource> trialList = trials == null ? List.of() : List.copyOf(trials);
        rejectInputAsDestination(destination, main, trialList);
        return new Run(main, trialList, reportTitle, destination).execute();
    }

    private static void rejectInputAsDestination(Path destination, DocumentSource main, List<DocumentSource> trials) {
        Path target = destination.toAbsolutePath().normalize();
        List<DocumentSource> inputs = new ArrayList<>(trials);
        inputs.add(main);
        for (DocumentSource input : inputs) {
            if (input.isFile() && input.path().toAbsolutePath().normalize().equals(target)) {
                throw new IllegalArgumentException("Output would overwrite input " + input);
            }
        }
    }

    /**
     * State of one run. Owns the cursor and the output accumulator; discarded when the run ends.
     */
    private final class Run {
        private final DocumentSource main;
        private final List<DocumentSource> trials;
        private final String reportTitle;
        private final Path destination;

        private final OutputDocument output = new OutputDocument();
        private final List<TrialFailure> trialFailures = new ArrayList<>();
        private AssemblyPhase phase = AssemblyPhase.NOT_STARTED;
        private PageCursor cursor;
        private int sequence;

        Run(DocumentSource main, List<DocumentSource> trials, String reportTitle, Path destination) {
            this.main = main;
            this.trials = trials;
            this.reportTitle = reportTitle;
            this.destination = destination;
        }

        AssemblyResult execute() throws AssemblyException {
            LOGGER.info("Starting PDF assembly: main=" + main.name() + ", trials=" + trials.size());

            transition(AssemblyPhase.COUNTING_PAGES);
            AssemblyPlan plan = planner.plan(main, trials);
            listener.onPlan(plan);
            cursor = new PageCursor(plan.totalPages(), reportTitle);

            transition(AssemblyPhase.EMITTING_MAIN);
            emitMain();

            transition(AssemblyPhase.EMITTING_TRIALS);
            for (int i = 0; i < trials.size(); i++) {
                emitTrial(i, trials.get(i));
            }

            transition(AssemblyPhase.SERIALIZING);
            LOGGER.info("Writing final PDF to " + destination);
            try {
                output.writeTo(destination);
            } catch (IOException | RuntimeException ex) {
                throw fail(AssemblyFailure.FATAL_OUTPUT, null, "Error writing final PDF: " + describe(ex), ex);
            }

            if (output.pageCount() != plan.totalPages()) {
                LOGGER.warning("Footers show a total of " + plan.totalPages() + " pages but "
                    + output.pageCount() + " pages were written");
            }
            transition(AssemblyPhase.SUCCEEDED);
            LOGGER.info("PDF assembly complete. Output: " + destination);
            return new AssemblyResult(destination, plan.totalPages(), output.pageCount(), trialFailures);
        }

        private void emitMain() throws AssemblyException {
            try (PDDocument document = main.open()) {
                List<PendingPage> stamped = new ArrayList<>(document.getNumberOfPages());
                stampPages(document, main.name(), PageKind.MAIN_PAGE, stamped);
                commit(main.name(), document, stamped);
            } catch (IOException | RuntimeException ex) {
                throw fail(AssemblyFailure.FATAL_INPUT, main.name(), "Error processing main PDF: " + describe(ex), ex);
            }
        }

        private void emitTrial(int index, DocumentSource trial) {
            String title = trial.title();
            LOGGER.info("Processing trial PDF " + (index + 1) + ": " + title);
            int bodyStart = -1;
            try {
                emitCover(trial, title);
                bodyStart = output.pageCount();
                try (PDDocument document = trial.open()) {
                    List<PendingPage> stamped = new ArrayList<>(document.getNumberOfPages());
                    try {
                        stampPages(document, trial.name(), PageKind.TRIAL_PAGE, stamped);
                    } catch (IOException | RuntimeException ex) {
                        keepStampedPages(trial, document, stamped, ex);
                        throw ex;
                    }
                    commit(trial.name(), document, stamped);
                }
            } catch (IOException | RuntimeException ex) {
                int kept = bodyStart < 0 ? 0 : output.pageCount() - bodyStart;
                TrialFailure failure = TrialFailure.of(index + 1, trial.name(), title, kept, ex);
                trialFailures.add(failure);
                LOGGER.log(Level.FINE, "Trial " + trial + " stopped after " + kept + " pages", ex);
                listener.onTrialFailed(failure);
            }
        }

        private void emitCover(DocumentSource trial, String title) throws IOException {
            FooterSpec spec = cursor.peek(0);
            try (Stamp cover = coverRenderer.renderCover(title, spec)) {
                output.append(new OutputDocument.Segment(trial.name(), 1, cover.toBytes()));
            }
            cursor.advance(1);
            publish(List.of(new PendingPage(trial.name(), PageKind.COVER, 0, spec)));
        }

        /**
         * Pages stamped before a failure stay in the output; the failing page and the rest are dropped.
         */
        private void keepStampedPages(DocumentSource trial, PDDocument document, List<PendingPage> stamped,
                                      Exception failure) {
            try {
                for (int i = document.getNumberOfPages() - 1; i >= stamped.size(); i--) {
                    document.removePage(i);
                }
                commit(trial.name(), document, stamped);
            } catch (IOException | RuntimeException ex) {
                failure.addSuppressed(ex);
            }
        }

        private void stampPages(PDDocument document, String sourceName, PageKind kind, List<PendingPage> stamped)
                throws IOException {
            int sourcePage = 0;
            for (PDPage page : document.getPages()) {
                sourcePage++;
                FooterSpec spec = cursor.peek(stamped.size());
                try (Stamp footer = overlayRenderer.renderFooter(spec)) {
                    footer.mergeOnto(document, page);
                }
                stamped.add(new PendingPage(sourceName, kind, sourcePage, spec));
            }
        }

        private void commit(String sourceName, PDDocument document, List<PendingPage> stamped) throws IOException {
            output.append(sourceName, document);
            cursor.advance(stamped.size());
            publish(stamped);
        }

        private void publish(List<PendingPage> pages) {
            for (PendingPage page : pages) {
                sequence++;
                listener.onPageEmitted(new PageEvent(
                    sequence,
                    page.sourceName(),
                    page.kind(),
                    page.sourcePage(),
                    page.spec().pageNumber(),
                    page.spec().totalPages()
                ));
            }
        }

        private void transition(AssemblyPhase next) {
            if (phase.isTerminal()) {
                throw new IllegalStateException("Run already ended in " + phase);
            }
            AssemblyPhase previous = phase;
            phase = next;
            listener.onPhase(previous, next);
        }

        private AssemblyException fail(AssemblyFailure kind, String sourceName, String message, Exception cause) {
            AssemblyPhase failedIn = phase;
            LOGGER.log(Level.SEVERE, message, cause);
            transition(AssemblyPhase.FAILED_FATAL);
            return new AssemblyException(kind, failedIn, sourceName, message, cause);
        }

        private String describe(Exception ex) {
            return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        }
    }

    /**
     * A stamped page whose event is published once its document has been appended to the output.
     */
    private record PendingPage(String sourceName, PageKind kind, int sourcePage, FooterSpec spec) {
    }
}
