package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.PdfFixtures;
import com.osman.pdfmerger.core.model.DocumentSource;
import com.osman.pdfmerger.core.model.FooterSpec;
import com.osman.pdfmerger.core.pdf.PageCounter;
import com.osman.pdfmerger.core.render.CoverRenderer;
import com.osman.pdfmerger.core.render.OverlayRenderer;
import com.osman.pdfmerger.core.render.Stamp;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentAssemblerTest {

    @TempDir
    Path tempDir;

    @Test
    void numbersEveryPageAgainstTheFrozenTotal() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 5);
        DocumentSource trialA = pdf("Trial A.pdf", "A", 3);
        DocumentSource trialB = pdf("Trial B.pdf", "B", 2);
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        AssemblyResult result = assembler(new PageCounter(), listener)
            .assemble(main, List.of(trialA, trialB), "Study 42", destination);

        assertEquals(12, result.plannedPages());
        assertEquals(12, result.emittedPages());
        assertTrue(result.isComplete());
        assertEquals(12, listener.pages.size());
        for (int i = 0; i < listener.pages.size(); i++) {
            PageEvent event = listener.pages.get(i);
            assertEquals(i + 1, event.sequence());
            assertEquals(i + 1, event.outputPage());
            assertEquals(12, event.totalPages());
        }

        try (PDDocument out = PDDocument.load(destination.toFile())) {
            assertEquals(12, out.getNumberOfPages());
            for (int page = 1; page <= 12; page++) {
                String text = PdfFixtures.pageText(out, page);
                assertTrue(text.contains("Page " + page + " of 12"), "page " + page + ": " + text);
                assertTrue(text.contains("Study 42"), "page " + page + ": " + text);
            }
        }
    }

    @Test
    void placesCoverDirectlyBeforeEachTrial() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 5);
        DocumentSource trialA = pdf("Trial A.pdf", "A", 3);
        DocumentSource trialB = pdf("Trial B.pdf", "B", 2);
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        assembler(new PageCounter(), listener).assemble(main, List.of(trialA, trialB), null, destination);

        List<PageKind> kinds = listener.pages.stream().map(PageEvent::kind).toList();
        List<PageKind> expected = new ArrayList<>();
        expected.addAll(List.of(PageKind.MAIN_PAGE, PageKind.MAIN_PAGE, PageKind.MAIN_PAGE, PageKind.MAIN_PAGE,
            PageKind.MAIN_PAGE));
        expected.addAll(List.of(PageKind.COVER, PageKind.TRIAL_PAGE, PageKind.TRIAL_PAGE, PageKind.TRIAL_PAGE));
        expected.addAll(List.of(PageKind.COVER, PageKind.TRIAL_PAGE, PageKind.TRIAL_PAGE));
        assertEquals(expected, kinds);

        try (PDDocument out = PDDocument.load(destination.toFile())) {
            assertTrue(PdfFixtures.pageText(out, 5).contains("Main body 5"));
            assertTrue(PdfFixtures.pageText(out, 6).contains("Trial A"));
            assertTrue(PdfFixtures.pageText(out, 7).contains("A body 1"));
            assertTrue(PdfFixtures.pageText(out, 10).contains("Trial B"));
            assertTrue(PdfFixtures.pageText(out, 12).contains("B body 2"));
            assertFalse(PdfFixtures.pageText(out, 1).contains("null"));
        }
    }

    @Test
    void unreadableTrialKeepsItsCoverAndTheRunContinues() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 2);
        DocumentSource broken = DocumentSource.of(PdfFixtures.writeGarbage(tempDir.resolve("Broken Trial.pdf")));
        DocumentSource good = pdf("Good Trial.pdf", "Good", 1);
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        AssemblyResult result = assembler(new PageCounter(), listener)
            .assemble(main, List.of(broken, good), null, destination);

        assertEquals(5, result.plannedPages());
        assertEquals(5, result.emittedPages());
        assertEquals(1, result.trialFailures().size());
        TrialFailure failure = result.trialFailures().get(0);
        assertEquals(1, failure.trialIndex());
        assertEquals("Broken Trial", failure.title());
        assertEquals(0, failure.pagesKept());
        assertEquals(1, listener.failures.size());

        try (PDDocument out = PDDocument.load(destination.toFile())) {
            assertEquals(5, out.getNumberOfPages());
            String brokenCover = PdfFixtures.pageText(out, 3);
            assertTrue(brokenCover.contains("Broken Trial"), brokenCover);
            assertTrue(brokenCover.contains("Page 3 of 5"), brokenCover);
            assertTrue(PdfFixtures.pageText(out, 4).contains("Good Trial"));
            assertTrue(PdfFixtures.pageText(out, 5).contains("Page 5 of 5"));
        }
    }

    @Test
    void trialFailingAfterCountingLeavesTotalAsPlanned() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 2);
        DocumentSource flaky = DocumentSource.of(PdfFixtures.writeGarbage(tempDir.resolve("flaky.pdf")));
        PageCounter counter = new PageCounter() {
            @Override
            public int count(DocumentSource source) {
                return source.name().equals("flaky.pdf") ? 1 : super.count(source);
            }
        };
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        AssemblyResult result = assembler(counter, listener).assemble(main, List.of(flaky), null, destination);

        assertEquals(4, result.plannedPages());
        assertEquals(3, result.emittedPages());
        assertFalse(result.isComplete());
        assertEquals(3, listener.pages.size());
        assertEquals(PageKind.COVER, listener.pages.get(2).kind());
        try (PDDocument out = PDDocument.load(destination.toFile())) {
            assertEquals(3, out.getNumberOfPages());
            assertTrue(PdfFixtures.pageText(out, 3).contains("Page 3 of 4"));
        }
    }

    @Test
    void trialFailingMidBodyKeepsPagesAlreadyPlaced() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 2);
        DocumentSource trialA = pdf("TrialA.pdf", "A", 3);
        DocumentSource trialB = pdf("TrialB.pdf", "B", 1);
        // footers 1 and 2 go to the main report, footer 4 is TrialA's second page
        OverlayRenderer failsOnFourthFooter = new OverlayRenderer() {
            private int calls;

            @Override
            public Stamp renderFooter(FooterSpec spec) throws IOException {
                if (++calls == 4) {
                    throw new IOException("damaged page");
                }
                return super.renderFooter(spec);
            }
        };
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        AssemblyResult result = new DocumentAssembler(new AssemblyPlanner(new PageCounter(), 1),
            failsOnFourthFooter, new CoverRenderer(), listener)
            .assemble(main, List.of(trialA, trialB), null, destination);

        assertEquals(8, result.plannedPages());
        assertEquals(6, result.emittedPages());
        TrialFailure failure = result.trialFailures().get(0);
        assertEquals("TrialA", failure.title());
        assertEquals(1, failure.pagesKept());
        assertEquals("java.io.IOException", failure.exceptionType());
        assertEquals(List.of(1, 2, 3, 4, 5, 6), listener.pages.stream().map(PageEvent::outputPage).toList());

        try (PDDocument out = PDDocument.load(destination.toFile())) {
            assertEquals(6, out.getNumberOfPages());
            assertTrue(PdfFixtures.pageText(out, 3).contains("TrialA"));
            String kept = PdfFixtures.pageText(out, 4);
            assertTrue(kept.contains("A body 1"), kept);
            assertTrue(kept.contains("Page 4 of 8"), kept);
            String nextCover = PdfFixtures.pageText(out, 5);
            assertTrue(nextCover.contains("TrialB"), nextCover);
            assertTrue(nextCover.contains("Page 5 of 8"), nextCover);
            assertTrue(PdfFixtures.pageText(out, 6).contains("B body 1"));
            assertTrue(PdfFixtures.pageText(out, 6).contains("Page 6 of 8"));
        }
    }

    @Test
    void failedCoverSkipsTrialWithoutUsingANumber() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 2);
        DocumentSource trialA = pdf("TrialA.pdf", "A", 3);
        DocumentSource trialB = pdf("TrialB.pdf", "B", 1);
        CoverRenderer failsForTrialA = new CoverRenderer() {
            @Override
            public Stamp renderCover(String title, FooterSpec spec) throws IOException {
                if (title.equals("TrialA")) {
                    throw new IOException("cover failed");
                }
                return super.renderCover(title, spec);
            }
        };
        Path destination = tempDir.resolve("out.pdf");

        AssemblyResult result = new DocumentAssembler(new AssemblyPlanner(new PageCounter(), 1),
            new OverlayRenderer(), failsForTrialA, AssemblyListener.NONE)
            .assemble(main, List.of(trialA, trialB), null, destination);

        assertEquals(4, result.emittedPages());
        assertEquals(0, result.trialFailures().get(0).pagesKept());
        try (PDDocument out = PDDocument.load(destination.toFile())) {
            String cover = PdfFixtures.pageText(out, 3);
            assertTrue(cover.contains("TrialB"), cover);
            assertTrue(cover.contains("Page 3 of 8"), cover);
        }
    }

    @Test
    void unreadableMainAbortsWithoutWritingOutput() throws Exception {
        DocumentSource main = DocumentSource.of(PdfFixtures.writeGarbage(tempDir.resolve("report.pdf")));
        DocumentSource trial = pdf("Trial A.pdf", "A", 1);
        RecordingListener listener = new RecordingListener();
        Path destination = tempDir.resolve("out.pdf");

        AssemblyException ex = assertThrows(AssemblyException.class,
            () -> assembler(new PageCounter(), listener).assemble(main, List.of(trial), null, destination));

        assertEquals(AssemblyFailure.FATAL_INPUT, ex.kind());
        assertEquals(AssemblyPhase.EMITTING_MAIN, ex.phase());
        assertEquals("report.pdf", ex.sourceName());
        assertTrue(ex.getMessage().startsWith("Error processing main PDF"));
        assertFalse(Files.exists(destination));
        assertTrue(listener.pages.isEmpty());
        assertEquals(AssemblyPhase.FAILED_FATAL, listener.lastPhase());
    }

    @Test
    void unwritableDestinationFailsAsOutputError() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 1);
        Path missingDir = tempDir.resolve("no-such-dir");
        Path destination = missingDir.resolve("out.pdf");

        AssemblyException ex = assertThrows(AssemblyException.class,
            () -> assembler(new PageCounter(), AssemblyListener.NONE).assemble(main, List.of(), null, destination));

        assertEquals(AssemblyFailure.FATAL_OUTPUT, ex.kind());
        assertEquals(AssemblyPhase.SERIALIZING, ex.phase());
        assertFalse(Files.exists(missingDir));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void phasesAdvanceInOrder() throws Exception {
        RecordingListener listener = new RecordingListener();

        assembler(new PageCounter(), listener)
            .assemble(pdf("report.pdf", "Main", 1), List.of(), null, tempDir.resolve("out.pdf"));

        assertEquals(List.of(
            AssemblyPhase.COUNTING_PAGES,
            AssemblyPhase.EMITTING_MAIN,
            AssemblyPhase.EMITTING_TRIALS,
            AssemblyPhase.SERIALIZING,
            AssemblyPhase.SUCCEEDED
        ), listener.phases);
        assertEquals(1, listener.plan.totalPages());
    }

    @Test
    void refusesToOverwriteAnInput() throws Exception {
        DocumentSource main = pdf("report.pdf", "Main", 1);

        assertThrows(IllegalArgumentException.class,
            () -> assembler(new PageCounter(), AssemblyListener.NONE).assemble(main, List.of(), null, main.path()));
    }

    private DocumentSource pdf(String name, String label, int pages) throws IOException {
        return DocumentSource.of(PdfFixtures.writePdf(tempDir.resolve(name), label, pages));
    }

    private static DocumentAssembler assembler(PageCounter counter, AssemblyListener listener) {
        return new DocumentAssembler(new AssemblyPlanner(counter, 1), new OverlayRenderer(), new CoverRenderer(),
            listener);
    }

    private static final class RecordingListener implements AssemblyListener {
        final List<AssemblyPhase> phases = new ArrayList<>();
        final List<PageEvent> pages = new ArrayList<>();
        final List<TrialFailure> failures = new ArrayList<>();
        AssemblyPlan plan;

        @Override
        public void onPhase(AssemblyPhase from, AssemblyPhase to) {
            phases.add(to);
        }

        @Override
        public void onPlan(AssemblyPlan plan) {
            this.plan = plan;
        }

        @Override
        public void onPageEmitted(PageEvent event) {
            pages.add(event);
        }

        @Override
        public void onTrialFailed(TrialFailure failure) {
            failures.add(failure);
        }

        AssemblyPhase lastPhase() {
            return phases.get(phases.size() - 1);
        }
    }
}
