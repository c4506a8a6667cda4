package com.osman.pdfmerger.cli;

import com.osman.pdfmerger.config.ConfigService;
import com.osman.pdfmerger.core.assemble.AssemblyException;
import com.osman.pdfmerger.core.assemble.AssemblyResult;
import com.osman.pdfmerger.core.assemble.DocumentAssembler;
import com.osman.pdfmerger.core.assemble.TrialFailure;
import com.osman.pdfmerger.core.json.AssemblyJob;
import com.osman.pdfmerger.core.json.AssemblyJobLoader;
import com.osman.pdfmerger.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line front end: merges a main report and its trial reports into one PDF with cover pages
 * and page-numbered footers.
 *
 * <pre>
 * PdfMergerTool [--title &lt;report title&gt;] [--out &lt;output.pdf&gt;] &lt;main.pdf&gt; &lt;trial.pdf&gt;...
 * PdfMergerTool [--title ...] [--out ...] --job &lt;job.json&gt;
 * </pre>
 * Without arguments the inputs are read from {@code -Dpdfmerger.job}, or from {@code -Dpdfmerger.main},
 * {@code -Dpdfmerger.trials} (comma-separated), {@code -Dpdfmerger.title} and {@code -Dpdfmerger.output}.
 */
public final class PdfMergerTool {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = AppLogger.get();
    private static final String USAGE =
        "Usage: PdfMergerTool [--title <report title>] [--out <output.pdf>] (<main.pdf> <trial.pdf>... | --job <job.json>)";

    private final ConfigService config;
    private final DocumentAssembler assembler;

    PdfMergerTool(ConfigService config, DocumentAssembler assembler) {
        this.config = config;
        this.assembler = assembler;
    }

    public static void main(String[] args) {
        int code = new PdfMergerTool(ConfigService.getInstance(), new DocumentAssembler()).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        AssemblyJob job;
        try {
            job = resolveJob(args);
        } catch (UsageException ex) {
            LOGGER.warning(ex.getMessage());
            LOGGER.warning(USAGE);
            return EXIT_USAGE;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Could not read job: " + ex.getMessage(), ex);
            return EXIT_USAGE;
        }

        if (job.reportTitle() == null) {
            job = job.withReportTitle(config.lastReportTitle().orElse(null));
        }
        if (job.output() == null) {
            job = job.withOutput(config.defaultOutputFor(job.main()));
        }

        LOGGER.info("Main PDF: " + job.main());
        LOGGER.info("Trial PDFs: " + job.trials().stream().map(p -> String.valueOf(p.getFileName())).toList());
        LOGGER.info("Report title: " + (job.reportTitle() == null ? "<none>" : job.reportTitle()));

        AssemblyResult result;
        try {
            result = assembler.assemble(job.mainSource(), job.trialSources(), job.reportTitle(), job.output());
        } catch (AssemblyException ex) {
            LOGGER.severe(ex.kind() + " during " + ex.phase() + ": " + ex.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException ex) {
            LOGGER.warning(ex.getMessage());
            return EXIT_USAGE;
        }

        config.rememberReportTitle(job.reportTitle());

        if (result.hasTrialFailures()) {
            for (TrialFailure failure : result.trialFailures()) {
                LOGGER.warning("Trial " + failure.trialIndex() + " (" + failure.title() + ") is incomplete, "
                    + failure.pagesKept() + " body pages kept: " + failure.message());
            }
        }
        LOGGER.info((result.isComplete() ? "PDF successfully created at: " : "PDF created with warnings at: ")
            + result.output()
            + " (" + result.emittedPages() + " pages)");
        return EXIT_OK;
    }

    AssemblyJob resolveJob(String[] args) throws IOException, UsageException {
        String title = null;
        String out = null;
        String jobFile = null;
        List<String> positional = new ArrayList<>();

        String[] effective = args == null ? new String[0] : args;
        for (int i = 0; i < effective.length; i++) {
            String arg = effective[i];
            switch (arg) {
                case "--title", "-t" -> title = valueAfter(effective, ++i, arg);
                case "--out", "-o" -> out = valueAfter(effective, ++i, arg);
                case "--job", "-j" -> jobFile = valueAfter(effective, ++i, arg);
                case "--help", "-h" -> throw new UsageException("Help requested.");
                default -> {
                    if (arg.startsWith("-")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    if (!arg.isBlank()) {
                        positional.add(arg.trim());
                    }
                }
            }
        }

        if (jobFile == null && positional.isEmpty()) {
            jobFile = blankToNull(System.getProperty("pdfmerger.job"));
            if (jobFile == null) {
                positional.addAll(fromSystemProperties());
            }
            title = title != null ? title : blankToNull(System.getProperty("pdfmerger.title"));
            out = out != null ? out : blankToNull(System.getProperty("pdfmerger.output"));
        }

        AssemblyJob job;
        if (jobFile != null) {
            if (!positional.isEmpty()) {
                throw new UsageException("Pass either a job file or input PDFs, not both.");
            }
            job = AssemblyJobLoader.load(Path.of(jobFile));
        } else {
            if (positional.isEmpty()) {
                throw new UsageException("No input file");
            }
            List<Path> trials = new ArrayList<>();
            for (String trial : positional.subList(1, positional.size())) {
                trials.add(Path.of(trial));
            }
            job = new AssemblyJob(Path.of(positional.get(0)), trials, null, null);
        }

        if (title != null) {
            job = job.withReportTitle(title);
        }
        if (out != null) {
            job = job.withOutput(Path.of(out));
        }
        return job;
    }

    private static List<String> fromSystemProperties() {
        List<String> inputs = new ArrayList<>();
        String main = blankToNull(System.getProperty("pdfmerger.main"));
        if (main == null) {
            return inputs;
        }
        inputs.add(main);
        String csv = System.getProperty("pdfmerger.trials");
        if (csv != null && !csv.isBlank()) {
            for (String p : csv.split(",")) {
                String s = p.trim();
                if (!s.isEmpty()) inputs.add(s);
            }
        }
        return inputs;
    }

    private static String valueAfter(String[] args, int index, String option) throws UsageException {
        if (index >= args.length || args[index].isBlank()) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index];
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
