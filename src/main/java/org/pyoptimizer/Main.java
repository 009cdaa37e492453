package org.pyoptimizer;

import org.pyoptimizer.exception.BatchAbortedException;
import org.pyoptimizer.exception.ConfigurationException;
import org.pyoptimizer.io.FileSystemProjectScanner;
import org.pyoptimizer.io.JsonReportWriter;
import org.pyoptimizer.io.OptimizedScriptWriter;
import org.pyoptimizer.io.ProjectScanner;
import org.pyoptimizer.io.ReportSink;
import org.pyoptimizer.model.Outcome;
import org.pyoptimizer.pipeline.PipelineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Command line entry point.
 * <p>
 * Exit status: 0 when every file completed, 1 when at least one file failed or could
 * not be validated, 2 for bad options or unreadable inputs, 3 when the batch was
 * aborted.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FILE_ERRORS = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_ABORTED = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the optimizer and returns the exit status.
     *
     * @param stdout receives the JSON report when no report file is configured
     */
    public static int run(String[] args, PrintStream stdout) {
        OptimizerOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }
        if (options.inputs.isEmpty()) {
            System.err.println("Error: no input paths given  (-h will show valid options)");
            return EXIT_USAGE;
        }
        log.debug("{}", options);

        List<Path> scripts;
        try {
            scripts = discover(new FileSystemProjectScanner(), options.inputs);
        } catch (IOException e) {
            System.err.println("Error: cannot list inputs: " + e.getMessage());
            return EXIT_USAGE;
        }
        log.info("optimizing {} script(s) with {} worker(s)", scripts.size(), options.workers);

        List<Outcome> outcomes;
        try {
            outcomes = PipelineController.create(options).processAll(scripts);
        } catch (BatchAbortedException e) {
            log.error("batch aborted: {}", e.getMessage(), e);
            return EXIT_ABORTED;
        }

        try (ReportSink report = new JsonReportWriter(reportWriter(options, stdout))) {
            OptimizedScriptWriter scriptWriter = options.analyzeOnly ? null : new OptimizedScriptWriter(options.outputDirectory);
            for (Outcome outcome : outcomes) {
                if (scriptWriter != null) {
                    scriptWriter.accept(outcome);
                }
                report.accept(outcome);
            }
        } catch (IOException e) {
            log.error("cannot write results: {}", e.getMessage(), e);
            return EXIT_ABORTED;
        }

        boolean allCompleted = outcomes.stream().allMatch(outcome -> outcome.status() == Outcome.Status.COMPLETED);
        return allCompleted ? EXIT_OK : EXIT_FILE_ERRORS;
    }

    /**
     * Expands the input paths into scripts, dropping duplicates while keeping the
     * order in which inputs were given.
     */
    static List<Path> discover(ProjectScanner scanner, List<Path> inputs) throws IOException {
        Set<Path> scripts = new LinkedHashSet<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IOException("no such file or directory: " + input);
            }
            for (Path script : scanner.discover(input)) {
                scripts.add(script.toAbsolutePath().normalize());
            }
        }
        return new ArrayList<>(scripts);
    }

    private static Writer reportWriter(OptimizerOptions options, PrintStream stdout) throws IOException {
        if (options.reportFile == null) {
            // Leave the caller's stream open: only flush it
            return new OutputStreamWriter(stdout, StandardCharsets.UTF_8) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        Path parent = options.reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(options.reportFile, StandardCharsets.UTF_8);
    }
}
