package org.pyoptimizer.pipeline;

import org.pyoptimizer.OptimizerOptions;
import org.pyoptimizer.analysis.StaticPatternAnalyzer;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.engine.PlanResult;
import org.pyoptimizer.engine.TransformationEngine;
import org.pyoptimizer.exception.BatchAbortedException;
import org.pyoptimizer.exception.ParseError;
import org.pyoptimizer.exception.ValidationException;
import org.pyoptimizer.model.Finding;
import org.pyoptimizer.model.Outcome;
import org.pyoptimizer.model.SourceUnit;
import org.pyoptimizer.parser.PythonParserAdapter;
import org.pyoptimizer.rules.RuleSet;
import org.pyoptimizer.validation.DynamicValidator;
import org.pyoptimizer.validation.PythonProcessRunner;
import org.pyoptimizer.validation.ScriptRunner;
import org.pyoptimizer.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs parse, analyze, plan and validate for each file and turns the result into an
 * {@link Outcome}.
 * <p>
 * Files are independent: one file failing to parse, or its validation timing out,
 * never affects the others. {@link #processAll(List)} runs files on a fixed pool of
 * {@code workers} threads and returns the outcomes in input order. A watchdog
 * interrupts a file's worker when the per-file timeout expires, which kills the
 * running interpreter and ends that file as INCOMPLETE.
 */
public class PipelineController {
    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final OptimizerOptions options;
    private final PythonParserAdapter parserAdapter;
    private final StaticPatternAnalyzer analyzer;
    private final TransformationEngine engine;
    private final DynamicValidator validator;

    public PipelineController(OptimizerOptions options, PythonParserAdapter parserAdapter,
                              StaticPatternAnalyzer analyzer, TransformationEngine engine,
                              DynamicValidator validator) {
        this.options = options;
        this.parserAdapter = parserAdapter;
        this.analyzer = analyzer;
        this.engine = engine;
        this.validator = validator;
    }

    /**
     * Wires the standard components. Validation is left out in analyze-only mode.
     */
    public static PipelineController create(OptimizerOptions options) {
        ScriptRunner runner = options.analyzeOnly
                ? null
                : new PythonProcessRunner(options.pythonExecutable, options.memoryLimitMb);
        return create(options, runner);
    }

    public static PipelineController create(OptimizerOptions options, ScriptRunner runner) {
        PythonParserAdapter parserAdapter = new PythonParserAdapter();
        TransformationEngine engine = new TransformationEngine(RuleSet.standard(options.enabledRules), parserAdapter);
        DynamicValidator validator = runner == null ? null : new DynamicValidator(runner, engine, options);
        return new PipelineController(options, parserAdapter,
                new StaticPatternAnalyzer(options.highIterationThreshold), engine, validator);
    }

    /**
     * Processes one file on the calling thread.
     *
     * @return the outcome; never null, and no exception escapes for a bad file
     */
    public Outcome process(Path path) {
        String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("{}: cannot read: {}", path, e.getMessage());
            return Outcome.failed(path, null, "cannot read file: " + e.getMessage());
        }
        SyntaxTree tree;
        try {
            tree = parserAdapter.parse(path.toString(), text);
        } catch (ParseError e) {
            log.error("{}", e.getMessage());
            return Outcome.failed(path, null, e.getMessage());
        }
        SourceUnit unit = new SourceUnit(path, text, tree);
        List<Finding> findings = analyzer.analyze(tree);
        PlanResult plan = engine.plan(unit, findings);
        if (validator == null) {
            return new Outcome(path, unit, Outcome.Status.COMPLETED, findings, plan.patches(), List.of(),
                    plan.superseded(), plan.declined(), List.of(), null, null);
        }
        ValidationReport report;
        try {
            report = validator.validate(unit, plan.patches());
        } catch (ValidationException e) {
            log.error("{}: validation could not run: {}", path, e.getMessage());
            return Outcome.incomplete(path, unit, findings, e.getMessage());
        } catch (CancellationException e) {
            log.warn("{}: validation cancelled", path);
            return Outcome.incomplete(path, unit, findings, "cancelled or exceeded the per-file timeout of "
                    + options.fileTimeout.toSeconds() + "s");
        }
        return new Outcome(path, unit, Outcome.Status.COMPLETED, findings, plan.patches(), report.accepted(),
                plan.superseded(), plan.declined(), report.results(), report.transformedText(), null);
    }

    /**
     * Processes files concurrently, one file per task.
     *
     * @return one outcome per path, in the order of {@code paths}
     * @throws BatchAbortedException if the pool refuses work or the calling thread is
     *                               interrupted while waiting
     */
    public List<Outcome> processAll(List<Path> paths) {
        AtomicInteger threadNumber = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, options.workers), runnable -> {
            Thread thread = new Thread(runnable, "pyopt-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pyopt-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        List<Future<Outcome>> futures = new ArrayList<>();
        try {
            for (Path path : paths) {
                futures.add(pool.submit(() -> processWithDeadline(path, watchdog)));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (int i = 0; i < paths.size(); i++) {
                outcomes.add(await(paths.get(i), futures.get(i)));
            }
            return outcomes;
        } catch (RejectedExecutionException e) {
            throw new BatchAbortedException("worker pool rejected a file", e);
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new BatchAbortedException("batch interrupted", e);
        } finally {
            pool.shutdownNow();
            watchdog.shutdownNow();
        }
    }

    private Outcome await(Path path, Future<Outcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("{}: unexpected failure", path, e.getCause());
            return Outcome.failed(path, null, "internal error: " + e.getCause());
        }
    }

    private Outcome processWithDeadline(Path path, ScheduledExecutorService watchdog) {
        Thread worker = Thread.currentThread();
        Object lock = new Object();
        boolean[] active = {true};
        ScheduledFuture<?> alarm = watchdog.schedule(() -> {
            synchronized (lock) {
                if (active[0]) {
                    log.warn("{}: per-file timeout of {}s expired", path, options.fileTimeout.toSeconds());
                    worker.interrupt();
                }
            }
        }, options.fileTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return process(path);
        } finally {
            synchronized (lock) {
                active[0] = false;
            }
            alarm.cancel(false);
            // An alarm that fired after the last blocking call must not leak into the next file.
            Thread.interrupted();
        }
    }
}
