package org.pyoptimizer.validation;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.pyoptimizer.exception.ValidationException;
import org.pyoptimizer.model.FailureCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs script variants in a fresh Python interpreter each.
 * <p>
 * The script is written to a scratch directory and executed by a small harness
 * ({@code harness.py}, passed with {@code -c}) that measures the wall time of the
 * script body with {@code time.perf_counter} and the peak resident set size with
 * {@code resource.getrusage}, and prints both as one JSON line on standard error,
 * after the marker {@value #METRICS_MARKER}. Output goes to files rather than pipes,
 * so a chatty script cannot block on a full pipe.
 * <p>
 * When the directory of the original file is known, the interpreter runs there and the
 * harness puts it first on {@code sys.path}: sibling imports and relative paths behave
 * as they do for the original script.
 */
public class PythonProcessRunner implements ScriptRunner {
    public static final String METRICS_MARKER = "@@PYOPT_METRICS@@";
    private static final Logger log = LoggerFactory.getLogger(PythonProcessRunner.class);
    private static final String HARNESS = loadHarness();

    private final String pythonExecutable;
    private final int memoryLimitMb;

    public PythonProcessRunner(String pythonExecutable, int memoryLimitMb) {
        this.pythonExecutable = pythonExecutable;
        this.memoryLimitMb = memoryLimitMb;
    }

    private static String loadHarness() {
        try (InputStream in = PythonProcessRunner.class.getResourceAsStream("harness.py")) {
            if (in == null) {
                throw new IllegalStateException("harness.py missing from the class path");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public ExecutionReport run(String scriptText, Path sourceDirectory, String label, Duration timeout) {
        Path directory;
        try {
            directory = Files.createTempDirectory("pyopt-");
        } catch (IOException e) {
            throw new ValidationException("cannot create a scratch directory for " + label, e);
        }
        try {
            return runIn(directory, sourceDirectory, scriptText, label, timeout);
        } finally {
            deleteRecursively(directory);
        }
    }

    private ExecutionReport runIn(Path directory, Path sourceDirectory, String scriptText, String label,
                                  Duration timeout) {
        Path script = directory.resolve("script.py");
        Path stdoutFile = directory.resolve("stdout.txt");
        Path stderrFile = directory.resolve("stderr.txt");
        Process process;
        try {
            Files.writeString(script, scriptText, StandardCharsets.UTF_8);
            List<String> command = new ArrayList<>(List.of(pythonExecutable, "-c", HARNESS, script.toString()));
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory((sourceDirectory != null ? sourceDirectory : directory).toFile());
            builder.redirectOutput(stdoutFile.toFile());
            builder.redirectError(stderrFile.toFile());
            builder.environment().put("PYOPT_MEMORY_LIMIT_MB", Integer.toString(memoryLimitMb));
            if (sourceDirectory != null) {
                builder.environment().put("PYOPT_SOURCE_DIR", sourceDirectory.toAbsolutePath().toString());
            }
            builder.environment().put("PYTHONHASHSEED", "0");
            builder.environment().put("PYTHONIOENCODING", "utf-8");
            process = builder.start();
        } catch (IOException e) {
            throw new ValidationException("cannot start " + pythonExecutable + " for " + label + ": " + e.getMessage(), e);
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("run of " + label + " cancelled");
            cancelled.initCause(e);
            throw cancelled;
        }
        if (!finished) {
            kill(process);
            log.info("{}: timed out after {} ms", label, timeout.toMillis());
            return ExecutionReport.failure(-1, read(stdoutFile), read(stderrFile), FailureCause.TIMEOUT,
                    "timed out after " + timeout.toMillis() + " ms");
        }
        return interpret(process.exitValue(), read(stdoutFile), read(stderrFile), label);
    }

    /**
     * Builds the report from the exit status and the captured streams.
     */
    static ExecutionReport interpret(int exitCode, String stdout, String rawStderr, String label) {
        int markerAt = rawStderr.lastIndexOf(METRICS_MARKER);
        if (markerAt < 0) {
            // Killed before the harness could report, typically by the memory limit or a signal.
            return ExecutionReport.failure(exitCode, stdout, rawStderr, FailureCause.NONZERO_EXIT,
                    "interpreter exited with status " + exitCode + " without reporting metrics");
        }
        int lineEnd = rawStderr.indexOf('\n', markerAt);
        String json = rawStderr.substring(markerAt + METRICS_MARKER.length(), lineEnd < 0 ? rawStderr.length() : lineEnd);
        String stderr = stripTrailingNewline(rawStderr.substring(0, markerAt));
        JSONObject metrics;
        try {
            metrics = JSON.isValidObject(json) ? JSON.parseObject(json) : null;
        } catch (RuntimeException e) {
            // fastjson2 may fail on a truncated line with an index error instead of a JSONException.
            metrics = null;
            log.debug("{}: metrics parse failed", label, e);
        }
        if (metrics == null) {
            log.warn("{}: unreadable metrics line: {}", label, json);
            return ExecutionReport.failure(exitCode, stdout, stderr, FailureCause.NONZERO_EXIT,
                    "unreadable metrics: " + json.trim());
        }
        String status = metrics.getString("status");
        String detail = metrics.getString("detail");
        if ("ok".equals(status) && exitCode == 0) {
            Duration runtime = Duration.ofNanos(Math.round(metrics.getDoubleValue("wallSeconds") * 1e9));
            return ExecutionReport.success(stdout, stderr, runtime, metrics.getLongValue("maxRssKb", -1L));
        }
        FailureCause cause = switch (status == null ? "" : status) {
            case "exception" -> FailureCause.EXCEPTION;
            case "memory" -> FailureCause.MEMORY_LIMIT;
            default -> FailureCause.NONZERO_EXIT;
        };
        return ExecutionReport.failure(exitCode, stdout, stderr, cause,
                detail != null ? detail : "exit status " + exitCode);
    }

    private static String stripTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String read(Path file) {
        try {
            return Files.exists(file) ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            throw new ValidationException("cannot read " + file, e);
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.warn("cannot remove scratch directory {}: {}", directory, e.getMessage());
        }
    }
}
