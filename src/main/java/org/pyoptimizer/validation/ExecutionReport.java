package org.pyoptimizer.validation;

import org.pyoptimizer.model.FailureCause;

import java.time.Duration;

/**
 * One run of one script variant.
 *
 * @param exitCode     process exit status, -1 when the process was killed
 * @param stdout       everything the script printed on standard output
 * @param stderr       standard error without the metrics line
 * @param runtime      wall time of the script body, null when unknown
 * @param peakMemoryKb peak resident set size in KiB, -1 when unknown
 * @param failureCause null for a successful run
 * @param detail       exception summary or other short explanation, may be null
 */
public record ExecutionReport(int exitCode,
                              String stdout,
                              String stderr,
                              Duration runtime,
                              long peakMemoryKb,
                              FailureCause failureCause,
                              String detail) {

    public static ExecutionReport success(String stdout, String stderr, Duration runtime, long peakMemoryKb) {
        return new ExecutionReport(0, stdout, stderr, runtime, peakMemoryKb, null, null);
    }

    public static ExecutionReport failure(int exitCode, String stdout, String stderr, FailureCause cause,
                                          String detail) {
        return new ExecutionReport(exitCode, stdout, stderr, null, -1, cause, detail);
    }

    public boolean succeeded() {
        return failureCause == null;
    }
}
