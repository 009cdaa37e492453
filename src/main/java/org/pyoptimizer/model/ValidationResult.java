package org.pyoptimizer.model;

import java.time.Duration;

/**
 * Result of validating one patch against the original script.
 *
 * @param patch                the patch
 * @param executionSucceeded   whether the candidate ran to completion
 * @param outputsEqual         whether observable output matched; null when not compared
 * @param baselineRuntime      best runtime of the original script, null when it did not run
 * @param baselinePeakMemoryKb peak resident memory of the original script in KiB, -1 when unknown
 * @param candidateRuntime     best runtime of the candidate, null when it did not run
 * @param candidatePeakMemoryKb peak resident memory of the candidate in KiB, -1 when unknown
 * @param verdict              the decision
 * @param failureCause         set only for {@link Verdict#REJECTED_EXECUTION_FAILED}
 * @param detail               short free text (error excerpt, rollback note), may be null
 */
public record ValidationResult(Patch patch,
                               boolean executionSucceeded,
                               Boolean outputsEqual,
                               Duration baselineRuntime,
                               long baselinePeakMemoryKb,
                               Duration candidateRuntime,
                               long candidatePeakMemoryKb,
                               Verdict verdict,
                               FailureCause failureCause,
                               String detail) {

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    /**
     * Relative runtime gain, e.g. 0.25 for a candidate 25% faster than the baseline.
     * Zero when either runtime is unknown.
     */
    public double runtimeImprovement() {
        if (baselineRuntime == null || candidateRuntime == null || baselineRuntime.isZero()) {
            return 0.0;
        }
        return 1.0 - (double) candidateRuntime.toNanos() / baselineRuntime.toNanos();
    }

    public double memoryImprovement() {
        if (baselinePeakMemoryKb <= 0 || candidatePeakMemoryKb < 0) {
            return 0.0;
        }
        return 1.0 - (double) candidatePeakMemoryKb / baselinePeakMemoryKb;
    }

    /**
     * Same measurements with a different verdict, used when a later combined run
     * overturns an individual decision.
     */
    public ValidationResult withVerdict(Verdict newVerdict, FailureCause cause, String newDetail) {
        return new ValidationResult(patch, executionSucceeded, outputsEqual, baselineRuntime, baselinePeakMemoryKb,
                candidateRuntime, candidatePeakMemoryKb, newVerdict, cause, newDetail);
    }
}
