package org.pyoptimizer.validation;

import org.pyoptimizer.OptimizerOptions;
import org.pyoptimizer.engine.TransformationEngine;
import org.pyoptimizer.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

/**
 * Decides which candidate patches make it into the optimized script by running them.
 * <p>
 * The original script is the baseline. Every patch is first applied alone to the
 * original and judged on its own:
 * <ol>
 *   <li>the candidate fails while the baseline runs: REJECTED_EXECUTION_FAILED;</li>
 *   <li>standard output differs from the baseline: REJECTED_UNSAFE (skipped for
 *   PROVEN flatten patches, which are only profiled);</li>
 *   <li>neither runtime nor peak memory improves by the configured fraction:
 *   REJECTED_NO_BENEFIT;</li>
 *   <li>otherwise ACCEPTED.</li>
 * </ol>
 * The accepted patches are then run together. If that combination fails or changes
 * the output, HEURISTIC patches are rolled back one at a time, cache patches before
 * vectorize patches, until the rest passes. The patch whose removal made the set pass
 * stays rejected; each one rolled back before it is added back alone and kept when the
 * combination still matches the baseline.
 */
public class DynamicValidator {
    private static final Logger log = LoggerFactory.getLogger(DynamicValidator.class);

    private final ScriptRunner runner;
    private final TransformationEngine engine;
    private final OptimizerOptions options;

    public DynamicValidator(ScriptRunner runner, TransformationEngine engine, OptimizerOptions options) {
        this.runner = runner;
        this.engine = engine;
        this.options = options;
    }

    public ValidationReport validate(SourceUnit unit, List<Patch> candidates) {
        if (candidates.isEmpty()) {
            return new ValidationReport(List.of(), List.of(), null);
        }
        Measurement baseline = measure(unit, unit.originalText(), unit.fileName() + " baseline");
        if (!baseline.succeeded()) {
            log.warn("{}: original script fails ({}), no patch can be validated", unit.fileName(), baseline.report.detail());
            List<ValidationResult> results = new ArrayList<>();
            for (Patch patch : candidates) {
                results.add(new ValidationResult(patch, false, null, null, -1, null, -1,
                        Verdict.REJECTED_EXECUTION_FAILED, FailureCause.BASELINE_FAILED, baseline.report.detail()));
            }
            return new ValidationReport(results, List.of(), null);
        }

        Map<Integer, ValidationResult> results = new LinkedHashMap<>();
        for (Patch patch : candidates) {
            ValidationResult result = validateAlone(unit, patch, baseline);
            log.info("{}: {} {} (runtime {}%, memory {}%)", unit.fileName(), patch.label(), result.verdict(),
                    percent(result.runtimeImprovement()), percent(result.memoryImprovement()));
            results.put(patch.id(), result);
        }

        List<Patch> accepted = new ArrayList<>();
        for (Patch patch : candidates) {
            if (results.get(patch.id()).isAccepted()) {
                accepted.add(patch);
            }
        }
        if (accepted.size() > 1) {
            checkCombination(unit, baseline, accepted, results);
        }
        String text = accepted.isEmpty() ? null : engine.render(unit, accepted);
        return new ValidationReport(new ArrayList<>(results.values()), accepted, text);
    }

    private ValidationResult validateAlone(SourceUnit unit, Patch patch, Measurement baseline) {
        String text = engine.render(unit, List.of(patch));
        Measurement candidate = measure(unit, text, unit.fileName() + " " + patch.label());
        if (!candidate.succeeded()) {
            return new ValidationResult(patch, false, null, baseline.runtime, baseline.peakMemoryKb, null, -1,
                    Verdict.REJECTED_EXECUTION_FAILED, candidate.report.failureCause(), candidate.report.detail());
        }
        Boolean outputsEqual = null;
        if (!(patch.isProven() && patch.ruleKind() == RuleKind.FLATTEN)) {
            outputsEqual = baseline.report.stdout().equals(candidate.report.stdout());
        }
        ValidationResult measured = new ValidationResult(patch, true, outputsEqual, baseline.runtime,
                baseline.peakMemoryKb, candidate.runtime, candidate.peakMemoryKb, Verdict.ACCEPTED, null, null);
        if (Boolean.FALSE.equals(outputsEqual)) {
            return measured.withVerdict(Verdict.REJECTED_UNSAFE, null, "standard output differs from the original");
        }
        if (measured.runtimeImprovement() < options.improvementThreshold
                && measured.memoryImprovement() < options.improvementThreshold) {
            return measured.withVerdict(Verdict.REJECTED_NO_BENEFIT, null,
                    "improvement below " + percent(options.improvementThreshold) + "%");
        }
        return measured;
    }

    private void checkCombination(SourceUnit unit, Measurement baseline, List<Patch> accepted,
                                  Map<Integer, ValidationResult> results) {
        List<Patch> planOrder = new ArrayList<>(accepted);
        List<Patch> rollbackOrder = new ArrayList<>();
        for (Patch patch : accepted) {
            if (!patch.isProven()) {
                rollbackOrder.add(patch);
            }
        }
        rollbackOrder.sort(Comparator.comparingInt((Patch patch) -> rollbackRank(patch.ruleKind()))
                .thenComparing(Comparator.comparingInt(Patch::id).reversed()));

        Map<Integer, ValidationResult> acceptedResults = new HashMap<>();
        List<Patch> rolledBack = new ArrayList<>();
        boolean passed = false;
        while (!accepted.isEmpty()) {
            Measurement combined = measure(unit, engine.render(unit, accepted),
                    unit.fileName() + " combined " + accepted.size());
            if (sameOutput(baseline, combined)) {
                passed = true;
                break;
            }
            List<Patch> dropped = rollbackOrder.isEmpty() ? new ArrayList<>(accepted) : List.of(rollbackOrder.remove(0));
            for (Patch patch : dropped) {
                log.info("{}: rolling back {} after the combined run {}", unit.fileName(), patch.label(),
                        combined.succeeded() ? "changed the output" : "failed");
                acceptedResults.put(patch.id(), results.get(patch.id()));
                results.put(patch.id(), rejectedInCombination(results.get(patch.id()), combined));
                accepted.remove(patch);
            }
            if (dropped.size() == 1) {
                rolledBack.add(dropped.get(0));
            }
            if (accepted.size() == 1) {
                // A single patch was already validated on its own.
                passed = true;
                break;
            }
        }
        if (!passed || rolledBack.size() < 2) {
            return;
        }

        // The last patch rolled back broke the set that passes now. Every earlier one
        // gets another chance on top of that set.
        for (Patch patch : rolledBack.subList(0, rolledBack.size() - 1)) {
            List<Patch> trial = new ArrayList<>(accepted);
            trial.add(patch);
            trial.sort(Comparator.comparingInt(planOrder::indexOf));
            Measurement combined = measure(unit, engine.render(unit, trial),
                    unit.fileName() + " combined " + trial.size());
            if (sameOutput(baseline, combined)) {
                log.info("{}: restored {} after the combined run passed", unit.fileName(), patch.label());
                results.put(patch.id(), acceptedResults.get(patch.id()));
                accepted.clear();
                accepted.addAll(trial);
            } else {
                results.put(patch.id(), rejectedInCombination(acceptedResults.get(patch.id()), combined));
            }
        }
    }

    private static boolean sameOutput(Measurement baseline, Measurement combined) {
        return combined.succeeded() && baseline.report.stdout().equals(combined.report.stdout());
    }

    private static ValidationResult rejectedInCombination(ValidationResult previous, Measurement combined) {
        return combined.succeeded()
                ? previous.withVerdict(Verdict.REJECTED_UNSAFE, null, "output differs in combination with other patches")
                : previous.withVerdict(Verdict.REJECTED_EXECUTION_FAILED, FailureCause.COMBINATION_FAILED,
                combined.report.detail());
    }

    private static int rollbackRank(RuleKind kind) {
        return switch (kind) {
            case CACHE -> 0;
            case VECTORIZE -> 1;
            case FLATTEN -> 2;
        };
    }

    /**
     * Runs a script {@code options.repeats} times, from the directory of the original
     * file, and keeps the best runtime and the lowest peak memory. Stops at the first
     * failing run.
     */
    private Measurement measure(SourceUnit unit, String text, String label) {
        Path sourceDirectory = unit.path().toAbsolutePath().getParent();
        ExecutionReport last = null;
        Duration best = null;
        long peak = -1;
        int runs = Math.max(1, options.repeats);
        for (int i = 0; i < runs; i++) {
            last = runner.run(text, sourceDirectory, label, options.candidateTimeout);
            if (!last.succeeded()) {
                return new Measurement(last, null, -1);
            }
            if (last.runtime() != null && (best == null || last.runtime().compareTo(best) < 0)) {
                best = last.runtime();
            }
            if (last.peakMemoryKb() >= 0 && (peak < 0 || last.peakMemoryKb() < peak)) {
                peak = last.peakMemoryKb();
            }
        }
        return new Measurement(last, best, peak);
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f", fraction * 100);
    }

    private record Measurement(ExecutionReport report, Duration runtime, long peakMemoryKb) {
        boolean succeeded() {
            return report.succeeded();
        }
    }
}
