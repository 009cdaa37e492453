package org.pyoptimizer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the pipeline learned about one file. Handed read-only to report sinks.
 *
 * @param path              the input file
 * @param sourceUnit        the parsed unit, null when the file could not be read or parsed
 * @param status            how far processing got
 * @param findings          analyzer findings, in source order
 * @param candidatePatches  the conflict-free patches planned for the file, before validation
 * @param appliedPatches    patches with an ACCEPTED verdict, present in {@code transformedText}
 * @param supersededPatches candidates dropped by conflict resolution
 * @param declinedFindings  findings no rule turned into a patch
 * @param validationResults one result per validated candidate patch
 * @param transformedText   the optimized script, null unless at least one patch was accepted
 * @param failureMessage    why processing stopped, null for COMPLETED
 */
public record Outcome(Path path,
                      SourceUnit sourceUnit,
                      Status status,
                      List<Finding> findings,
                      List<Patch> candidatePatches,
                      List<Patch> appliedPatches,
                      List<SupersededPatch> supersededPatches,
                      List<DeclinedFinding> declinedFindings,
                      List<ValidationResult> validationResults,
                      String transformedText,
                      String failureMessage) {

    public Outcome {
        findings = List.copyOf(findings);
        candidatePatches = List.copyOf(candidatePatches);
        appliedPatches = List.copyOf(appliedPatches);
        supersededPatches = List.copyOf(supersededPatches);
        declinedFindings = List.copyOf(declinedFindings);
        validationResults = List.copyOf(validationResults);
    }

    public static Outcome failed(Path path, SourceUnit sourceUnit, String message) {
        return new Outcome(path, sourceUnit, Status.FAILED, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                null, message);
    }

    public static Outcome incomplete(Path path, SourceUnit sourceUnit, List<Finding> findings, String message) {
        return new Outcome(path, sourceUnit, Status.INCOMPLETE, findings, List.of(), List.of(), List.of(), List.of(),
                List.of(), null, message);
    }

    public boolean hasTransformedText() {
        return transformedText != null;
    }

    public enum Status {
        COMPLETED,
        /**
         * The file could not be read or parsed.
         */
        FAILED,
        /**
         * Processing was cancelled or could not finish validation; nothing was emitted.
         */
        INCOMPLETE
    }
}
