package org.pyoptimizer.validation;

import org.pyoptimizer.model.Patch;
import org.pyoptimizer.model.ValidationResult;

import java.util.List;

/**
 * Validation of all candidate patches of one script.
 *
 * @param results         one final result per candidate, in candidate order
 * @param accepted        the patches that survived, individually and together
 * @param transformedText the script with all accepted patches, null when none was accepted
 */
public record ValidationReport(List<ValidationResult> results, List<Patch> accepted, String transformedText) {

    public ValidationReport {
        results = List.copyOf(results);
        accepted = List.copyOf(accepted);
    }
}
