package org.pyoptimizer.rules;

import org.pyoptimizer.model.Patch;

/**
 * What a rule made of a finding: a patch, or the reason it did not produce one.
 */
public record RuleResult(Patch patch, String reason) {

    public static RuleResult applied(Patch patch) {
        return new RuleResult(patch, null);
    }

    public static RuleResult declined(String reason) {
        return new RuleResult(null, reason);
    }

    public boolean isApplied() {
        return patch != null;
    }
}
