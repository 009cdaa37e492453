package org.pyoptimizer.model;

/**
 * A finding the responsible rule did not turn into a patch, with the reason.
 * {@code ruleKind} is null when no enabled rule handles the finding kind.
 */
public record DeclinedFinding(Finding finding, RuleKind ruleKind, String reason) {
}
