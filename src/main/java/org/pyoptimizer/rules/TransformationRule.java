package org.pyoptimizer.rules;

import org.pyoptimizer.model.Finding;
import org.pyoptimizer.model.FindingKind;
import org.pyoptimizer.model.RuleKind;

/**
 * A rewrite for one kind of finding.
 * <p>
 * Rules inspect the original tree through the {@link RuleContext} and never modify
 * it. A finding the rule cannot rewrite safely is declined with a reason; rules do
 * not throw for unsupported shapes.
 */
public interface TransformationRule {

    RuleKind kind();

    /**
     * The finding kind this rule rewrites.
     */
    FindingKind handles();

    RuleResult apply(Finding finding, RuleContext context);
}
