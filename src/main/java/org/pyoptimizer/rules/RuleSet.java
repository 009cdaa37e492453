package org.pyoptimizer.rules;

import org.pyoptimizer.model.FindingKind;
import org.pyoptimizer.model.RuleKind;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The table from finding kind to the rule that rewrites it, restricted to the
 * enabled rule families.
 */
public class RuleSet {
    private final Map<FindingKind, TransformationRule> byFinding = new EnumMap<>(FindingKind.class);
    private final Map<FindingKind, RuleKind> disabled = new EnumMap<>(FindingKind.class);

    public RuleSet(Collection<TransformationRule> rules, Set<RuleKind> enabled) {
        for (TransformationRule rule : rules) {
            if (enabled.contains(rule.kind())) {
                byFinding.put(rule.handles(), rule);
            } else {
                disabled.put(rule.handles(), rule.kind());
            }
        }
    }

    /**
     * The three built-in rules, filtered by {@code enabled}.
     */
    public static RuleSet standard(Set<RuleKind> enabled) {
        return new RuleSet(List.of(new FlattenRule(), new VectorizeRule(), new CacheRule()), enabled);
    }

    /**
     * The enabled rule for a finding kind, or null.
     */
    public TransformationRule ruleFor(FindingKind kind) {
        return byFinding.get(kind);
    }

    /**
     * The disabled rule family that would handle a finding kind, or null when the kind
     * has an enabled rule or no rule at all.
     */
    public RuleKind disabledRuleFor(FindingKind kind) {
        return disabled.get(kind);
    }
}
