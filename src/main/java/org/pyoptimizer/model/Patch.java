package org.pyoptimizer.model;

import org.pyoptimizer.astnode.Node;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A proposed rewrite: the statement at {@code anchor} is replaced by the
 * {@code replacement} statements.
 *
 * @param id              sequence number within one file
 * @param ruleKind        the rule that produced it
 * @param finding         the finding it fixes
 * @param anchor          the statement it replaces
 * @param replacement     replacement statements, spliced into the enclosing block
 * @param rationale       human readable explanation
 * @param safety          how much the rewrite can be trusted before validation
 * @param requiredImports modules the replacement refers to
 */
public record Patch(int id, RuleKind ruleKind, Finding finding, Anchor anchor, List<Node> replacement,
                    String rationale, SafetyLevel safety, Set<RequiredImport> requiredImports) {

    public Patch {
        replacement = List.copyOf(replacement);
        requiredImports = requiredImports.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(requiredImports));
    }

    public boolean isProven() {
        return safety == SafetyLevel.PROVEN;
    }

    /**
     * Short description for logs and reports, e.g. "#2 VECTORIZE@5".
     */
    public String label() {
        return "#" + id + " " + ruleKind + "@" + anchor.span().startLine();
    }

    @Override
    public String toString() {
        return label() + " (" + safety + ")";
    }
}
