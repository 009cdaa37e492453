package org.pyoptimizer.engine;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.CloneVisitor;
import org.pyoptimizer.model.*;
import org.pyoptimizer.parser.PythonParserAdapter;
import org.pyoptimizer.rules.NodeFactory;
import org.pyoptimizer.rules.RuleContext;
import org.pyoptimizer.rules.RuleResult;
import org.pyoptimizer.rules.RuleSet;
import org.pyoptimizer.rules.TransformationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns findings into a conflict-free set of patches and renders any subset of them
 * as source text.
 * <p>
 * Planning never touches the parsed tree. Rendering works on a deep copy, so the same
 * unit can be rendered with different patch subsets (one patch alone, all accepted
 * patches, all but one) any number of times.
 */
public class TransformationEngine {
    private static final Logger log = LoggerFactory.getLogger(TransformationEngine.class);
    private static final String REPORT_ONLY = "no rewrite rule for this pattern; reported only";

    private final RuleSet rules;
    private final PythonParserAdapter parserAdapter;

    public TransformationEngine(RuleSet rules, PythonParserAdapter parserAdapter) {
        this.rules = rules;
        this.parserAdapter = parserAdapter;
    }

    /**
     * Runs the enabled rules over the findings and resolves conflicts: of two
     * overlapping candidates the one of the higher priority rule family wins
     * (flatten before vectorize before cache), and within a family the earlier one.
     */
    public PlanResult plan(SourceUnit unit, List<Finding> findings) {
        RuleContext context = new RuleContext(unit);
        List<Patch> candidates = new ArrayList<>();
        List<DeclinedFinding> declined = new ArrayList<>();
        for (Finding finding : findings) {
            TransformationRule rule = rules.ruleFor(finding.kind());
            if (rule == null) {
                RuleKind disabled = rules.disabledRuleFor(finding.kind());
                String reason = disabled != null ? "rule " + disabled.optionName() + " is disabled" : REPORT_ONLY;
                declined.add(new DeclinedFinding(finding, disabled, reason));
                continue;
            }
            RuleResult result = rule.apply(finding, context);
            if (result.isApplied()) {
                candidates.add(result.patch());
            } else {
                log.debug("{}: {} declined {}: {}", unit.fileName(), rule.kind(), finding, result.reason());
                declined.add(new DeclinedFinding(finding, rule.kind(), result.reason()));
            }
        }

        List<Patch> byPriority = new ArrayList<>(candidates);
        byPriority.sort(Comparator.comparing(Patch::ruleKind)
                .thenComparing(patch -> patch.anchor().span())
                .thenComparingInt(Patch::id));
        List<Patch> kept = new ArrayList<>();
        List<SupersededPatch> superseded = new ArrayList<>();
        for (Patch candidate : byPriority) {
            Patch winner = null;
            for (Patch accepted : kept) {
                if (accepted.anchor().overlaps(candidate.anchor())) {
                    winner = accepted;
                    break;
                }
            }
            if (winner == null) {
                kept.add(candidate);
            } else {
                log.debug("{}: {} superseded by {}", unit.fileName(), candidate.label(), winner.label());
                superseded.add(new SupersededPatch(candidate, winner));
            }
        }
        kept.sort(Comparator.comparing((Patch patch) -> patch.anchor().span()).thenComparingInt(Patch::id));
        log.info("{}: {} patch(es) planned, {} superseded, {} finding(s) declined",
                unit.fileName(), kept.size(), superseded.size(), declined.size());
        return new PlanResult(kept, superseded, declined);
    }

    /**
     * Renders the script with the given patches applied.
     * <p>
     * Patches are applied outermost first. A patch whose anchor is no longer part of
     * the working tree is skipped as stale. Imports the applied patches need are added
     * after the module docstring and {@code __future__} imports unless the script
     * already has them. With no patches the result is the unparsed original.
     */
    public String render(SourceUnit unit, Collection<Patch> patches) {
        SyntaxTree working = unit.tree().copy();
        List<Patch> ordered = new ArrayList<>(patches);
        ordered.sort(Comparator.comparing((Patch patch) -> patch.anchor().span().startLine())
                .thenComparing(patch -> -patch.anchor().span().endLine())
                .thenComparingInt(Patch::id));
        Set<RequiredImport> imports = EnumSet.noneOf(RequiredImport.class);
        for (Patch patch : ordered) {
            if (splice(working, patch)) {
                imports.addAll(patch.requiredImports());
            } else {
                log.warn("{}: skipping stale patch {}", unit.fileName(), patch.label());
            }
        }
        addImports(working, imports);
        return parserAdapter.unparse(working);
    }

    private static boolean splice(SyntaxTree working, Patch patch) {
        TreeIndex index = new TreeIndex(working.root);
        Node target = index.get(patch.anchor().nodeId());
        BlockNode block = target == null ? null : index.blockOf(target);
        if (block == null) {
            return false;
        }
        int position = block.elements.indexOf(target);
        block.elements.remove(position);
        block.elements.addAll(position, CloneVisitor.cloneList(patch.replacement()));
        return true;
    }

    private static void addImports(SyntaxTree working, Set<RequiredImport> imports) {
        List<Node> body = working.root.body.elements;
        int position = 0;
        if (!body.isEmpty() && body.get(0) instanceof ExpressionStatementNode first
                && first.expression instanceof StringNode) {
            position = 1;
        }
        while (position < body.size() && body.get(position) instanceof ImportFromNode from
                && "__future__".equals(from.module)) {
            position++;
        }
        NodeFactory nodes = new NodeFactory(working, SourceSpan.UNKNOWN);
        for (RequiredImport required : imports) {
            if (!hasImport(body, required)) {
                body.add(position++, nodes.importStatement(required.module(), required.alias()));
            }
        }
    }

    private static boolean hasImport(List<Node> body, RequiredImport required) {
        for (Node statement : body) {
            if (statement instanceof ImportNode importNode) {
                for (ImportAlias alias : importNode.names) {
                    if (alias.name().equals(required.module()) && alias.boundName().equals(required.boundName())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
