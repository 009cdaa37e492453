package org.pyoptimizer.rules;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.CloneVisitor;
import org.pyoptimizer.astvisitor.ControlFlowDetectorVisitor;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.model.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Memoizes a module-level function that is called repeatedly with the same arguments
 * by decorating it with {@code functools.lru_cache(maxsize=None)}.
 * <p>
 * Whether the function is pure is not checked and cannot be in general: the patch is
 * always HEURISTIC and stands or falls with validation.
 */
public class CacheRule implements TransformationRule {

    @Override
    public RuleKind kind() {
        return RuleKind.CACHE;
    }

    @Override
    public FindingKind handles() {
        return FindingKind.REPEATED_COMPUTATION;
    }

    @Override
    public RuleResult apply(Finding finding, RuleContext context) {
        String callee = finding.getString(Evidence.CALLEE);
        if (callee == null || callee.contains(".")) {
            return RuleResult.declined("callee " + callee + " is not a function defined in this script");
        }
        FunctionDefNode function = null;
        for (Node statement : context.module().body.elements) {
            if (statement instanceof FunctionDefNode def && def.name.equals(callee)) {
                if (function != null) {
                    return RuleResult.declined("function " + callee + " is defined more than once");
                }
                function = def;
            } else if (NameUsageVisitor.scan(statement).getStored().contains(callee)) {
                return RuleResult.declined("name " + callee + " is rebound at module level");
            }
        }
        if (function == null) {
            return RuleResult.declined("callee " + callee + " is not a module-level function");
        }
        if (function.isAsync) {
            return RuleResult.declined("function " + callee + " is a coroutine");
        }
        if (ControlFlowDetectorVisitor.scan(function.body).hasYield()) {
            return RuleResult.declined("function " + callee + " is a generator");
        }
        if (isCached(function)) {
            return RuleResult.declined("function " + callee + " is already cached");
        }
        if (context.bindsOtherwise(RequiredImport.FUNCTOOLS)) {
            return RuleResult.declined("the name functools is already bound to something else");
        }

        NodeFactory nodes = context.factory(function.getSpan());
        List<Node> decorators = new ArrayList<>();
        decorators.add(nodes.call("functools.lru_cache", nodes.keyword("maxsize", nodes.finish(new ConstantNode("None")))));
        decorators.addAll(CloneVisitor.cloneList(function.decorators));
        FunctionDefNode copy = CloneVisitor.cloneNode(function);
        FunctionDefNode cached = new FunctionDefNode(copy.name, copy.parameters, copy.returns, copy.body, decorators,
                copy.isAsync);
        cached.id = function.id;
        cached.span = function.span;
        cached.headerSpan = function.headerSpan;

        Anchor anchor = new Anchor(function.getId(), function.headerSpan);
        String rationale = "Calls " + finding.getString(Evidence.SIGNATURE) + " repeat with identical arguments (lines "
                + finding.get(Evidence.CALL_SITE_LINES) + "); results of " + callee
                + " are memoized. The function is assumed to be pure; validation decides.";
        return RuleResult.applied(new Patch(context.nextPatchId(), kind(), finding, anchor, List.of(cached),
                rationale, SafetyLevel.HEURISTIC, EnumSet.of(RequiredImport.FUNCTOOLS)));
    }

    private static boolean isCached(FunctionDefNode function) {
        for (Node decorator : function.decorators) {
            Node target = decorator instanceof CallNode call ? call.function : decorator;
            String name = target instanceof AttributeNode attribute ? attribute.attribute
                    : target instanceof IdentifierNode identifier ? identifier.name : null;
            if ("lru_cache".equals(name) || "cache".equals(name)) {
                return true;
            }
        }
        return false;
    }
}
