package org.pyoptimizer.rules;

import org.pyoptimizer.analysis.ConstantEvaluator;
import org.pyoptimizer.analysis.LoopShapes;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.CloneVisitor;
import org.pyoptimizer.astvisitor.ControlFlowDetectorVisitor;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.astvisitor.TraversingVisitor;
import org.pyoptimizer.model.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns two perfectly nested counted loops into a single loop over index pairs.
 * <p>
 * When the inner bounds do not depend on the outer index, and the body calls nothing
 * that could rebind a name they read, the pairs come from {@code itertools.product}.
 * Otherwise a generator expression produces them, which evaluates the inner
 * {@code range} once per outer index exactly like the nest did.
 * Loop nests that can leave early are never flattened.
 */
public class FlattenRule implements TransformationRule {
    private static final Set<String> BUILTINS = Set.of(
            "abs", "len", "min", "max", "sum", "int", "float", "str", "bool", "round", "pow", "divmod",
            "print", "range", "isinstance", "repr");

    @Override
    public RuleKind kind() {
        return RuleKind.FLATTEN;
    }

    @Override
    public FindingKind handles() {
        return FindingKind.NESTED_LOOP;
    }

    @Override
    public RuleResult apply(Finding finding, RuleContext context) {
        if (!(context.resolve(finding.anchor()) instanceof ForNode outer) || !LoopShapes.isCountedLoop(outer)) {
            return RuleResult.declined("anchor is not a counted loop");
        }
        ForNode inner = LoopShapes.perfectlyNestedInner(outer);
        if (inner == null) {
            return RuleResult.declined("inner loop is not the only statement of the outer loop");
        }
        if (outer.elseBlock != null || inner.elseBlock != null) {
            return RuleResult.declined("loop has an else clause");
        }
        ControlFlowDetectorVisitor flow = ControlFlowDetectorVisitor.scan(inner.body);
        if (flow.hasBreak() || flow.hasReturn()) {
            return RuleResult.declined("loop body contains break or return");
        }
        if (LoopShapes.isInClassBody(context.index(), outer)) {
            return RuleResult.declined("loop is directly inside a class body");
        }
        String outerVariable = LoopShapes.loopVariable(outer);
        String innerVariable = LoopShapes.loopVariable(inner);
        if (outerVariable.equals(innerVariable)) {
            return RuleResult.declined("both loops use the variable " + outerVariable);
        }
        NameUsageVisitor body = NameUsageVisitor.scan(inner.body);
        if (body.getStored().contains(outerVariable)) {
            return RuleResult.declined("inner body assigns the outer index " + outerVariable);
        }
        CallNode innerRange = LoopShapes.rangeCall(inner);
        NameUsageVisitor bounds = NameUsageVisitor.scan(innerRange);
        for (String name : bounds.getLoaded()) {
            if (!name.equals(outerVariable) && NameUsageVisitor.scan(outer.body).mayChange(name)) {
                return RuleResult.declined("inner bound " + name + " changes inside the loop");
            }
        }
        for (String variable : List.of(outerVariable, innerVariable)) {
            if (context.isReadOutside(variable, outer)) {
                return RuleResult.declined("loop variable " + variable + " is read outside the loop");
            }
        }

        NodeFactory nodes = context.factory(outer.getSpan());
        boolean invariant = !bounds.getLoaded().contains(outerVariable)
                && hasSimpleArguments(innerRange, callsOnlyBuiltins(outer.body))
                && !context.bindsOtherwise(RequiredImport.ITERTOOLS);
        Node pairs;
        Set<RequiredImport> imports = EnumSet.noneOf(RequiredImport.class);
        String form;
        if (invariant) {
            pairs = nodes.call("itertools.product",
                    CloneVisitor.cloneNode(outer.iterable), CloneVisitor.cloneNode(innerRange));
            imports.add(RequiredImport.ITERTOOLS);
            form = "itertools.product";
        } else {
            pairs = nodes.generator(nodes.tuple(nodes.name(outerVariable), nodes.name(innerVariable)), List.of(
                    new ComprehensionClause(nodes.name(outerVariable), CloneVisitor.cloneNode(outer.iterable),
                            List.of(), false),
                    new ComprehensionClause(nodes.name(innerVariable), CloneVisitor.cloneNode(innerRange),
                            List.of(), false)));
            form = "a generator of index pairs";
        }
        ForNode flat = nodes.forLoop(nodes.tuple(nodes.name(outerVariable), nodes.name(innerVariable)), pairs,
                CloneVisitor.cloneNode(inner.body));
        String rationale = "Nested loops over " + outerVariable + " and " + innerVariable
                + " run as one loop over " + form + "; iteration order and body are unchanged.";
        return RuleResult.applied(new Patch(context.nextPatchId(), kind(), finding, finding.anchor(),
                List.of(flat), rationale, SafetyLevel.PROVEN, imports));
    }

    /**
     * Literal-foldable arguments, and plain names when {@code namesAllowed}, so building
     * the range up front evaluates nothing the nest would not.
     */
    private static boolean hasSimpleArguments(CallNode range, boolean namesAllowed) {
        for (Node argument : range.arguments) {
            if (argument instanceof IdentifierNode) {
                if (!namesAllowed) {
                    return false;
                }
            } else if (ConstantEvaluator.evaluate(argument) == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when every call in {@code body} is one of {@link #BUILTINS}. Any other call
     * may rebind a global the inner bound reads.
     */
    private static boolean callsOnlyBuiltins(Node body) {
        boolean[] other = {false};
        body.accept(new TraversingVisitor() {
            @Override
            public void visit(CallNode node) {
                if (!(node.function instanceof IdentifierNode name) || !BUILTINS.contains(name.name)) {
                    other[0] = true;
                }
                visitChildren(node);
            }
        });
        return !other[0];
    }
}
