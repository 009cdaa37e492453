package org.pyoptimizer.rules;

import org.pyoptimizer.analysis.ElementwiseLoop;
import org.pyoptimizer.analysis.ElementwiseMatcher;
import org.pyoptimizer.analysis.ElementwiseStatement;
import org.pyoptimizer.analysis.ExpressionFacts;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.CloneVisitor;
import org.pyoptimizer.astvisitor.ControlFlowDetectorVisitor;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.astvisitor.TraversingVisitor;
import org.pyoptimizer.model.*;

import java.math.BigInteger;
import java.util.*;

/**
 * Replaces element-wise list updates inside {@code for i in range(len(A))} loops by
 * NumPy array expressions.
 * <p>
 * Each element-wise statement {@code C[i] = expr} becomes
 * {@code C[:] = (<array expr>).tolist()}: containers are read through
 * {@code np.asarray}, the index becomes {@code np.arange(len(A))}, and the slice
 * assignment keeps the identity and the element type of the list. Containers not
 * known to be as long as A are sliced to {@code len(A)}.
 * <p>
 * When only some statements of the body are element-wise they are hoisted in front of
 * a loop over the rest, provided the rest cannot observe the difference.
 * <p>
 * Safety is PROVEN only for the fully element-wise one-level form over list literals
 * of small integers with at most one multiplication or division, where fixed-width
 * arithmetic cannot differ from Python's. Everything else is HEURISTIC.
 */
public class VectorizeRule implements TransformationRule {
    private static final BigInteger SMALL = BigInteger.valueOf(1_000_000);
    private static final Set<String> PURE_BUILTINS = Set.of(
            "print", "len", "abs", "min", "max", "round", "int", "float", "str", "bool", "repr", "format",
            "divmod", "pow");

    @Override
    public RuleKind kind() {
        return RuleKind.VECTORIZE;
    }

    @Override
    public FindingKind handles() {
        return FindingKind.VECTORIZABLE_LOOP;
    }

    @Override
    public RuleResult apply(Finding finding, RuleContext context) {
        if (!(context.resolve(finding.anchor()) instanceof ForNode loop)) {
            return RuleResult.declined("anchor is not a loop");
        }
        if (context.bindsOtherwise(RequiredImport.NUMPY)) {
            return RuleResult.declined("the name np is already bound to something other than numpy");
        }
        ElementwiseLoop match = Integer.valueOf(2).equals(finding.get(Evidence.DIMENSIONS))
                ? ElementwiseMatcher.matchTwoLevel(loop)
                : ElementwiseMatcher.matchOneLevel(loop);
        if (match == null) {
            return RuleResult.declined("loop body has no element-wise statement");
        }
        LiteralBindings bindings = LiteralBindings.before(context.index(), loop);
        NodeFactory nodes = context.factory(loop.getSpan());
        ArrayExpressions arrays = new ArrayExpressions(nodes, match, bindings);

        List<Node> replacement = new ArrayList<>();
        for (ElementwiseStatement statement : match.elementwise()) {
            replacement.add(arrays.statement(statement));
        }
        SafetyLevel safety;
        String rationale;
        if (match.isFullyElementwise()) {
            for (String index : match.indices()) {
                if (context.isReadOutside(index, loop)) {
                    return RuleResult.declined("loop variable " + index + " is read outside the loop");
                }
            }
            safety = isProven(match, bindings) ? SafetyLevel.PROVEN : SafetyLevel.HEURISTIC;
            rationale = "Loop over " + match.lengthSource() + " updates lists element by element; "
                    + "the " + match.elementwise().size() + " update(s) run as NumPy array expressions.";
        } else {
            String reason = partialBlocker(match);
            if (reason != null) {
                return RuleResult.declined(reason);
            }
            List<Node> rest = new ArrayList<>();
            for (Node statement : match.others()) {
                rest.add(CloneVisitor.cloneNode(statement));
            }
            replacement.add(nodes.forLoop(CloneVisitor.cloneNode(loop.target), CloneVisitor.cloneNode(loop.iterable),
                    nodes.block(rest)));
            safety = SafetyLevel.HEURISTIC;
            rationale = match.elementwise().size() + " of " + match.body().size()
                    + " statements of the loop over " + match.lengthSource()
                    + " run as NumPy array expressions before the loop; the rest stays in the loop.";
        }
        return RuleResult.applied(new Patch(context.nextPatchId(), kind(), finding, finding.anchor(), replacement,
                rationale, safety, EnumSet.of(RequiredImport.NUMPY)));
    }

    /**
     * Fixed-width arithmetic agrees with Python only while no value can grow past
     * 2^53; bounded literals and a single multiplicative step keep it there.
     */
    private static boolean isProven(ElementwiseLoop match, LiteralBindings bindings) {
        if (match.dimensions() != 1 || !bindings.isSmallIntegerList(match.lengthSource(), SMALL)) {
            return false;
        }
        int multiplicative = 0;
        for (ElementwiseStatement statement : match.elementwise()) {
            ExpressionFacts facts = statement.facts();
            multiplicative += facts.multiplicativeOperators();
            if (facts.hasVariableDivisor()) {
                return false;
            }
            Set<String> containers = new HashSet<>(facts.containers());
            containers.add(statement.container());
            for (String container : containers) {
                if (!bindings.isSmallIntegerList(container, SMALL)
                        || !bindings.sameLength(container, match.lengthSource())) {
                    return false;
                }
            }
            for (String scalar : facts.scalars()) {
                if (!bindings.isSmallInteger(scalar, SMALL)) {
                    return false;
                }
            }
            for (NumberNode literal : facts.literals()) {
                if (!literal.isInteger() || !LiteralBindings.isSmall(literal.integerValue(), SMALL)) {
                    return false;
                }
            }
        }
        return multiplicative <= 1;
    }

    /**
     * Why the element-wise statements cannot move in front of the remaining loop, or
     * null when they can.
     */
    private static String partialBlocker(ElementwiseLoop match) {
        if (match.dimensions() != 1) {
            return "two-level loops are only vectorized as a whole";
        }
        String index = match.index();
        NameUsageVisitor rest = new NameUsageVisitor();
        for (Node statement : match.others()) {
            statement.accept(rest);
            ControlFlowDetectorVisitor flow = ControlFlowDetectorVisitor.scan(statement);
            if (flow.hasBreak() || flow.hasContinue() || flow.hasReturn() || flow.hasYield()) {
                return "remaining loop statements can leave an iteration early";
            }
            String call = impureCall(statement);
            if (call != null) {
                return "remaining loop statements call " + call;
            }
        }
        for (ElementwiseStatement hoisted : match.elementwise()) {
            Set<String> read = new HashSet<>(hoisted.containersRead());
            read.addAll(hoisted.facts().scalars());
            read.add(hoisted.container());
            for (String name : read) {
                if (rest.mayChange(name)) {
                    return "remaining loop statements change " + name;
                }
            }
        }
        Map<String, List<Integer>> writers = new HashMap<>();
        for (ElementwiseStatement hoisted : match.elementwise()) {
            writers.computeIfAbsent(hoisted.container(), k -> new ArrayList<>()).add(hoisted.position());
        }
        List<Node> body = match.body();
        for (Node statement : match.others()) {
            int position = body.indexOf(statement);
            ElementReads reads = ElementReads.scan(statement, index, writers.keySet());
            if (!reads.onlyIndexed) {
                return "remaining loop statements use a vectorized list other than through [" + index + "]";
            }
            for (String container : reads.containers) {
                for (int writer : writers.get(container)) {
                    if (writer > position) {
                        return "list " + container + " is read before a later statement updates it";
                    }
                }
            }
        }
        return null;
    }

    private static String impureCall(Node statement) {
        String[] found = new String[1];
        statement.accept(new TraversingVisitor() {
            @Override
            public void visit(CallNode node) {
                if (found[0] == null && !(node.function instanceof IdentifierNode name
                        && PURE_BUILTINS.contains(name.name))) {
                    found[0] = node.function instanceof IdentifierNode function
                            ? function.name : "a method or computed function";
                }
                visitChildren(node);
            }
        });
        return found[0];
    }

    /**
     * How a statement refers to a set of lists: which of them it reads as
     * {@code C[index]}, and whether it refers to them in any other way.
     */
    private static class ElementReads extends TraversingVisitor {
        private final String index;
        private final Set<String> lists;
        final Set<String> containers = new LinkedHashSet<>();
        boolean onlyIndexed = true;

        private ElementReads(String index, Set<String> lists) {
            this.index = index;
            this.lists = lists;
        }

        static ElementReads scan(Node statement, String index, Set<String> lists) {
            ElementReads reads = new ElementReads(index, lists);
            statement.accept(reads);
            return reads;
        }

        @Override
        public void visit(SubscriptNode node) {
            String container = ElementwiseMatcher.elementContainer(node, List.of(index));
            if (container != null && lists.contains(container)) {
                containers.add(container);
                return;
            }
            visitChildren(node);
        }

        @Override
        public void visit(IdentifierNode node) {
            if (lists.contains(node.name)) {
                onlyIndexed = false;
            }
        }
    }

    /**
     * Builds the array form of element-wise statements.
     */
    private static class ArrayExpressions {
        private final NodeFactory nodes;
        private final ElementwiseLoop match;
        private final LiteralBindings bindings;

        ArrayExpressions(NodeFactory nodes, ElementwiseLoop match, LiteralBindings bindings) {
            this.nodes = nodes;
            this.match = match;
            this.bindings = bindings;
        }

        Node statement(ElementwiseStatement statement) {
            Node value = expression(statement.value());
            if (statement.operator() != null) {
                value = nodes.binary(statement.operator(), asArray(statement.container()), value);
            } else if (statement.containersRead().isEmpty() && !statement.facts().usesIndex()) {
                value = nodes.call("np.full", shape(), value);
            }
            Node tolist = nodes.call(nodes.attribute(value, "tolist"));
            Node target = nodes.subscript(nodes.name(statement.container()),
                    nodes.slice(null, isFullLength(statement.container()) ? null : length()));
            return nodes.assign(target, tolist);
        }

        private Node expression(Node node) {
            if (node instanceof IdentifierNode identifier) {
                if (match.indices().contains(identifier.name)) {
                    return nodes.call("np.arange", length());
                }
                return CloneVisitor.cloneNode(identifier);
            }
            if (node instanceof SubscriptNode) {
                return asArray(ElementwiseMatcher.elementContainer(node, match.indices()));
            }
            if (node instanceof OperatorNode unary) {
                return nodes.unary(unary.operator, expression(unary.operand));
            }
            if (node instanceof BinaryOperatorNode binary) {
                return nodes.binary(binary.operator, expression(binary.left), expression(binary.right));
            }
            return CloneVisitor.cloneNode(node);
        }

        private Node asArray(String container) {
            Node source = nodes.name(container);
            if (!isFullLength(container)) {
                source = nodes.subscript(source, nodes.slice(null, length()));
            }
            return nodes.call("np.asarray", source);
        }

        private boolean isFullLength(String container) {
            return match.dimensions() == 2
                    || container.equals(match.lengthSource())
                    || bindings.sameLength(container, match.lengthSource());
        }

        private Node length() {
            return nodes.call("len", nodes.name(match.lengthSource()));
        }

        private Node shape() {
            return match.dimensions() == 2 ? nodes.call("np.shape", nodes.name(match.lengthSource())) : length();
        }
    }
}
