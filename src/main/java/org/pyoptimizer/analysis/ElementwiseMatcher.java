package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.NameUsageVisitor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recognizes loops over {@code range(len(A))} whose body updates lists one element
 * at a time.
 * <p>
 * A statement is element-wise when it has the form {@code C[i] = expr} or
 * {@code C[i] op= expr} with {@code op} one of {@code + - * / // %}, and {@code expr}
 * is built from:
 * <ul>
 *   <li>element reads {@code X[i]} indexed by exactly the loop variable,</li>
 *   <li>numeric literals (not imaginary),</li>
 *   <li>names that the loop body neither rebinds nor modifies,</li>
 *   <li>the loop variable itself,</li>
 *   <li>unary {@code +}/{@code -} and binary {@code + - * / // %}.</li>
 * </ul>
 * Shifted indices such as {@code A[i + 1]} are not element-wise. The two-level form
 * is an outer {@code range(len(M))} loop whose only statement is
 * {@code for j in range(len(M[i]))}, with {@code C[i][j]} in place of {@code C[i]};
 * there the indices themselves may not appear bare.
 */
public class ElementwiseMatcher {
    private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "//", "%");

    private ElementwiseMatcher() {
    }

    /**
     * Matches the one-level form.
     *
     * @return the match, or null when the loop has a different shape or no statement
     * of its body is element-wise
     */
    public static ElementwiseLoop matchOneLevel(ForNode loop) {
        if (loop.elseBlock != null || !(LoopShapes.lengthSource(loop) instanceof IdentifierNode source)) {
            return null;
        }
        String index = LoopShapes.loopVariable(loop);
        List<String> indices = List.of(index);
        ElementwiseLoop match = classify(loop, null, indices, source.name, loop.body.elements, loop.body);
        return match == null || match.elementwise().isEmpty() ? null : match;
    }

    /**
     * Matches the two-level form. Only a fully element-wise inner body matches.
     */
    public static ElementwiseLoop matchTwoLevel(ForNode outer) {
        if (outer.elseBlock != null || !(LoopShapes.lengthSource(outer) instanceof IdentifierNode source)) {
            return null;
        }
        ForNode inner = LoopShapes.perfectlyNestedInner(outer);
        if (inner == null || inner.elseBlock != null) {
            return null;
        }
        String outerIndex = LoopShapes.loopVariable(outer);
        String innerIndex = LoopShapes.loopVariable(inner);
        if (outerIndex.equals(innerIndex)
                || !(LoopShapes.lengthSource(inner) instanceof SubscriptNode row)
                || !(row.value instanceof IdentifierNode)
                || !isName(row.index, outerIndex)) {
            return null;
        }
        List<String> indices = List.of(outerIndex, innerIndex);
        ElementwiseLoop match = classify(outer, inner, indices, source.name, inner.body.elements, outer.body);
        if (match == null || match.elementwise().isEmpty() || !match.isFullyElementwise()) {
            return null;
        }
        return match;
    }

    private static ElementwiseLoop classify(ForNode loop, ForNode inner, List<String> indices, String lengthSource,
                                            List<Node> body, BlockNode scanRoot) {
        NameUsageVisitor usage = NameUsageVisitor.scan(scanRoot);
        NameUsageVisitor innermost = NameUsageVisitor.scan(inner != null ? inner.body : loop.body);
        for (String index : indices) {
            if (innermost.getStored().contains(index)) {
                return null;
            }
        }
        List<ElementwiseStatement> elementwise = new ArrayList<>();
        List<Node> others = new ArrayList<>();
        for (int position = 0; position < body.size(); position++) {
            Node statement = body.get(position);
            ElementwiseStatement match = matchStatement(statement, position, indices);
            if (match != null) {
                elementwise.add(match);
            } else {
                others.add(statement);
            }
        }

        // Names touched by the other statements must stay put for the whole loop.
        NameUsageVisitor otherUsage = new NameUsageVisitor();
        others.forEach(statement -> statement.accept(otherUsage));
        if (usage.getStored().contains(lengthSource) || otherUsage.getMutated().contains(lengthSource)) {
            return null;
        }
        Set<String> written = new HashSet<>();
        elementwise.forEach(statement -> written.add(statement.container()));
        List<ElementwiseStatement> kept = new ArrayList<>();
        for (ElementwiseStatement statement : elementwise) {
            if (isStable(statement, written, usage, otherUsage)) {
                kept.add(statement);
            } else {
                others.add(statement.statement());
            }
        }
        others.sort((a, b) -> Integer.compare(body.indexOf(a), body.indexOf(b)));
        return new ElementwiseLoop(loop, inner, indices, lengthSource, kept, others);
    }

    private static boolean isStable(ElementwiseStatement statement, Set<String> written,
                                    NameUsageVisitor usage, NameUsageVisitor otherUsage) {
        Set<String> containers = new HashSet<>(statement.containersRead());
        containers.add(statement.container());
        for (String container : containers) {
            if (usage.getStored().contains(container) || otherUsage.getMutated().contains(container)) {
                return false;
            }
        }
        for (String scalar : statement.facts().scalars()) {
            if (usage.mayChange(scalar) || written.contains(scalar)) {
                return false;
            }
        }
        return true;
    }

    private static ElementwiseStatement matchStatement(Node statement, int position, List<String> indices) {
        Node target;
        String operator;
        Node value;
        if (statement instanceof AssignNode assign && assign.targets.size() == 1) {
            target = assign.targets.get(0);
            operator = null;
            value = assign.value;
        } else if (statement instanceof AugAssignNode augmented && OPERATORS.contains(augmented.operator)) {
            target = augmented.target;
            operator = augmented.operator;
            value = augmented.value;
        } else {
            return null;
        }
        String container = elementContainer(target, indices);
        if (container == null || indices.contains(container)) {
            return null;
        }
        ExpressionFacts facts = new ExpressionFacts();
        if (operator != null) {
            facts.addContainer(container);
            facts.countOperator(operator);
            if (isZeroDivisor(operator, value)) {
                return null;
            }
            if (isDivision(operator) && !(value instanceof NumberNode)) {
                facts.markVariableDivisor();
            }
        }
        if (!matchExpression(value, indices, facts)) {
            return null;
        }
        return new ElementwiseStatement(statement, position, container, operator, value, facts);
    }

    /**
     * For {@code C[i]} (or {@code C[i][j]} with two indices) returns C, otherwise null.
     */
    public static String elementContainer(Node node, List<String> indices) {
        Node current = node;
        for (int level = indices.size() - 1; level >= 0; level--) {
            if (!(current instanceof SubscriptNode subscript) || !isName(subscript.index, indices.get(level))) {
                return null;
            }
            current = subscript.value;
        }
        return current instanceof IdentifierNode identifier ? identifier.name : null;
    }

    private static boolean matchExpression(Node node, List<String> indices, ExpressionFacts facts) {
        if (node instanceof NumberNode number) {
            if (number.isImaginary()) {
                return false;
            }
            facts.addLiteral(number);
            return true;
        }
        if (node instanceof IdentifierNode identifier) {
            if (indices.contains(identifier.name)) {
                if (indices.size() > 1) {
                    return false;
                }
                facts.markIndexUse();
                return true;
            }
            facts.addScalar(identifier.name);
            return true;
        }
        if (node instanceof SubscriptNode) {
            String container = elementContainer(node, indices);
            if (container == null || indices.contains(container)) {
                return false;
            }
            facts.addContainer(container);
            return true;
        }
        if (node instanceof OperatorNode unary) {
            return ("-".equals(unary.operator) || "+".equals(unary.operator))
                    && matchExpression(unary.operand, indices, facts);
        }
        if (node instanceof BinaryOperatorNode binary) {
            if (!OPERATORS.contains(binary.operator) || isZeroDivisor(binary.operator, binary.right)) {
                return false;
            }
            facts.countOperator(binary.operator);
            if (isDivision(binary.operator) && !(binary.right instanceof NumberNode)) {
                facts.markVariableDivisor();
            }
            return matchExpression(binary.left, indices, facts) && matchExpression(binary.right, indices, facts);
        }
        return false;
    }

    private static boolean isDivision(String operator) {
        return "/".equals(operator) || "//".equals(operator) || "%".equals(operator);
    }

    private static boolean isZeroDivisor(String operator, Node divisor) {
        if (!isDivision(operator)) {
            return false;
        }
        return divisor instanceof NumberNode number && !number.isImaginary() && number.doubleValue() == 0.0;
    }

    private static boolean isName(Node node, String name) {
        return node instanceof IdentifierNode identifier && identifier.name.equals(name);
    }
}
