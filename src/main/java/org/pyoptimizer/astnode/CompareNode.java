package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * A comparison chain {@code a < b <= c}. {@code operators.get(i)} sits between
 * operand i and operand i+1, where operand 0 is {@link #left}.
 */
public class CompareNode extends AbstractNode {
    public final Node left;
    public final List<String> operators;
    public final List<Node> comparators;

    public CompareNode(Node left, List<String> operators, List<Node> comparators) {
        this.left = left;
        this.operators = operators;
        this.comparators = comparators;
    }

    @Override
    public List<Node> children() {
        return childList(left, comparators);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
