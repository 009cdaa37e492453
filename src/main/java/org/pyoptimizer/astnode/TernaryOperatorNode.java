package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The TernaryOperatorNode class represents the conditional expression
 * {@code trueExpr if condition else falseExpr}.
 */
public class TernaryOperatorNode extends AbstractNode {
    /**
     * The condition expression.
     */
    public final Node condition;

    /**
     * The expression evaluated when the condition is true.
     */
    public final Node trueExpr;

    /**
     * The expression evaluated when the condition is false.
     */
    public final Node falseExpr;

    public TernaryOperatorNode(Node condition, Node trueExpr, Node falseExpr) {
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
    }

    @Override
    public List<Node> children() {
        return childList(trueExpr, condition, falseExpr);
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the AST nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
