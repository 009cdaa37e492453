package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The BinaryOperatorNode class represents a node in the abstract syntax tree (AST) that holds
 * a binary operator and its two operands. Arithmetic, bitwise and the boolean
 * {@code and} / {@code or} operators all use this node.
 */
public class BinaryOperatorNode extends AbstractNode {
    /**
     * The operator, e.g. "+", "//", "and".
     */
    public final String operator;

    /**
     * The left operand of the binary operation.
     */
    public final Node left;

    /**
     * The right operand of the binary operation.
     */
    public final Node right;

    public BinaryOperatorNode(String operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public List<Node> children() {
        return childList(left, right);
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
