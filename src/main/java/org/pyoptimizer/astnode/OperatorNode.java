package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The OperatorNode class represents a unary operator and its operand: {@code -x},
 * {@code +x}, {@code ~x}, {@code not x} and {@code await x}.
 */
public class OperatorNode extends AbstractNode {
    /**
     * The operator represented by this node.
     */
    public final String operator;
    /**
     * The operand on which the operator is applied.
     */
    public final Node operand;

    public OperatorNode(String operator, Node operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public List<Node> children() {
        return childList(operand);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
