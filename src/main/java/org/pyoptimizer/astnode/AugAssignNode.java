package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Augmented assignment {@code target op= value}.
 */
public class AugAssignNode extends AbstractNode {
    public final Node target;
    /**
     * The binary operator without the trailing "=", e.g. "+" for "+=".
     */
    public final String operator;
    public final Node value;

    public AugAssignNode(Node target, String operator, Node value) {
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return childList(target, value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
