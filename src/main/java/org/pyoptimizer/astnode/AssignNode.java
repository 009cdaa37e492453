package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The AssignNode class represents an assignment statement. Chained assignments
 * {@code a = b = value} have several targets, assigned left to right.
 */
public class AssignNode extends AbstractNode {
    public final List<Node> targets;
    public final Node value;

    public AssignNode(List<Node> targets, Node value) {
        this.targets = targets;
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return childList(targets, value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
