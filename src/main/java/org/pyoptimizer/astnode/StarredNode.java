package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Unpacking: {@code *value} in calls, displays and targets, {@code **value} in calls.
 */
public class StarredNode extends AbstractNode {
    /**
     * Either "*" or "**".
     */
    public final String operator;
    public final Node value;

    public StarredNode(String operator, Node value) {
        this.operator = operator;
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return childList(value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
