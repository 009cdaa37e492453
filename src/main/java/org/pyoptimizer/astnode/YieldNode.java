package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code yield value} or {@code yield from value}; the value may be null for a bare yield.
 */
public class YieldNode extends AbstractNode {
    public final Node value;
    public final boolean isFrom;

    public YieldNode(Node value, boolean isFrom) {
        this.value = value;
        this.isFrom = isFrom;
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
