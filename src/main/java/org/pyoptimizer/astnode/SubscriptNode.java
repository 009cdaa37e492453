package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Subscription {@code value[index]}. A multi-dimensional index is a {@link TupleNode},
 * a slice is a {@link SliceNode}.
 */
public class SubscriptNode extends AbstractNode {
    public final Node value;
    public final Node index;

    public SubscriptNode(Node value, Node index) {
        this.value = value;
        this.index = index;
    }

    @Override
    public List<Node> children() {
        return childList(value, index);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
