package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

public class ReturnNode extends AbstractNode {
    /**
     * The returned expression, null for a bare return.
     */
    public final Node value;

    public ReturnNode(Node value) {
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
