package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

public class AssertNode extends AbstractNode {
    public final Node test;
    public final Node message;

    public AssertNode(Node test, Node message) {
        this.test = test;
        this.message = message;
    }

    @Override
    public List<Node> children() {
        return childList(test, message);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
