package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

public class DeleteNode extends AbstractNode {
    public final List<Node> targets;

    public DeleteNode(List<Node> targets) {
        this.targets = targets;
    }

    @Override
    public List<Node> children() {
        return childList(targets);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
