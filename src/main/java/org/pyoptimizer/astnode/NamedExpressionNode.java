package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Assignment expression {@code target := value}.
 */
public class NamedExpressionNode extends AbstractNode {
    public final IdentifierNode target;
    public final Node value;

    public NamedExpressionNode(IdentifierNode target, Node value) {
        this.target = target;
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
