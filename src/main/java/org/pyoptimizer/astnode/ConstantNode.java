package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Keyword constants: {@code None}, {@code True}, {@code False} and the ellipsis {@code ...}.
 */
public class ConstantNode extends AbstractNode {
    public final String value;

    public ConstantNode(String value) {
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
