package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The keyword statements without operands: {@code pass}, {@code break} and {@code continue}.
 */
public class ControlStatementNode extends AbstractNode {
    public final String keyword;

    public ControlStatementNode(String keyword) {
        this.keyword = keyword;
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
