package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

public class WhileNode extends AbstractNode {
    public final Node condition;
    public final BlockNode body;
    public final BlockNode elseBlock;

    public WhileNode(Node condition, BlockNode body, BlockNode elseBlock) {
        this.condition = condition;
        this.body = body;
        this.elseBlock = elseBlock;
    }

    @Override
    public List<Node> children() {
        return childList(condition, body, elseBlock);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
