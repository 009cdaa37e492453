package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The IfNode class represents an {@code if} statement.
 * <p>
 * An {@code elif} chain is a nested IfNode as the only element of the else block,
 * with {@link #isElif} set so that it regenerates as {@code elif}.
 */
public class IfNode extends AbstractNode {
    public final Node condition;
    public final BlockNode thenBlock;
    /**
     * The else block, or null.
     */
    public final BlockNode elseBlock;
    public final boolean isElif;

    public IfNode(Node condition, BlockNode thenBlock, BlockNode elseBlock, boolean isElif) {
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
        this.isElif = isElif;
    }

    @Override
    public List<Node> children() {
        return childList(condition, thenBlock, elseBlock);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
