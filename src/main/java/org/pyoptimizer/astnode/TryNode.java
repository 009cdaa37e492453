package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The TryNode class represents a {@code try} statement with its handlers and the
 * optional {@code else} and {@code finally} blocks.
 */
public class TryNode extends AbstractNode {
    /**
     * The protected block.
     */
    public final BlockNode body;
    public final List<ExceptHandler> handlers;
    public final BlockNode elseBlock;
    public final BlockNode finallyBlock;

    public TryNode(BlockNode body, List<ExceptHandler> handlers, BlockNode elseBlock, BlockNode finallyBlock) {
        this.body = body;
        this.handlers = handlers;
        this.elseBlock = elseBlock;
        this.finallyBlock = finallyBlock;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>();
        parts.add(body);
        for (ExceptHandler handler : handlers) {
            parts.add(handler.type());
            parts.add(handler.body());
        }
        parts.add(elseBlock);
        parts.add(finallyBlock);
        return childList(parts.toArray());
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
