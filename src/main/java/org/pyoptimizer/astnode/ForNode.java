package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The ForNode class represents a {@code for target in iterable:} loop, with its
 * optional {@code else} clause.
 */
public class ForNode extends AbstractNode {
    /**
     * The loop target: a name, a tuple of targets, an attribute or a subscript.
     */
    public final Node target;

    /**
     * The iterated expression.
     */
    public final Node iterable;

    /**
     * The loop body.
     */
    public final BlockNode body;

    /**
     * The else clause, or null.
     */
    public final BlockNode elseBlock;

    public final boolean isAsync;

    public ForNode(Node target, Node iterable, BlockNode body, BlockNode elseBlock, boolean isAsync) {
        this.target = target;
        this.iterable = iterable;
        this.body = body;
        this.elseBlock = elseBlock;
        this.isAsync = isAsync;
    }

    @Override
    public List<Node> children() {
        return childList(target, iterable, body, elseBlock);
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the AST nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
