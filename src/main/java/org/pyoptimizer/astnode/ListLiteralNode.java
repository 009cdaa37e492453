package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The ListLiteralNode class represents a list display {@code [a, b, *c]}.
 */
public class ListLiteralNode extends AbstractNode {
    /**
     * The elements of the list, in source order.
     */
    public final List<Node> elements;

    public ListLiteralNode(List<Node> elements) {
        this.elements = elements;
    }

    @Override
    public List<Node> children() {
        return childList(elements);
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
