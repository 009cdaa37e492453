package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The IdentifierNode class represents a plain name, either read (a variable reference)
 * or written (an assignment target); the role follows from the parent node.
 */
public class IdentifierNode extends AbstractNode {
    /**
     * The name, exactly as written.
     */
    public final String name;

    public IdentifierNode(String name) {
        this.name = name;
    }

    @Override
    public List<Node> children() {
        return List.of();
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
