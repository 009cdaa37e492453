package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The BlockNode class represents a suite of statements: a module body, the body
 * of a compound statement or one of its clauses.
 * <p>
 * The element list is mutable; it is the only place where the transformation engine
 * splices replacement statements into a working tree.
 */
public class BlockNode extends AbstractNode {
    /**
     * The list of statements in this block.
     */
    public final List<Node> elements;

    /**
     * Constructs a new BlockNode with the specified list of statements.
     *
     * @param elements a mutable list of statement nodes
     */
    public BlockNode(List<Node> elements) {
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
