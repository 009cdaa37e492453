package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * A tuple, parenthesized or bare ({@code a, b = b, a}).
 */
public class TupleNode extends AbstractNode {
    public final List<Node> elements;

    public TupleNode(List<Node> elements) {
        this.elements = elements;
    }

    @Override
    public List<Node> children() {
        return childList(elements);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
