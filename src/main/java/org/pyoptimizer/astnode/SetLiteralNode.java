package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * A non-empty set display {@code {a, b}}. The empty braces always denote a dict.
 */
public class SetLiteralNode extends AbstractNode {
    public final List<Node> elements;

    public SetLiteralNode(List<Node> elements) {
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
