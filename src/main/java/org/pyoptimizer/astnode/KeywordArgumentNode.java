package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code name=value} inside a call or a class header.
 */
public class KeywordArgumentNode extends AbstractNode {
    public final String name;
    public final Node value;

    public KeywordArgumentNode(String name, Node value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return childList(value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
