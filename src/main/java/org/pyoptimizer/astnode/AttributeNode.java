package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Attribute access {@code value.attribute}.
 */
public class AttributeNode extends AbstractNode {
    public final Node value;
    public final String attribute;

    public AttributeNode(Node value, String attribute) {
        this.value = value;
        this.attribute = attribute;
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
