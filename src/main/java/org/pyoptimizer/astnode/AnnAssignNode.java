package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Annotated assignment {@code target: annotation [= value]}.
 */
public class AnnAssignNode extends AbstractNode {
    public final Node target;
    public final Node annotation;
    public final Node value;

    public AnnAssignNode(Node target, Node annotation, Node value) {
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    @Override
    public List<Node> children() {
        return childList(target, annotation, value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
