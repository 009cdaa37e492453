package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code raise [exception [from cause]]}.
 */
public class RaiseNode extends AbstractNode {
    public final Node exception;
    public final Node cause;

    public RaiseNode(Node exception, Node cause) {
        this.exception = exception;
        this.cause = cause;
    }

    @Override
    public List<Node> children() {
        return childList(exception, cause);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
