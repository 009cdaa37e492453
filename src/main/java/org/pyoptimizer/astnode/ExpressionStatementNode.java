package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * An expression evaluated for its side effects, e.g. a call or a docstring.
 */
public class ExpressionStatementNode extends AbstractNode {
    public final Node expression;

    public ExpressionStatementNode(Node expression) {
        this.expression = expression;
    }

    @Override
    public List<Node> children() {
        return childList(expression);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
