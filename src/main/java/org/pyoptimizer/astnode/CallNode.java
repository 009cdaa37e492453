package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The CallNode class represents a call expression. Arguments keep their source order;
 * keyword arguments are {@link KeywordArgumentNode}s and unpacked arguments are
 * {@link StarredNode}s.
 */
public class CallNode extends AbstractNode {
    /**
     * The expression being called.
     */
    public final Node function;

    public final List<Node> arguments;

    public CallNode(Node function, List<Node> arguments) {
        this.function = function;
        this.arguments = arguments;
    }

    @Override
    public List<Node> children() {
        return childList(function, arguments);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
