package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code lambda parameters: body}. Lambda parameters never carry annotations.
 */
public class LambdaNode extends AbstractNode {
    public final ParameterList parameters;
    public final Node body;

    public LambdaNode(ParameterList parameters, Node body) {
        this.parameters = parameters;
        this.body = body;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>(parameters.nodes());
        parts.add(body);
        return childList(parts.toArray());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
