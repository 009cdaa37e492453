package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The FunctionDefNode class represents a {@code def} (or {@code async def}) statement.
 * <p>
 * The node span starts at the first decorator; {@link #headerSpan} covers the decorators
 * and the signature up to the colon, without the body. Rewrites that only touch the
 * header anchor on it so they do not collide with rewrites inside the body.
 */
public class FunctionDefNode extends AbstractNode {
    public final String name;
    public final ParameterList parameters;
    /**
     * The return annotation, or null.
     */
    public final Node returns;
    public final BlockNode body;
    public final List<Node> decorators;
    public final boolean isAsync;
    public SourceSpan headerSpan = SourceSpan.UNKNOWN;

    public FunctionDefNode(String name, ParameterList parameters, Node returns, BlockNode body,
                           List<Node> decorators, boolean isAsync) {
        this.name = name;
        this.parameters = parameters;
        this.returns = returns;
        this.body = body;
        this.decorators = decorators;
        this.isAsync = isAsync;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>(decorators);
        parts.addAll(parameters.nodes());
        parts.add(returns);
        parts.add(body);
        return childList(parts.toArray());
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
