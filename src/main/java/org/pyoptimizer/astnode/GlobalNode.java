package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code global} and {@code nonlocal} declarations.
 */
public class GlobalNode extends AbstractNode {
    /**
     * Either "global" or "nonlocal".
     */
    public final String keyword;
    public final List<String> names;

    public GlobalNode(String keyword, List<String> names) {
        this.keyword = keyword;
        this.names = names;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
