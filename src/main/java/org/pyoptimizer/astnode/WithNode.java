package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

public class WithNode extends AbstractNode {
    public final List<WithItem> items;
    public final BlockNode body;
    public final boolean isAsync;

    public WithNode(List<WithItem> items, BlockNode body, boolean isAsync) {
        this.items = items;
        this.body = body;
        this.isAsync = isAsync;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>();
        for (WithItem item : items) {
            parts.add(item.context());
            parts.add(item.target());
        }
        parts.add(body);
        return childList(parts.toArray());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
