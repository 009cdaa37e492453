package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code class Name(bases): body}. Keyword arguments of the header (metaclass=...)
 * are {@link KeywordArgumentNode}s among the bases.
 */
public class ClassDefNode extends AbstractNode {
    public final String name;
    public final List<Node> bases;
    public final BlockNode body;
    public final List<Node> decorators;

    public ClassDefNode(String name, List<Node> bases, BlockNode body, List<Node> decorators) {
        this.name = name;
        this.bases = bases;
        this.body = body;
        this.decorators = decorators;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>(decorators);
        parts.addAll(bases);
        parts.add(body);
        return childList(parts.toArray());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
