package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code import a, b.c as d}.
 */
public class ImportNode extends AbstractNode {
    public final List<ImportAlias> names;

    public ImportNode(List<ImportAlias> names) {
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
