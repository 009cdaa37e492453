package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code from [.]*module import names}. The module is null for {@code from . import x}.
 */
public class ImportFromNode extends AbstractNode {
    public final String module;
    /**
     * Number of leading dots of a relative import.
     */
    public final int level;
    public final List<ImportAlias> names;

    public ImportFromNode(String module, int level, List<ImportAlias> names) {
        this.module = module;
        this.level = level;
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
