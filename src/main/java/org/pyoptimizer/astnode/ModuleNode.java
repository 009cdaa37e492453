package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Root of a syntax tree: the statements of one script.
 */
public class ModuleNode extends AbstractNode {
    public final BlockNode body;

    public ModuleNode(BlockNode body) {
        this.body = body;
    }

    @Override
    public List<Node> children() {
        return childList(body);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
