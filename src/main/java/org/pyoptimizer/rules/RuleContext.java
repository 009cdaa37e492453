package org.pyoptimizer.rules;

import org.pyoptimizer.analysis.LoopShapes;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.model.Anchor;
import org.pyoptimizer.model.RequiredImport;
import org.pyoptimizer.model.SourceUnit;

/**
 * Read-only view of the script being planned, shared by all rules of one planning run.
 */
public class RuleContext {
    private final SourceUnit unit;
    private final TreeIndex index;
    private final NameUsageVisitor moduleUsage;
    private int nextPatchId = 1;

    public RuleContext(SourceUnit unit) {
        this.unit = unit;
        this.index = new TreeIndex(unit.tree().root);
        this.moduleUsage = NameUsageVisitor.scan(unit.tree().root);
    }

    public SourceUnit unit() {
        return unit;
    }

    public ModuleNode module() {
        return unit.tree().root;
    }

    public TreeIndex index() {
        return index;
    }

    /**
     * The node an anchor points at, or null.
     */
    public Node resolve(Anchor anchor) {
        return index.get(anchor.nodeId());
    }

    public NodeFactory factory(SourceSpan span) {
        return new NodeFactory(unit.tree(), span);
    }

    public int nextPatchId() {
        return nextPatchId++;
    }

    /**
     * True when the script has a top-level {@code import} binding exactly this module
     * under the expected name.
     */
    public boolean imports(RequiredImport required) {
        for (Node statement : module().body.elements) {
            if (statement instanceof ImportNode importNode) {
                for (ImportAlias alias : importNode.names) {
                    if (alias.name().equals(required.module()) && alias.boundName().equals(required.boundName())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * True when the name an import would bind is already used for something else.
     */
    public boolean bindsOtherwise(RequiredImport required) {
        return moduleUsage.getStored().contains(required.boundName()) && !imports(required);
    }

    /**
     * True when a loop variable is read anywhere in the loop's scope outside the loop
     * itself, including nested functions of that scope.
     */
    public boolean isReadOutside(String name, ForNode loop) {
        BlockNode scope = LoopShapes.scopeBody(index, module(), loop);
        return NameUsageVisitor.scan(scope).loadCount(name) > NameUsageVisitor.scan(loop).loadCount(name);
    }
}
