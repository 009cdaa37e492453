package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * {@code lower:upper:step}; every part may be null.
 */
public class SliceNode extends AbstractNode {
    public final Node lower;
    public final Node upper;
    public final Node step;
    /**
     * True when the second colon was written, even without a step expression.
     */
    public final boolean hasStepColon;

    public SliceNode(Node lower, Node upper, Node step, boolean hasStepColon) {
        this.lower = lower;
        this.upper = upper;
        this.step = step;
        this.hasStepColon = hasStepColon;
    }

    @Override
    public List<Node> children() {
        return childList(lower, upper, step);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
