package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.ForNode;
import org.pyoptimizer.astnode.Node;

import java.util.List;

/**
 * A counted loop over {@code range(len(A))} with at least one element-wise statement.
 *
 * @param loop            the (outer) loop
 * @param innerLoop       the inner loop of the two-level form, null for one level
 * @param indices         loop variables, outer first
 * @param lengthSource    the name A whose length bounds the loop
 * @param elementwise     element-wise statements of the innermost body, in body order
 * @param others          remaining statements of the innermost body, in body order
 */
public record ElementwiseLoop(ForNode loop, ForNode innerLoop, List<String> indices, String lengthSource,
                              List<ElementwiseStatement> elementwise, List<Node> others) {

    public int dimensions() {
        return indices.size();
    }

    public String index() {
        return indices.get(0);
    }

    public boolean isFullyElementwise() {
        return others.isEmpty();
    }

    /**
     * The statements all element-wise statements live in.
     */
    public List<Node> body() {
        return innerLoop != null ? innerLoop.body.elements : loop.body.elements;
    }
}
