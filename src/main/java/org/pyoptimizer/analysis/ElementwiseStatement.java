package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.Node;

import java.util.Set;

/**
 * A loop body statement of the form {@code C[i] = expr} or {@code C[i] op= expr}
 * (two-level: {@code C[i][j]}), where {@code expr} only combines same-index element
 * reads, numeric literals, loop-invariant names and the index itself.
 *
 * @param statement  the assignment
 * @param position   its position in the loop body
 * @param container  the written container C
 * @param operator   the augmented operator without "=", or null for plain assignment
 * @param value      the right-hand side
 * @param facts      what the right-hand side (and C itself for augmented forms) uses
 */
public record ElementwiseStatement(Node statement, int position, String container, String operator, Node value,
                                   ExpressionFacts facts) {

    /**
     * Containers read element-wise, including C for augmented assignment.
     */
    public Set<String> containersRead() {
        return facts.containers();
    }
}
