package org.pyoptimizer.astnode;

import java.util.List;

/**
 * One {@code for target in iterable if cond ...} clause of a comprehension.
 *
 * @param target     the loop target
 * @param iterable   the iterated expression
 * @param conditions the trailing {@code if} filters, possibly empty
 * @param isAsync    true for {@code async for}
 */
public record ComprehensionClause(Node target, Node iterable, List<Node> conditions, boolean isAsync) {
}
