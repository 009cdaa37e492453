package org.pyoptimizer.astnode;

/**
 * {@code context [as target]} inside a {@code with} header.
 */
public record WithItem(Node context, Node target) {
}
