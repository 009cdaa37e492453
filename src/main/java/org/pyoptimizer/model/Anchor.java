package org.pyoptimizer.model;

import org.pyoptimizer.astnode.Node;
import org.pyoptimizer.astnode.SourceSpan;

/**
 * Stable reference to a location in a syntax tree: the id of a node plus the source
 * region the reference covers. The region may be narrower than the node (a function
 * header rather than the whole function).
 */
public record Anchor(int nodeId, SourceSpan span) {

    public static Anchor of(Node node) {
        return new Anchor(node.getId(), node.getSpan());
    }

    public boolean overlaps(Anchor other) {
        return nodeId == other.nodeId || span.overlaps(other.span);
    }
}
