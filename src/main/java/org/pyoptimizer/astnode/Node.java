package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * Common interface of all syntax tree nodes.
 * <p>
 * Every node carries a stable integer id, unique within one {@link SyntaxTree}. Ids
 * survive cloning, so a reference taken on the parsed tree (an anchor) can be looked
 * up again in any patched copy of it.
 */
public interface Node {

    void accept(Visitor visitor);

    int getId();

    void setId(int id);

    SourceSpan getSpan();

    void setSpan(SourceSpan span);

    /**
     * Direct child nodes in source order. Nested helper structures (parameters,
     * comprehension clauses, except handlers, with items) contribute their nodes.
     */
    List<Node> children();
}
