package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The ComprehensionNode class represents list, set and dict comprehensions and
 * generator expressions.
 * <p>
 * For a dict comprehension {@code element} is the key and {@code value} the value;
 * for the other kinds {@code value} is null.
 */
public class ComprehensionNode extends AbstractNode {
    public final Kind kind;
    public final Node element;
    public final Node value;
    public final List<ComprehensionClause> clauses;

    public ComprehensionNode(Kind kind, Node element, Node value, List<ComprehensionClause> clauses) {
        this.kind = kind;
        this.element = element;
        this.value = value;
        this.clauses = clauses;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>();
        parts.add(element);
        parts.add(value);
        for (ComprehensionClause clause : clauses) {
            parts.add(clause.target());
            parts.add(clause.iterable());
            parts.add(clause.conditions());
        }
        return childList(parts.toArray());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    public enum Kind {
        LIST, SET, DICT, GENERATOR
    }
}
