package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.PrintVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base class for syntax tree nodes. It holds the arena id of the node and the
 * source span it was parsed from, which is used both for error messages and for
 * deciding whether two rewrites touch the same region.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public int id;
    public SourceSpan span = SourceSpan.UNKNOWN;

    @Override
    public int getId() {
        return id;
    }

    @Override
    public void setId(int id) {
        this.id = id;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public void setSpan(SourceSpan span) {
        this.span = span;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }

    /**
     * Builds a child list skipping absent (null) parts.
     */
    protected static List<Node> childList(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
