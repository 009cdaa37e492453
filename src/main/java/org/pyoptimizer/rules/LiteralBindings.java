package org.pyoptimizer.rules;

import org.pyoptimizer.analysis.ConstantEvaluator;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.astvisitor.TraversingVisitor;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names that the statements before a given statement bind to literal values, and that
 * nothing has touched since.
 * <p>
 * Only plain {@code name = [...]} and {@code name = <integer constant>} assignments
 * bind. A later statement that stores, modifies or aliases a name unbinds it; a
 * statement containing a call or a compound statement unbinds everything.
 */
public class LiteralBindings {
    private final Map<String, ListLiteralNode> lists = new HashMap<>();
    private final Map<String, BigInteger> integers = new HashMap<>();

    private LiteralBindings() {
    }

    public static LiteralBindings before(TreeIndex index, Node statement) {
        LiteralBindings bindings = new LiteralBindings();
        for (Node earlier : index.statementsBefore(statement)) {
            bindings.apply(earlier);
        }
        return bindings;
    }

    private void apply(Node statement) {
        if (statement instanceof AssignNode assign && assign.targets.size() == 1
                && assign.targets.get(0) instanceof IdentifierNode target && !containsCall(assign.value)) {
            // A list reachable from another name is no longer under our eyes.
            NameUsageVisitor.scan(assign.value).getLoaded().forEach(lists::remove);
            lists.remove(target.name);
            integers.remove(target.name);
            if (assign.value instanceof ListLiteralNode list) {
                lists.put(target.name, list);
            } else {
                BigInteger value = ConstantEvaluator.evaluate(assign.value);
                if (value != null) {
                    integers.put(target.name, value);
                }
            }
            return;
        }
        if (statement.children().stream().anyMatch(child -> child instanceof BlockNode)
                || containsCall(statement)) {
            lists.clear();
            integers.clear();
            return;
        }
        NameUsageVisitor usage = NameUsageVisitor.scan(statement);
        for (String name : usage.getStored()) {
            lists.remove(name);
            integers.remove(name);
        }
        usage.getMutated().forEach(lists::remove);
        usage.getLoaded().forEach(lists::remove);
    }

    private static boolean containsCall(Node node) {
        boolean[] found = new boolean[1];
        node.accept(new TraversingVisitor() {
            @Override
            public void visit(CallNode call) {
                found[0] = true;
            }
        });
        return found[0];
    }

    /**
     * The list literal the name is bound to, or null.
     */
    public ListLiteralNode list(String name) {
        return lists.get(name);
    }

    /**
     * The integer the name is bound to, or null.
     */
    public BigInteger integer(String name) {
        return integers.get(name);
    }

    /**
     * True when the name is bound to a list literal of integer constants, all smaller
     * than {@code limit} in magnitude.
     */
    public boolean isSmallIntegerList(String name, BigInteger limit) {
        ListLiteralNode list = lists.get(name);
        if (list == null) {
            return false;
        }
        for (Node element : list.elements) {
            if (!isSmall(ConstantEvaluator.evaluate(element), limit)) {
                return false;
            }
        }
        return true;
    }

    public boolean isSmallInteger(String name, BigInteger limit) {
        return isSmall(integers.get(name), limit);
    }

    public static boolean isSmall(BigInteger value, BigInteger limit) {
        return value != null && value.abs().compareTo(limit) < 0;
    }

    /**
     * True when both names are bound to list literals with the same number of elements.
     */
    public boolean sameLength(String first, String second) {
        ListLiteralNode a = lists.get(first);
        ListLiteralNode b = lists.get(second);
        return a != null && b != null && a.elements.size() == b.elements.size()
                && !hasStarred(a.elements) && !hasStarred(b.elements);
    }

    private static boolean hasStarred(List<Node> elements) {
        return elements.stream().anyMatch(element -> element instanceof StarredNode);
    }
}
