package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects how plain names are used inside a subtree.
 * <ul>
 *   <li>stored: bound by assignment, loop or with targets, imports, definitions,
 *   parameters, except clauses, {@code del}, {@code global}/{@code nonlocal};</li>
 *   <li>loaded: read anywhere;</li>
 *   <li>mutated: the root name of an item or attribute store ({@code a[i] = x},
 *   {@code a.b = x}, {@code del a[i]}) or the receiver of a method call
 *   ({@code a.append(x)}).</li>
 * </ul>
 * Nested scopes are entered, so names bound in a nested function count as stored
 * here too. Callers use this to answer "may this name change?", where
 * over-approximation is the safe direction.
 */
public class NameUsageVisitor extends TraversingVisitor {
    private final Set<String> stored = new LinkedHashSet<>();
    private final Set<String> loaded = new LinkedHashSet<>();
    private final Set<String> mutated = new LinkedHashSet<>();
    private final Map<String, Integer> loadCounts = new HashMap<>();

    public static NameUsageVisitor scan(Node node) {
        NameUsageVisitor visitor = new NameUsageVisitor();
        if (node != null) {
            node.accept(visitor);
        }
        return visitor;
    }

    public Set<String> getStored() {
        return stored;
    }

    public Set<String> getLoaded() {
        return loaded;
    }

    public Set<String> getMutated() {
        return mutated;
    }

    /**
     * Number of places the name is read.
     */
    public int loadCount(String name) {
        return loadCounts.getOrDefault(name, 0);
    }

    /**
     * True when the name is rebound or its object may be modified in place.
     */
    public boolean mayChange(String name) {
        return stored.contains(name) || mutated.contains(name);
    }

    /**
     * Returns the name at the root of an attribute/subscript chain, or null.
     */
    public static String rootName(Node node) {
        Node current = node;
        while (true) {
            if (current instanceof IdentifierNode identifier) {
                return identifier.name;
            } else if (current instanceof AttributeNode attribute) {
                current = attribute.value;
            } else if (current instanceof SubscriptNode subscript) {
                current = subscript.value;
            } else {
                return null;
            }
        }
    }

    private void target(Node node) {
        if (node instanceof IdentifierNode identifier) {
            stored.add(identifier.name);
        } else if (node instanceof TupleNode tuple) {
            tuple.elements.forEach(this::target);
        } else if (node instanceof ListLiteralNode list) {
            list.elements.forEach(this::target);
        } else if (node instanceof StarredNode starred) {
            target(starred.value);
        } else if (node instanceof SubscriptNode subscript) {
            markMutated(subscript);
            subscript.value.accept(this);
            subscript.index.accept(this);
        } else if (node instanceof AttributeNode attribute) {
            markMutated(attribute);
            attribute.value.accept(this);
        } else if (node != null) {
            node.accept(this);
        }
    }

    private void markMutated(Node node) {
        String root = rootName(node);
        if (root != null) {
            mutated.add(root);
        }
    }

    private void parameters(ParameterList parameters) {
        stored.addAll(parameters.boundNames());
        for (Node part : parameters.nodes()) {
            part.accept(this);
        }
    }

    @Override
    public void visit(IdentifierNode node) {
        load(node.name);
    }

    private void load(String name) {
        loaded.add(name);
        loadCounts.merge(name, 1, Integer::sum);
    }

    @Override
    public void visit(CallNode node) {
        if (node.function instanceof AttributeNode attribute) {
            markMutated(attribute.value);
        }
        visitChildren(node);
    }

    @Override
    public void visit(AssignNode node) {
        node.targets.forEach(this::target);
        node.value.accept(this);
    }

    @Override
    public void visit(AugAssignNode node) {
        if (node.target instanceof IdentifierNode identifier) {
            load(identifier.name);
        }
        target(node.target);
        node.value.accept(this);
    }

    @Override
    public void visit(AnnAssignNode node) {
        if (node.value != null) {
            target(node.target);
            node.value.accept(this);
        }
        node.annotation.accept(this);
    }

    @Override
    public void visit(NamedExpressionNode node) {
        stored.add(node.target.name);
        node.value.accept(this);
    }

    @Override
    public void visit(DeleteNode node) {
        node.targets.forEach(this::target);
    }

    @Override
    public void visit(ForNode node) {
        target(node.target);
        node.iterable.accept(this);
        node.body.accept(this);
        if (node.elseBlock != null) {
            node.elseBlock.accept(this);
        }
    }

    @Override
    public void visit(ComprehensionNode node) {
        for (ComprehensionClause clause : node.clauses) {
            target(clause.target());
            clause.iterable().accept(this);
            clause.conditions().forEach(condition -> condition.accept(this));
        }
        node.element.accept(this);
        if (node.value != null) {
            node.value.accept(this);
        }
    }

    @Override
    public void visit(WithNode node) {
        for (WithItem item : node.items) {
            item.context().accept(this);
            target(item.target());
        }
        node.body.accept(this);
    }

    @Override
    public void visit(TryNode node) {
        for (ExceptHandler handler : node.handlers) {
            if (handler.name() != null) {
                stored.add(handler.name());
            }
        }
        visitChildren(node);
    }

    @Override
    public void visit(FunctionDefNode node) {
        stored.add(node.name);
        node.decorators.forEach(decorator -> decorator.accept(this));
        parameters(node.parameters);
        if (node.returns != null) {
            node.returns.accept(this);
        }
        node.body.accept(this);
    }

    @Override
    public void visit(LambdaNode node) {
        parameters(node.parameters);
        node.body.accept(this);
    }

    @Override
    public void visit(ClassDefNode node) {
        stored.add(node.name);
        visitChildren(node);
    }

    @Override
    public void visit(ImportNode node) {
        for (ImportAlias alias : node.names) {
            stored.add(alias.boundName());
        }
    }

    @Override
    public void visit(ImportFromNode node) {
        for (ImportAlias alias : node.names) {
            stored.add(alias.boundName());
        }
    }

    @Override
    public void visit(GlobalNode node) {
        stored.addAll(node.names);
    }
}
