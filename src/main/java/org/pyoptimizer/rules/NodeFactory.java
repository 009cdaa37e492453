package org.pyoptimizer.rules;

import org.pyoptimizer.astnode.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds new syntax tree nodes for rewrites. Every node gets a fresh id from the
 * tree's allocator and the span of the code it replaces.
 */
public class NodeFactory {
    private final SyntaxTree tree;
    private final SourceSpan span;

    public NodeFactory(SyntaxTree tree, SourceSpan span) {
        this.tree = tree;
        this.span = span;
    }

    public <T extends AbstractNode> T finish(T node) {
        node.id = tree.nextId();
        node.span = span;
        return node;
    }

    public IdentifierNode name(String name) {
        return finish(new IdentifierNode(name));
    }

    public NumberNode number(String literal) {
        return finish(new NumberNode(literal));
    }

    /**
     * A dotted name such as {@code np.asarray}.
     */
    public Node dotted(String path) {
        String[] parts = path.split("\\.");
        Node node = name(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            node = finish(new AttributeNode(node, parts[i]));
        }
        return node;
    }

    public AttributeNode attribute(Node value, String attribute) {
        return finish(new AttributeNode(value, attribute));
    }

    public CallNode call(Node function, Node... arguments) {
        return finish(new CallNode(function, new ArrayList<>(Arrays.asList(arguments))));
    }

    public CallNode call(String function, Node... arguments) {
        return call(dotted(function), arguments);
    }

    public KeywordArgumentNode keyword(String name, Node value) {
        return finish(new KeywordArgumentNode(name, value));
    }

    public SubscriptNode subscript(Node value, Node index) {
        return finish(new SubscriptNode(value, index));
    }

    /**
     * {@code lower:upper}; either bound may be null.
     */
    public SliceNode slice(Node lower, Node upper) {
        return finish(new SliceNode(lower, upper, null, false));
    }

    public BinaryOperatorNode binary(String operator, Node left, Node right) {
        return finish(new BinaryOperatorNode(operator, left, right));
    }

    public OperatorNode unary(String operator, Node operand) {
        return finish(new OperatorNode(operator, operand));
    }

    public TupleNode tuple(Node... elements) {
        return finish(new TupleNode(new ArrayList<>(Arrays.asList(elements))));
    }

    public AssignNode assign(Node target, Node value) {
        return finish(new AssignNode(new ArrayList<>(List.of(target)), value));
    }

    public BlockNode block(List<Node> statements) {
        return finish(new BlockNode(new ArrayList<>(statements)));
    }

    public ForNode forLoop(Node target, Node iterable, BlockNode body) {
        return finish(new ForNode(target, iterable, body, null, false));
    }

    public ComprehensionNode generator(Node element, List<ComprehensionClause> clauses) {
        return finish(new ComprehensionNode(ComprehensionNode.Kind.GENERATOR, element, null, clauses));
    }

    public ImportNode importStatement(String module, String alias) {
        return finish(new ImportNode(new ArrayList<>(List.of(new ImportAlias(module, alias)))));
    }
}
