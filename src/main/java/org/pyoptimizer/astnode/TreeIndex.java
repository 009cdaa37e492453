package org.pyoptimizer.astnode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Id, parent and enclosing-block lookups over one tree.
 * <p>
 * An index is a snapshot: after a tree is modified a new index has to be built.
 */
public class TreeIndex {
    private final Map<Integer, Node> byId = new HashMap<>();
    private final Map<Integer, Node> parents = new HashMap<>();
    private final Map<Integer, BlockNode> blocks = new HashMap<>();

    public TreeIndex(Node root) {
        index(root, null);
    }

    private void index(Node node, Node parent) {
        byId.put(node.getId(), node);
        if (parent != null) {
            parents.put(node.getId(), parent);
        }
        if (node instanceof BlockNode block) {
            for (Node element : block.elements) {
                blocks.put(element.getId(), block);
            }
        }
        for (Node child : node.children()) {
            index(child, node);
        }
    }

    public Node get(int id) {
        return byId.get(id);
    }

    public boolean contains(int id) {
        return byId.containsKey(id);
    }

    public Node parentOf(Node node) {
        return parents.get(node.getId());
    }

    /**
     * The block that directly holds the given statement, or null for expressions
     * and for the module block itself.
     */
    public BlockNode blockOf(Node statement) {
        return blocks.get(statement.getId());
    }

    /**
     * The compound statement owning the block that holds the given statement:
     * a def, class, loop, if, try, with, or the module.
     */
    public Node ownerOf(Node statement) {
        BlockNode block = blockOf(statement);
        return block == null ? null : parentOf(block);
    }

    /**
     * Statements preceding the given one in its block.
     */
    public List<Node> statementsBefore(Node statement) {
        BlockNode block = blockOf(statement);
        if (block == null) {
            return Collections.emptyList();
        }
        int position = block.elements.indexOf(statement);
        return new ArrayList<>(block.elements.subList(0, position));
    }

    /**
     * The innermost function whose body contains the node, or null at module level.
     * Lambdas and classes do not count.
     */
    public FunctionDefNode enclosingFunction(Node node) {
        Node current = parentOf(node);
        while (current != null) {
            if (current instanceof FunctionDefNode function) {
                return function;
            }
            current = parentOf(current);
        }
        return null;
    }
}
