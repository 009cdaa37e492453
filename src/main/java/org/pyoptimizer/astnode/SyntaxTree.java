package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.CloneVisitor;

/**
 * A parsed script: the module node plus the allocator for node ids.
 * <p>
 * Ids are unique within a tree and all of its copies. Copies share nothing with the
 * original except the id space, so nodes created for a rewrite never collide with
 * parsed nodes.
 */
public class SyntaxTree {
    public final String fileName;
    public final ModuleNode root;
    private int lastId;

    public SyntaxTree(String fileName, ModuleNode root, int lastId) {
        this.fileName = fileName;
        this.root = root;
        this.lastId = lastId;
    }

    public synchronized int nextId() {
        return ++lastId;
    }

    public synchronized int lastId() {
        return lastId;
    }

    /**
     * Deep copy with identical node ids.
     */
    public synchronized SyntaxTree copy() {
        return new SyntaxTree(fileName, CloneVisitor.cloneNode(root), lastId);
    }
}
