package org.pyoptimizer.model;

import org.pyoptimizer.astnode.SyntaxTree;

import java.nio.file.Path;

/**
 * One script being optimized: where it came from, its text and its parsed tree.
 * The tree is never modified; rewrites work on copies of it.
 */
public record SourceUnit(Path path, String originalText, SyntaxTree tree) {

    public String fileName() {
        return path.getFileName() == null ? path.toString() : path.getFileName().toString();
    }
}
