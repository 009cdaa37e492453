package org.pyoptimizer.parser;

import org.pyoptimizer.astnode.Node;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.astvisitor.UnparseVisitor;
import org.pyoptimizer.exception.ParseError;

/**
 * Entry point of the parsing layer: source text to syntax tree and back.
 */
public class PythonParserAdapter {

    /**
     * Parses a complete script.
     *
     * @param fileName name used in error messages
     * @param text     the source text
     * @return the syntax tree
     * @throws ParseError if the text is not valid Python
     */
    public SyntaxTree parse(String fileName, String text) {
        return new Parser(fileName, text).parse();
    }

    /**
     * Regenerates source text. Never fails on a tree built by the parser or by the
     * transformation rules.
     */
    public String unparse(SyntaxTree tree) {
        return UnparseVisitor.unparse(tree.root);
    }

    public String unparse(Node node) {
        return UnparseVisitor.unparse(node);
    }
}
