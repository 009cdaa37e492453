package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.List;

/**
 * The StringNode class represents a string or bytes literal. Adjacent literals
 * ({@code "a" "b"}) are kept as separate raw pieces so they regenerate unchanged.
 */
public class StringNode extends AbstractNode {
    /**
     * Raw literal pieces, prefix and quotes included.
     */
    public final List<String> pieces;

    public StringNode(List<String> pieces) {
        this.pieces = List.copyOf(pieces);
    }

    public boolean isFormatted() {
        for (String piece : pieces) {
            int i = 0;
            while (i < piece.length() && piece.charAt(i) != '"' && piece.charAt(i) != '\'') {
                if (Character.toLowerCase(piece.charAt(i)) == 'f') {
                    return true;
                }
                i++;
            }
        }
        return false;
    }

    public String text() {
        return String.join(" ", pieces);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
