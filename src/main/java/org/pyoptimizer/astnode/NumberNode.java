package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.math.BigInteger;
import java.util.List;

/**
 * The NumberNode class represents a numeric literal. The literal text is kept as
 * written (underscores, radix prefixes, exponents) so that regenerated source is
 * identical to the input.
 */
public class NumberNode extends AbstractNode {
    public final String value;

    public NumberNode(String value) {
        this.value = value;
    }

    public boolean isImaginary() {
        return value.endsWith("j") || value.endsWith("J");
    }

    /**
     * True for integer literals in any radix.
     */
    public boolean isInteger() {
        String text = value.toLowerCase();
        if (text.startsWith("0x") || text.startsWith("0o") || text.startsWith("0b")) {
            return true;
        }
        return !isImaginary() && text.indexOf('.') < 0 && text.indexOf('e') < 0;
    }

    /**
     * Integer value of the literal, or null when the literal is not an integer.
     */
    public BigInteger integerValue() {
        if (!isInteger()) {
            return null;
        }
        String text = value.replace("_", "").toLowerCase();
        if (text.startsWith("0x")) {
            return new BigInteger(text.substring(2), 16);
        } else if (text.startsWith("0o")) {
            return new BigInteger(text.substring(2), 8);
        } else if (text.startsWith("0b")) {
            return new BigInteger(text.substring(2), 2);
        }
        return new BigInteger(text);
    }

    /**
     * Magnitude of a real (non-complex) literal as a double.
     */
    public double doubleValue() {
        BigInteger integer = integerValue();
        if (integer != null) {
            return integer.doubleValue();
        }
        return Double.parseDouble(value.replace("_", ""));
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
