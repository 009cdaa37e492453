package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.BinaryOperatorNode;
import org.pyoptimizer.astnode.Node;
import org.pyoptimizer.astnode.NumberNode;
import org.pyoptimizer.astnode.OperatorNode;

import java.math.BigInteger;
import java.util.List;

/**
 * Folds integer constant expressions: integer literals combined with unary +/- and
 * the binary operators {@code + - * // % **}. Anything else is "not evaluable".
 */
public class ConstantEvaluator {
    // Results wider than this are treated as not evaluable
    private static final int MAX_BITS = 256;

    private ConstantEvaluator() {
    }

    /**
     * @return the value, or null when the expression is not a foldable integer constant
     */
    public static BigInteger evaluate(Node node) {
        if (node instanceof NumberNode number) {
            return number.integerValue();
        }
        if (node instanceof OperatorNode unary) {
            BigInteger operand = evaluate(unary.operand);
            if (operand == null) {
                return null;
            }
            return switch (unary.operator) {
                case "-" -> operand.negate();
                case "+" -> operand;
                default -> null;
            };
        }
        if (node instanceof BinaryOperatorNode binary) {
            BigInteger left = evaluate(binary.left);
            BigInteger right = left == null ? null : evaluate(binary.right);
            if (right == null) {
                return null;
            }
            BigInteger result = apply(binary.operator, left, right);
            return result == null || result.bitLength() > MAX_BITS ? null : result;
        }
        return null;
    }

    private static BigInteger apply(String operator, BigInteger left, BigInteger right) {
        switch (operator) {
            case "+":
                return left.add(right);
            case "-":
                return left.subtract(right);
            case "*":
                return left.multiply(right);
            case "//":
                if (right.signum() == 0) {
                    return null;
                }
                return floorDiv(left, right);
            case "%":
                if (right.signum() == 0) {
                    return null;
                }
                return left.subtract(floorDiv(left, right).multiply(right));
            case "**":
                // Negative exponents give floats
                if (right.signum() < 0 || right.bitLength() > 16
                        || (long) left.bitLength() * right.longValue() > MAX_BITS) {
                    return null;
                }
                return left.pow(right.intValue());
            default:
                return null;
        }
    }

    private static BigInteger floorDiv(BigInteger left, BigInteger right) {
        BigInteger[] qr = left.divideAndRemainder(right);
        if (qr[1].signum() != 0 && (qr[1].signum() != right.signum())) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * Number of values produced by {@code range(...)} called with the given arguments,
     * or null when an argument is not a constant or the step is zero.
     */
    public static BigInteger rangeLength(List<Node> arguments) {
        BigInteger start = BigInteger.ZERO;
        BigInteger stop;
        BigInteger step = BigInteger.ONE;
        switch (arguments.size()) {
            case 1 -> stop = evaluate(arguments.get(0));
            case 2, 3 -> {
                start = evaluate(arguments.get(0));
                stop = evaluate(arguments.get(1));
                if (arguments.size() == 3) {
                    step = evaluate(arguments.get(2));
                }
            }
            default -> {
                return null;
            }
        }
        if (start == null || stop == null || step == null || step.signum() == 0) {
            return null;
        }
        BigInteger distance = stop.subtract(start);
        if (distance.signum() != step.signum()) {
            return BigInteger.ZERO;
        }
        // ceil(distance / step) for same-sign operands
        BigInteger[] qr = distance.divideAndRemainder(step);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }
}
