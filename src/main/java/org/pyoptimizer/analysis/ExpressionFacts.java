package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.NumberNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What an element-wise expression is made of. Filled while the expression is matched.
 */
public class ExpressionFacts {
    private final Set<String> containers = new LinkedHashSet<>();
    private final Set<String> scalars = new LinkedHashSet<>();
    private final List<NumberNode> literals = new ArrayList<>();
    private boolean usesIndex;
    private int multiplicativeOperators;
    private boolean hasDivision;
    private boolean hasVariableDivisor;

    public Set<String> containers() {
        return containers;
    }

    public Set<String> scalars() {
        return scalars;
    }

    public List<NumberNode> literals() {
        return literals;
    }

    public boolean usesIndex() {
        return usesIndex;
    }

    public int multiplicativeOperators() {
        return multiplicativeOperators;
    }

    /**
     * True when the expression contains {@code /}, {@code //} or {@code %}.
     */
    public boolean hasDivision() {
        return hasDivision;
    }

    /**
     * True when some divisor of {@code /}, {@code //} or {@code %} is not a literal.
     */
    public boolean hasVariableDivisor() {
        return hasVariableDivisor;
    }

    void addContainer(String name) {
        containers.add(name);
    }

    void addScalar(String name) {
        scalars.add(name);
    }

    void addLiteral(NumberNode literal) {
        literals.add(literal);
    }

    void markIndexUse() {
        usesIndex = true;
    }

    void markVariableDivisor() {
        hasVariableDivisor = true;
    }

    void countOperator(String operator) {
        switch (operator) {
            case "*" -> multiplicativeOperators++;
            case "/", "//", "%" -> {
                multiplicativeOperators++;
                hasDivision = true;
            }
            default -> {
            }
        }
    }
}
