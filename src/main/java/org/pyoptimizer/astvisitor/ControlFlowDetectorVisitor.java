package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

/**
 * Visitor that detects statements which leave a loop body early or turn the enclosing
 * function into a generator: {@code break}, {@code continue}, {@code return} and
 * {@code yield}.
 * <p>
 * Nested functions, lambdas and classes are not entered, since their control flow does
 * not affect the code being inspected.
 */
public class ControlFlowDetectorVisitor extends TraversingVisitor {
    private boolean hasBreak = false;
    private boolean hasContinue = false;
    private boolean hasReturn = false;
    private boolean hasYield = false;

    /**
     * Runs a fresh detector over the given node.
     */
    public static ControlFlowDetectorVisitor scan(Node node) {
        ControlFlowDetectorVisitor detector = new ControlFlowDetectorVisitor();
        node.accept(detector);
        return detector;
    }

    public boolean hasBreak() {
        return hasBreak;
    }

    public boolean hasContinue() {
        return hasContinue;
    }

    public boolean hasReturn() {
        return hasReturn;
    }

    public boolean hasYield() {
        return hasYield;
    }

    @Override
    public void visit(ControlStatementNode node) {
        switch (node.keyword) {
            case "break" -> hasBreak = true;
            case "continue" -> hasContinue = true;
            default -> {
            }
        }
    }

    @Override
    public void visit(ReturnNode node) {
        hasReturn = true;
        visitChildren(node);
    }

    @Override
    public void visit(YieldNode node) {
        hasYield = true;
        visitChildren(node);
    }

    @Override
    public void visit(FunctionDefNode node) {
        // Different scope: only the decorators and defaults run here
        for (Node decorator : node.decorators) {
            decorator.accept(this);
        }
        for (Node part : node.parameters.nodes()) {
            part.accept(this);
        }
    }

    @Override
    public void visit(LambdaNode node) {
        for (Node part : node.parameters.nodes()) {
            part.accept(this);
        }
    }

    @Override
    public void visit(ClassDefNode node) {
        for (Node decorator : node.decorators) {
            decorator.accept(this);
        }
        for (Node base : node.bases) {
            base.accept(this);
        }
    }
}
