package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

import java.util.List;

/**
 * Regenerates Python source from a syntax tree.
 * <p>
 * The output uses 4-space indentation, one statement per line, and two blank lines
 * around top-level functions and classes (one inside nested blocks). Parentheses are
 * inserted from the operator precedence table below, so a tree built by a rewrite does
 * not need explicit grouping nodes. Comments are not part of the tree and are lost.
 * <p>
 * Every expression slot has a required precedence: an expression binding looser than
 * the slot requires is wrapped in parentheses. Tuples are written bare only in slots
 * that allow it (assignment sides, return, for headers, subscripts, expression
 * statements).
 */
public class UnparseVisitor implements Visitor {
    private static final int TUPLE = 0;
    private static final int YIELD = 1;
    private static final int LAMBDA = 2;
    private static final int TERNARY = 3;
    private static final int OR = 4;
    private static final int AND = 5;
    private static final int NOT = 6;
    private static final int COMPARE = 7;
    private static final int BOR = 8;
    private static final int BXOR = 9;
    private static final int BAND = 10;
    private static final int SHIFT = 11;
    private static final int ARITH = 12;
    private static final int TERM = 13;
    private static final int FACTOR = 14;
    private static final int POWER = 15;
    private static final int AWAIT = 16;
    private static final int ATOM = 17;

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;
    private int required = TUPLE;
    private boolean bareTupleAllowed = false;

    public static String unparse(Node node) {
        UnparseVisitor visitor = new UnparseVisitor();
        node.accept(visitor);
        return visitor.getResult();
    }

    public String getResult() {
        return sb.toString();
    }

    public static int binaryPrecedence(String operator) {
        return switch (operator) {
            case "or" -> OR;
            case "and" -> AND;
            case "|" -> BOR;
            case "^" -> BXOR;
            case "&" -> BAND;
            case "<<", ">>" -> SHIFT;
            case "+", "-" -> ARITH;
            case "*", "/", "//", "%", "@" -> TERM;
            case "**" -> POWER;
            default -> throw new IllegalArgumentException("unknown binary operator " + operator);
        };
    }

    // ---------- expression helpers ----------

    private void expr(Node node, int requiredPrecedence) {
        expr(node, requiredPrecedence, false);
    }

    private void expr(Node node, int requiredPrecedence, boolean allowBareTuple) {
        int savedRequired = required;
        boolean savedBare = bareTupleAllowed;
        required = requiredPrecedence;
        bareTupleAllowed = allowBareTuple;
        node.accept(this);
        required = savedRequired;
        bareTupleAllowed = savedBare;
    }

    /**
     * Opens a parenthesis when an expression of the given precedence does not fit the
     * current slot. Returns whether it did, so the caller can close it.
     */
    private boolean open(int precedence) {
        boolean wrap = precedence < required;
        if (wrap) {
            sb.append('(');
        }
        return wrap;
    }

    private void close(boolean wrapped) {
        if (wrapped) {
            sb.append(')');
        }
    }

    private void commaSeparated(List<? extends Node> nodes, int requiredPrecedence) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            expr(nodes.get(i), requiredPrecedence);
        }
    }

    /**
     * Assignment and loop targets: a tuple of targets is written bare.
     */
    private void target(Node node) {
        expr(node, TUPLE, true);
    }

    private void parameters(ParameterList parameterList, boolean allowAnnotations) {
        List<Parameter> parameters = parameterList.parameters;
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Parameter parameter = parameters.get(i);
            switch (parameter.kind()) {
                case POSITIONAL_ONLY_MARKER -> sb.append('/');
                case VAR_POSITIONAL -> sb.append('*').append(parameter.name() == null ? "" : parameter.name());
                case VAR_KEYWORD -> sb.append("**").append(parameter.name());
                default -> sb.append(parameter.name());
            }
            boolean annotated = allowAnnotations && parameter.annotation() != null;
            if (annotated) {
                sb.append(": ");
                expr(parameter.annotation(), LAMBDA);
            }
            if (parameter.defaultValue() != null) {
                sb.append(annotated ? " = " : "=");
                expr(parameter.defaultValue(), LAMBDA);
            }
        }
    }

    // ---------- expressions ----------

    @Override
    public void visit(IdentifierNode node) {
        sb.append(node.name);
    }

    @Override
    public void visit(NumberNode node) {
        sb.append(node.value);
    }

    @Override
    public void visit(StringNode node) {
        sb.append(node.text());
    }

    @Override
    public void visit(ConstantNode node) {
        sb.append(node.value);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        int precedence = binaryPrecedence(node.operator);
        boolean wrapped = open(precedence);
        if (precedence == POWER) {
            expr(node.left, AWAIT);
            sb.append(" ** ");
            expr(node.right, FACTOR);
        } else {
            expr(node.left, precedence);
            sb.append(' ').append(node.operator).append(' ');
            expr(node.right, precedence + 1);
        }
        close(wrapped);
    }

    @Override
    public void visit(OperatorNode node) {
        switch (node.operator) {
            case "not" -> {
                boolean wrapped = open(NOT);
                sb.append("not ");
                expr(node.operand, NOT);
                close(wrapped);
            }
            case "await" -> {
                boolean wrapped = open(AWAIT);
                sb.append("await ");
                expr(node.operand, ATOM);
                close(wrapped);
            }
            default -> {
                boolean wrapped = open(FACTOR);
                sb.append(node.operator);
                expr(node.operand, FACTOR);
                close(wrapped);
            }
        }
    }

    @Override
    public void visit(CompareNode node) {
        boolean wrapped = open(COMPARE);
        expr(node.left, BOR);
        for (int i = 0; i < node.operators.size(); i++) {
            sb.append(' ').append(node.operators.get(i)).append(' ');
            expr(node.comparators.get(i), BOR);
        }
        close(wrapped);
    }

    @Override
    public void visit(CallNode node) {
        boolean wrapped = open(ATOM);
        expr(node.function, ATOM);
        sb.append('(');
        commaSeparated(node.arguments, LAMBDA);
        sb.append(')');
        close(wrapped);
    }

    @Override
    public void visit(KeywordArgumentNode node) {
        sb.append(node.name).append('=');
        expr(node.value, LAMBDA);
    }

    @Override
    public void visit(StarredNode node) {
        sb.append(node.operator);
        expr(node.value, BOR);
    }

    @Override
    public void visit(AttributeNode node) {
        boolean wrapped = open(ATOM);
        if (node.value instanceof NumberNode number && number.isInteger()) {
            // "1.real" would lex as a float
            sb.append('(').append(number.value).append(')');
        } else {
            expr(node.value, ATOM);
        }
        sb.append('.').append(node.attribute);
        close(wrapped);
    }

    @Override
    public void visit(SubscriptNode node) {
        boolean wrapped = open(ATOM);
        expr(node.value, ATOM);
        sb.append('[');
        expr(node.index, TUPLE, true);
        sb.append(']');
        close(wrapped);
    }

    @Override
    public void visit(SliceNode node) {
        if (node.lower != null) {
            expr(node.lower, LAMBDA);
        }
        sb.append(':');
        if (node.upper != null) {
            expr(node.upper, LAMBDA);
        }
        if (node.hasStepColon || node.step != null) {
            sb.append(':');
            if (node.step != null) {
                expr(node.step, LAMBDA);
            }
        }
    }

    @Override
    public void visit(ListLiteralNode node) {
        sb.append('[');
        commaSeparated(node.elements, LAMBDA);
        sb.append(']');
    }

    @Override
    public void visit(TupleNode node) {
        boolean bare = bareTupleAllowed && !node.elements.isEmpty();
        if (!bare) {
            sb.append('(');
        }
        commaSeparated(node.elements, LAMBDA);
        if (node.elements.size() == 1) {
            sb.append(',');
        }
        if (!bare) {
            sb.append(')');
        }
    }

    @Override
    public void visit(SetLiteralNode node) {
        sb.append('{');
        commaSeparated(node.elements, LAMBDA);
        sb.append('}');
    }

    @Override
    public void visit(DictLiteralNode node) {
        sb.append('{');
        for (int i = 0; i < node.values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Node key = node.keys.get(i);
            if (key == null) {
                sb.append("**");
                expr(node.values.get(i), BOR);
            } else {
                expr(key, LAMBDA);
                sb.append(": ");
                expr(node.values.get(i), LAMBDA);
            }
        }
        sb.append('}');
    }

    @Override
    public void visit(ComprehensionNode node) {
        String closing;
        switch (node.kind) {
            case LIST -> {
                sb.append('[');
                closing = "]";
            }
            case SET, DICT -> {
                sb.append('{');
                closing = "}";
            }
            default -> {
                sb.append('(');
                closing = ")";
            }
        }
        expr(node.element, LAMBDA);
        if (node.kind == ComprehensionNode.Kind.DICT) {
            sb.append(": ");
            expr(node.value, LAMBDA);
        }
        for (ComprehensionClause clause : node.clauses) {
            sb.append(clause.isAsync() ? " async for " : " for ");
            target(clause.target());
            sb.append(" in ");
            expr(clause.iterable(), OR);
            for (Node condition : clause.conditions()) {
                sb.append(" if ");
                expr(condition, OR);
            }
        }
        sb.append(closing);
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        boolean wrapped = open(TERNARY);
        expr(node.trueExpr, OR);
        sb.append(" if ");
        expr(node.condition, OR);
        sb.append(" else ");
        expr(node.falseExpr, TERNARY);
        close(wrapped);
    }

    @Override
    public void visit(LambdaNode node) {
        boolean wrapped = open(LAMBDA);
        sb.append("lambda");
        if (!node.parameters.parameters.isEmpty()) {
            sb.append(' ');
            parameters(node.parameters, false);
        }
        sb.append(": ");
        expr(node.body, LAMBDA);
        close(wrapped);
    }

    @Override
    public void visit(YieldNode node) {
        boolean wrapped = open(YIELD);
        sb.append("yield");
        if (node.isFrom) {
            sb.append(" from ");
            expr(node.value, LAMBDA);
        } else if (node.value != null) {
            sb.append(' ');
            expr(node.value, TUPLE, true);
        }
        close(wrapped);
    }

    @Override
    public void visit(NamedExpressionNode node) {
        sb.append('(').append(node.target.name).append(" := ");
        expr(node.value, LAMBDA);
        sb.append(')');
    }

    // ---------- statements ----------

    private void appendIndent() {
        sb.append(INDENT.repeat(indentLevel));
    }

    private static boolean isDefinition(Node node) {
        return node instanceof FunctionDefNode || node instanceof ClassDefNode;
    }

    private void statements(List<Node> elements) {
        int blankLines = indentLevel == 0 ? 2 : 1;
        for (int i = 0; i < elements.size(); i++) {
            Node statement = elements.get(i);
            if (i > 0 && (isDefinition(statement) || isDefinition(elements.get(i - 1)))) {
                sb.append("\n".repeat(blankLines));
            }
            statement.accept(this);
        }
    }

    /**
     * Writes ":" and the indented block that follows a compound statement header.
     */
    private void suite(BlockNode block) {
        sb.append(":\n");
        indentLevel++;
        if (block.elements.isEmpty()) {
            appendIndent();
            sb.append("pass\n");
        } else {
            statements(block.elements);
        }
        indentLevel--;
    }

    private void simpleStatement(Runnable body) {
        appendIndent();
        body.run();
        sb.append('\n');
    }

    @Override
    public void visit(BlockNode node) {
        statements(node.elements);
    }

    @Override
    public void visit(ModuleNode node) {
        statements(node.body.elements);
    }

    private void decorators(List<Node> decorators) {
        for (Node decorator : decorators) {
            appendIndent();
            sb.append('@');
            expr(decorator, LAMBDA);
            sb.append('\n');
        }
    }

    @Override
    public void visit(FunctionDefNode node) {
        decorators(node.decorators);
        appendIndent();
        if (node.isAsync) {
            sb.append("async ");
        }
        sb.append("def ").append(node.name).append('(');
        parameters(node.parameters, true);
        sb.append(')');
        if (node.returns != null) {
            sb.append(" -> ");
            expr(node.returns, LAMBDA);
        }
        suite(node.body);
    }

    @Override
    public void visit(ClassDefNode node) {
        decorators(node.decorators);
        appendIndent();
        sb.append("class ").append(node.name);
        if (!node.bases.isEmpty()) {
            sb.append('(');
            commaSeparated(node.bases, LAMBDA);
            sb.append(')');
        }
        suite(node.body);
    }

    @Override
    public void visit(IfNode node) {
        appendIndent();
        ifChain(node, "if ");
    }

    private void ifChain(IfNode node, String keyword) {
        sb.append(keyword);
        expr(node.condition, LAMBDA);
        suite(node.thenBlock);
        BlockNode elseBlock = node.elseBlock;
        if (elseBlock == null) {
            return;
        }
        appendIndent();
        if (elseBlock.elements.size() == 1 && elseBlock.elements.get(0) instanceof IfNode elif && elif.isElif) {
            ifChain(elif, "elif ");
        } else {
            sb.append("else");
            suite(elseBlock);
        }
    }

    @Override
    public void visit(ForNode node) {
        appendIndent();
        sb.append(node.isAsync ? "async for " : "for ");
        target(node.target);
        sb.append(" in ");
        expr(node.iterable, LAMBDA, true);
        suite(node.body);
        if (node.elseBlock != null) {
            appendIndent();
            sb.append("else");
            suite(node.elseBlock);
        }
    }

    @Override
    public void visit(WhileNode node) {
        appendIndent();
        sb.append("while ");
        expr(node.condition, LAMBDA);
        suite(node.body);
        if (node.elseBlock != null) {
            appendIndent();
            sb.append("else");
            suite(node.elseBlock);
        }
    }

    @Override
    public void visit(TryNode node) {
        appendIndent();
        sb.append("try");
        suite(node.body);
        for (ExceptHandler handler : node.handlers) {
            appendIndent();
            sb.append(handler.isGroup() ? "except*" : "except");
            if (handler.type() != null) {
                sb.append(' ');
                expr(handler.type(), LAMBDA);
                if (handler.name() != null) {
                    sb.append(" as ").append(handler.name());
                }
            }
            suite(handler.body());
        }
        if (node.elseBlock != null) {
            appendIndent();
            sb.append("else");
            suite(node.elseBlock);
        }
        if (node.finallyBlock != null) {
            appendIndent();
            sb.append("finally");
            suite(node.finallyBlock);
        }
    }

    @Override
    public void visit(WithNode node) {
        appendIndent();
        sb.append(node.isAsync ? "async with " : "with ");
        for (int i = 0; i < node.items.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            WithItem item = node.items.get(i);
            expr(item.context(), LAMBDA);
            if (item.target() != null) {
                sb.append(" as ");
                expr(item.target(), BOR);
            }
        }
        suite(node.body);
    }

    @Override
    public void visit(AssignNode node) {
        simpleStatement(() -> {
            for (Node target : node.targets) {
                target(target);
                sb.append(" = ");
            }
            expr(node.value, TUPLE, true);
        });
    }

    @Override
    public void visit(AugAssignNode node) {
        simpleStatement(() -> {
            expr(node.target, ATOM);
            sb.append(' ').append(node.operator).append("= ");
            expr(node.value, TUPLE, true);
        });
    }

    @Override
    public void visit(AnnAssignNode node) {
        simpleStatement(() -> {
            expr(node.target, ATOM);
            sb.append(": ");
            expr(node.annotation, LAMBDA);
            if (node.value != null) {
                sb.append(" = ");
                expr(node.value, TUPLE, true);
            }
        });
    }

    @Override
    public void visit(ReturnNode node) {
        simpleStatement(() -> {
            sb.append("return");
            if (node.value != null) {
                sb.append(' ');
                expr(node.value, TUPLE, true);
            }
        });
    }

    @Override
    public void visit(DeleteNode node) {
        simpleStatement(() -> {
            sb.append("del ");
            commaSeparated(node.targets, BOR);
        });
    }

    @Override
    public void visit(RaiseNode node) {
        simpleStatement(() -> {
            sb.append("raise");
            if (node.exception != null) {
                sb.append(' ');
                expr(node.exception, LAMBDA);
                if (node.cause != null) {
                    sb.append(" from ");
                    expr(node.cause, LAMBDA);
                }
            }
        });
    }

    @Override
    public void visit(AssertNode node) {
        simpleStatement(() -> {
            sb.append("assert ");
            expr(node.test, LAMBDA);
            if (node.message != null) {
                sb.append(", ");
                expr(node.message, LAMBDA);
            }
        });
    }

    @Override
    public void visit(GlobalNode node) {
        simpleStatement(() -> sb.append(node.keyword).append(' ').append(String.join(", ", node.names)));
    }

    private void aliases(List<ImportAlias> names) {
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            ImportAlias alias = names.get(i);
            sb.append(alias.name());
            if (alias.asName() != null) {
                sb.append(" as ").append(alias.asName());
            }
        }
    }

    @Override
    public void visit(ImportNode node) {
        simpleStatement(() -> {
            sb.append("import ");
            aliases(node.names);
        });
    }

    @Override
    public void visit(ImportFromNode node) {
        simpleStatement(() -> {
            sb.append("from ").append(".".repeat(node.level));
            if (node.module != null) {
                sb.append(node.module);
            }
            sb.append(" import ");
            aliases(node.names);
        });
    }

    @Override
    public void visit(ControlStatementNode node) {
        simpleStatement(() -> sb.append(node.keyword));
    }

    @Override
    public void visit(ExpressionStatementNode node) {
        simpleStatement(() -> expr(node.expression, TUPLE, true));
    }
}
