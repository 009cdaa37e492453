package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

import java.util.List;

/*
 * Prints a syntax tree as an indented outline, one node per line.
 *
 * Node ids and source spans are left out, so two trees print identically exactly
 * when they have the same structure. The parser tests rely on this.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public String getResult() {
        return sb.toString();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    private void line(String text) {
        appendIndent();
        sb.append(text).append("\n");
    }

    private void child(String label, Node node) {
        if (node == null) {
            return;
        }
        line(label + ":");
        indentLevel++;
        node.accept(this);
        indentLevel--;
    }

    private void children(String label, List<? extends Node> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        line(label + ":");
        indentLevel++;
        for (Node node : nodes) {
            if (node == null) {
                line("null");
            } else {
                node.accept(this);
            }
        }
        indentLevel--;
    }

    private void parameters(ParameterList parameterList) {
        if (parameterList.parameters.isEmpty()) {
            return;
        }
        line("Parameters:");
        indentLevel++;
        for (Parameter parameter : parameterList.parameters) {
            line(parameter.kind() + " " + parameter.name());
            indentLevel++;
            child("annotation", parameter.annotation());
            child("default", parameter.defaultValue());
            indentLevel--;
        }
        indentLevel--;
    }

    @Override
    public void visit(IdentifierNode node) {
        line("IdentifierNode: " + node.name);
    }

    @Override
    public void visit(NumberNode node) {
        line("NumberNode: " + node.value);
    }

    @Override
    public void visit(StringNode node) {
        line("StringNode: " + node.text());
    }

    @Override
    public void visit(ConstantNode node) {
        line("ConstantNode: " + node.value);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        line("BinaryOperatorNode: " + node.operator);
        indentLevel++;
        node.left.accept(this);
        node.right.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(OperatorNode node) {
        line("OperatorNode: " + node.operator);
        indentLevel++;
        node.operand.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(CompareNode node) {
        line("CompareNode: " + String.join(" ", node.operators));
        indentLevel++;
        node.left.accept(this);
        for (Node comparator : node.comparators) {
            comparator.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(CallNode node) {
        line("CallNode:");
        indentLevel++;
        node.function.accept(this);
        children("Arguments", node.arguments);
        indentLevel--;
    }

    @Override
    public void visit(KeywordArgumentNode node) {
        line("KeywordArgumentNode: " + node.name);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(StarredNode node) {
        line("StarredNode: " + node.operator);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(AttributeNode node) {
        line("AttributeNode: " + node.attribute);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(SubscriptNode node) {
        line("SubscriptNode:");
        indentLevel++;
        node.value.accept(this);
        child("Index", node.index);
        indentLevel--;
    }

    @Override
    public void visit(SliceNode node) {
        line("SliceNode:" + (node.hasStepColon ? " step" : ""));
        indentLevel++;
        child("lower", node.lower);
        child("upper", node.upper);
        child("step", node.step);
        indentLevel--;
    }

    @Override
    public void visit(ListLiteralNode node) {
        line("ListLiteralNode:");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(TupleNode node) {
        line("TupleNode:");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(SetLiteralNode node) {
        line("SetLiteralNode:");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(DictLiteralNode node) {
        line("DictLiteralNode:");
        indentLevel++;
        for (int i = 0; i < node.values.size(); i++) {
            Node key = node.keys.get(i);
            if (key == null) {
                child("**", node.values.get(i));
            } else {
                line("Entry:");
                indentLevel++;
                key.accept(this);
                node.values.get(i).accept(this);
                indentLevel--;
            }
        }
        indentLevel--;
    }

    @Override
    public void visit(ComprehensionNode node) {
        line("ComprehensionNode: " + node.kind);
        indentLevel++;
        node.element.accept(this);
        child("value", node.value);
        for (ComprehensionClause clause : node.clauses) {
            line(clause.isAsync() ? "async for:" : "for:");
            indentLevel++;
            clause.target().accept(this);
            clause.iterable().accept(this);
            children("if", clause.conditions());
            indentLevel--;
        }
        indentLevel--;
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        line("TernaryOperatorNode:");
        indentLevel++;
        node.condition.accept(this);
        node.trueExpr.accept(this);
        node.falseExpr.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(LambdaNode node) {
        line("LambdaNode:");
        indentLevel++;
        parameters(node.parameters);
        node.body.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(YieldNode node) {
        line(node.isFrom ? "YieldNode: from" : "YieldNode:");
        indentLevel++;
        if (node.value != null) {
            node.value.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(NamedExpressionNode node) {
        line("NamedExpressionNode:");
        indentLevel++;
        node.target.accept(this);
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        line("BlockNode:");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ModuleNode node) {
        line("ModuleNode:");
        indentLevel++;
        node.body.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(FunctionDefNode node) {
        line("FunctionDefNode: " + (node.isAsync ? "async " : "") + node.name);
        indentLevel++;
        children("Decorators", node.decorators);
        parameters(node.parameters);
        child("returns", node.returns);
        node.body.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(ClassDefNode node) {
        line("ClassDefNode: " + node.name);
        indentLevel++;
        children("Decorators", node.decorators);
        children("Bases", node.bases);
        node.body.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(IfNode node) {
        line(node.isElif ? "IfNode: elif" : "IfNode:");
        indentLevel++;
        node.condition.accept(this);
        node.thenBlock.accept(this);
        child("else", node.elseBlock);
        indentLevel--;
    }

    @Override
    public void visit(ForNode node) {
        line(node.isAsync ? "ForNode: async" : "ForNode:");
        indentLevel++;
        child("Variable", node.target);
        child("List", node.iterable);
        node.body.accept(this);
        child("else", node.elseBlock);
        indentLevel--;
    }

    @Override
    public void visit(WhileNode node) {
        line("WhileNode:");
        indentLevel++;
        node.condition.accept(this);
        node.body.accept(this);
        child("else", node.elseBlock);
        indentLevel--;
    }

    @Override
    public void visit(TryNode node) {
        line("TryNode:");
        indentLevel++;
        node.body.accept(this);
        for (ExceptHandler handler : node.handlers) {
            line((handler.isGroup() ? "except*" : "except") + (handler.name() == null ? "" : " as " + handler.name()) + ":");
            indentLevel++;
            child("type", handler.type());
            handler.body().accept(this);
            indentLevel--;
        }
        child("else", node.elseBlock);
        child("finally", node.finallyBlock);
        indentLevel--;
    }

    @Override
    public void visit(WithNode node) {
        line(node.isAsync ? "WithNode: async" : "WithNode:");
        indentLevel++;
        for (WithItem item : node.items) {
            line("Item:");
            indentLevel++;
            item.context().accept(this);
            child("as", item.target());
            indentLevel--;
        }
        node.body.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(AssignNode node) {
        line("AssignNode:");
        indentLevel++;
        children("Targets", node.targets);
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(AugAssignNode node) {
        line("AugAssignNode: " + node.operator + "=");
        indentLevel++;
        node.target.accept(this);
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(AnnAssignNode node) {
        line("AnnAssignNode:");
        indentLevel++;
        node.target.accept(this);
        child("annotation", node.annotation);
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(ReturnNode node) {
        line("ReturnNode:");
        indentLevel++;
        if (node.value != null) {
            node.value.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(DeleteNode node) {
        line("DeleteNode:");
        indentLevel++;
        for (Node target : node.targets) {
            target.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(RaiseNode node) {
        line("RaiseNode:");
        indentLevel++;
        child("exception", node.exception);
        child("from", node.cause);
        indentLevel--;
    }

    @Override
    public void visit(AssertNode node) {
        line("AssertNode:");
        indentLevel++;
        node.test.accept(this);
        child("message", node.message);
        indentLevel--;
    }

    @Override
    public void visit(GlobalNode node) {
        line("GlobalNode: " + node.keyword + " " + String.join(", ", node.names));
    }

    @Override
    public void visit(ImportNode node) {
        line("ImportNode: " + aliases(node.names));
    }

    @Override
    public void visit(ImportFromNode node) {
        line("ImportFromNode: " + ".".repeat(node.level) + (node.module == null ? "" : node.module)
                + " import " + aliases(node.names));
    }

    private static String aliases(List<ImportAlias> names) {
        StringBuilder result = new StringBuilder();
        for (ImportAlias alias : names) {
            if (result.length() > 0) {
                result.append(", ");
            }
            result.append(alias.name());
            if (alias.asName() != null) {
                result.append(" as ").append(alias.asName());
            }
        }
        return result.toString();
    }

    @Override
    public void visit(ControlStatementNode node) {
        line("ControlStatementNode: " + node.keyword);
    }

    @Override
    public void visit(ExpressionStatementNode node) {
        line("ExpressionStatementNode:");
        indentLevel++;
        node.expression.accept(this);
        indentLevel--;
    }
}
