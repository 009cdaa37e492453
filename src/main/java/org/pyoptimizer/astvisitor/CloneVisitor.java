package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Deep clones syntax tree nodes.
 * <p>
 * Clones keep the id and the span of the original, so anchors taken
 * on a parsed tree resolve in every copy of it. Blocks get fresh element lists, so
 * splicing statements into a copy never touches the original.
 */
public class CloneVisitor implements Visitor {
    private Node clonedNode;

    @SuppressWarnings("unchecked")
    public static <T extends Node> T cloneNode(T node) {
        if (node == null) {
            return null;
        }
        CloneVisitor visitor = new CloneVisitor();
        node.accept(visitor);
        return (T) visitor.clonedNode;
    }

    public static List<Node> cloneList(List<? extends Node> nodes) {
        List<Node> cloned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            cloned.add(cloneNode(node));
        }
        return cloned;
    }

    private static ParameterList cloneParameters(ParameterList parameterList) {
        List<Parameter> parameters = new ArrayList<>(parameterList.parameters.size());
        for (Parameter parameter : parameterList.parameters) {
            parameters.add(new Parameter(parameter.kind(), parameter.name(),
                    cloneNode(parameter.annotation()), cloneNode(parameter.defaultValue())));
        }
        return new ParameterList(parameters);
    }

    private void done(AbstractNode original, AbstractNode copy) {
        copy.id = original.id;
        copy.span = original.span;
        clonedNode = copy;
    }

    @Override
    public void visit(IdentifierNode node) {
        done(node, new IdentifierNode(node.name));
    }

    @Override
    public void visit(NumberNode node) {
        done(node, new NumberNode(node.value));
    }

    @Override
    public void visit(StringNode node) {
        done(node, new StringNode(node.pieces));
    }

    @Override
    public void visit(ConstantNode node) {
        done(node, new ConstantNode(node.value));
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        done(node, new BinaryOperatorNode(node.operator, cloneNode(node.left), cloneNode(node.right)));
    }

    @Override
    public void visit(OperatorNode node) {
        done(node, new OperatorNode(node.operator, cloneNode(node.operand)));
    }

    @Override
    public void visit(CompareNode node) {
        done(node, new CompareNode(cloneNode(node.left), new ArrayList<>(node.operators), cloneList(node.comparators)));
    }

    @Override
    public void visit(CallNode node) {
        done(node, new CallNode(cloneNode(node.function), cloneList(node.arguments)));
    }

    @Override
    public void visit(KeywordArgumentNode node) {
        done(node, new KeywordArgumentNode(node.name, cloneNode(node.value)));
    }

    @Override
    public void visit(StarredNode node) {
        done(node, new StarredNode(node.operator, cloneNode(node.value)));
    }

    @Override
    public void visit(AttributeNode node) {
        done(node, new AttributeNode(cloneNode(node.value), node.attribute));
    }

    @Override
    public void visit(SubscriptNode node) {
        done(node, new SubscriptNode(cloneNode(node.value), cloneNode(node.index)));
    }

    @Override
    public void visit(SliceNode node) {
        done(node, new SliceNode(cloneNode(node.lower), cloneNode(node.upper), cloneNode(node.step), node.hasStepColon));
    }

    @Override
    public void visit(ListLiteralNode node) {
        done(node, new ListLiteralNode(cloneList(node.elements)));
    }

    @Override
    public void visit(TupleNode node) {
        done(node, new TupleNode(cloneList(node.elements)));
    }

    @Override
    public void visit(SetLiteralNode node) {
        done(node, new SetLiteralNode(cloneList(node.elements)));
    }

    @Override
    public void visit(DictLiteralNode node) {
        done(node, new DictLiteralNode(cloneList(node.keys), cloneList(node.values)));
    }

    @Override
    public void visit(ComprehensionNode node) {
        List<ComprehensionClause> clauses = new ArrayList<>();
        for (ComprehensionClause clause : node.clauses) {
            clauses.add(new ComprehensionClause(cloneNode(clause.target()), cloneNode(clause.iterable()),
                    cloneList(clause.conditions()), clause.isAsync()));
        }
        done(node, new ComprehensionNode(node.kind, cloneNode(node.element), cloneNode(node.value), clauses));
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        done(node, new TernaryOperatorNode(cloneNode(node.condition), cloneNode(node.trueExpr), cloneNode(node.falseExpr)));
    }

    @Override
    public void visit(LambdaNode node) {
        done(node, new LambdaNode(cloneParameters(node.parameters), cloneNode(node.body)));
    }

    @Override
    public void visit(YieldNode node) {
        done(node, new YieldNode(cloneNode(node.value), node.isFrom));
    }

    @Override
    public void visit(NamedExpressionNode node) {
        done(node, new NamedExpressionNode(cloneNode(node.target), cloneNode(node.value)));
    }

    @Override
    public void visit(BlockNode node) {
        done(node, new BlockNode(cloneList(node.elements)));
    }

    @Override
    public void visit(ModuleNode node) {
        done(node, new ModuleNode(cloneNode(node.body)));
    }

    @Override
    public void visit(FunctionDefNode node) {
        FunctionDefNode copy = new FunctionDefNode(node.name, cloneParameters(node.parameters), cloneNode(node.returns),
                cloneNode(node.body), cloneList(node.decorators), node.isAsync);
        copy.headerSpan = node.headerSpan;
        done(node, copy);
    }

    @Override
    public void visit(ClassDefNode node) {
        done(node, new ClassDefNode(node.name, cloneList(node.bases), cloneNode(node.body), cloneList(node.decorators)));
    }

    @Override
    public void visit(IfNode node) {
        done(node, new IfNode(cloneNode(node.condition), cloneNode(node.thenBlock), cloneNode(node.elseBlock), node.isElif));
    }

    @Override
    public void visit(ForNode node) {
        done(node, new ForNode(cloneNode(node.target), cloneNode(node.iterable), cloneNode(node.body),
                cloneNode(node.elseBlock), node.isAsync));
    }

    @Override
    public void visit(WhileNode node) {
        done(node, new WhileNode(cloneNode(node.condition), cloneNode(node.body), cloneNode(node.elseBlock)));
    }

    @Override
    public void visit(TryNode node) {
        List<ExceptHandler> handlers = new ArrayList<>();
        for (ExceptHandler handler : node.handlers) {
            handlers.add(new ExceptHandler(cloneNode(handler.type()), handler.name(), cloneNode(handler.body()), handler.isGroup()));
        }
        done(node, new TryNode(cloneNode(node.body), handlers, cloneNode(node.elseBlock), cloneNode(node.finallyBlock)));
    }

    @Override
    public void visit(WithNode node) {
        List<WithItem> items = new ArrayList<>();
        for (WithItem item : node.items) {
            items.add(new WithItem(cloneNode(item.context()), cloneNode(item.target())));
        }
        done(node, new WithNode(items, cloneNode(node.body), node.isAsync));
    }

    @Override
    public void visit(AssignNode node) {
        done(node, new AssignNode(cloneList(node.targets), cloneNode(node.value)));
    }

    @Override
    public void visit(AugAssignNode node) {
        done(node, new AugAssignNode(cloneNode(node.target), node.operator, cloneNode(node.value)));
    }

    @Override
    public void visit(AnnAssignNode node) {
        done(node, new AnnAssignNode(cloneNode(node.target), cloneNode(node.annotation), cloneNode(node.value)));
    }

    @Override
    public void visit(ReturnNode node) {
        done(node, new ReturnNode(cloneNode(node.value)));
    }

    @Override
    public void visit(DeleteNode node) {
        done(node, new DeleteNode(cloneList(node.targets)));
    }

    @Override
    public void visit(RaiseNode node) {
        done(node, new RaiseNode(cloneNode(node.exception), cloneNode(node.cause)));
    }

    @Override
    public void visit(AssertNode node) {
        done(node, new AssertNode(cloneNode(node.test), cloneNode(node.message)));
    }

    @Override
    public void visit(GlobalNode node) {
        done(node, new GlobalNode(node.keyword, new ArrayList<>(node.names)));
    }

    @Override
    public void visit(ImportNode node) {
        done(node, new ImportNode(new ArrayList<>(node.names)));
    }

    @Override
    public void visit(ImportFromNode node) {
        done(node, new ImportFromNode(node.module, node.level, new ArrayList<>(node.names)));
    }

    @Override
    public void visit(ControlStatementNode node) {
        done(node, new ControlStatementNode(node.keyword));
    }

    @Override
    public void visit(ExpressionStatementNode node) {
        done(node, new ExpressionStatementNode(cloneNode(node.expression)));
    }
}
