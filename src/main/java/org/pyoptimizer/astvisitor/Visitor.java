package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

/**
 * Visitor over the syntax tree, one method per node class.
 * <p>
 * Most analyses only care about a handful of node kinds and extend
 * {@link TraversingVisitor} instead of implementing this interface directly.
 */
public interface Visitor {

    void visit(IdentifierNode node);

    void visit(NumberNode node);

    void visit(StringNode node);

    void visit(ConstantNode node);

    void visit(BinaryOperatorNode node);

    void visit(OperatorNode node);

    void visit(CompareNode node);

    void visit(CallNode node);

    void visit(KeywordArgumentNode node);

    void visit(StarredNode node);

    void visit(AttributeNode node);

    void visit(SubscriptNode node);

    void visit(SliceNode node);

    void visit(ListLiteralNode node);

    void visit(TupleNode node);

    void visit(SetLiteralNode node);

    void visit(DictLiteralNode node);

    void visit(ComprehensionNode node);

    void visit(TernaryOperatorNode node);

    void visit(LambdaNode node);

    void visit(YieldNode node);

    void visit(NamedExpressionNode node);

    void visit(BlockNode node);

    void visit(ModuleNode node);

    void visit(FunctionDefNode node);

    void visit(ClassDefNode node);

    void visit(IfNode node);

    void visit(ForNode node);

    void visit(WhileNode node);

    void visit(TryNode node);

    void visit(WithNode node);

    void visit(AssignNode node);

    void visit(AugAssignNode node);

    void visit(AnnAssignNode node);

    void visit(ReturnNode node);

    void visit(DeleteNode node);

    void visit(RaiseNode node);

    void visit(AssertNode node);

    void visit(GlobalNode node);

    void visit(ImportNode node);

    void visit(ImportFromNode node);

    void visit(ControlStatementNode node);

    void visit(ExpressionStatementNode node);
}
