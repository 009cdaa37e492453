package org.pyoptimizer.astvisitor;

import org.pyoptimizer.astnode.*;

/**
 * Visitor that walks every node of a tree in source order.
 * <p>
 * Each visit method delegates to {@link #visitNode(Node)}, whose default implementation
 * descends into the children. Subclasses override the visit methods of the node
 * kinds they inspect and call {@link #visitChildren(Node)} to keep descending.
 */
public abstract class TraversingVisitor implements Visitor {

    protected void visitNode(Node node) {
        visitChildren(node);
    }

    protected void visitChildren(Node node) {
        for (Node child : node.children()) {
            child.accept(this);
        }
    }

    @Override
    public void visit(IdentifierNode node) {
        visitNode(node);
    }

    @Override
    public void visit(NumberNode node) {
        visitNode(node);
    }

    @Override
    public void visit(StringNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ConstantNode node) {
        visitNode(node);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        visitNode(node);
    }

    @Override
    public void visit(OperatorNode node) {
        visitNode(node);
    }

    @Override
    public void visit(CompareNode node) {
        visitNode(node);
    }

    @Override
    public void visit(CallNode node) {
        visitNode(node);
    }

    @Override
    public void visit(KeywordArgumentNode node) {
        visitNode(node);
    }

    @Override
    public void visit(StarredNode node) {
        visitNode(node);
    }

    @Override
    public void visit(AttributeNode node) {
        visitNode(node);
    }

    @Override
    public void visit(SubscriptNode node) {
        visitNode(node);
    }

    @Override
    public void visit(SliceNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ListLiteralNode node) {
        visitNode(node);
    }

    @Override
    public void visit(TupleNode node) {
        visitNode(node);
    }

    @Override
    public void visit(SetLiteralNode node) {
        visitNode(node);
    }

    @Override
    public void visit(DictLiteralNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ComprehensionNode node) {
        visitNode(node);
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        visitNode(node);
    }

    @Override
    public void visit(LambdaNode node) {
        visitNode(node);
    }

    @Override
    public void visit(YieldNode node) {
        visitNode(node);
    }

    @Override
    public void visit(NamedExpressionNode node) {
        visitNode(node);
    }

    @Override
    public void visit(BlockNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ModuleNode node) {
        visitNode(node);
    }

    @Override
    public void visit(FunctionDefNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ClassDefNode node) {
        visitNode(node);
    }

    @Override
    public void visit(IfNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ForNode node) {
        visitNode(node);
    }

    @Override
    public void visit(WhileNode node) {
        visitNode(node);
    }

    @Override
    public void visit(TryNode node) {
        visitNode(node);
    }

    @Override
    public void visit(WithNode node) {
        visitNode(node);
    }

    @Override
    public void visit(AssignNode node) {
        visitNode(node);
    }

    @Override
    public void visit(AugAssignNode node) {
        visitNode(node);
    }

    @Override
    public void visit(AnnAssignNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ReturnNode node) {
        visitNode(node);
    }

    @Override
    public void visit(DeleteNode node) {
        visitNode(node);
    }

    @Override
    public void visit(RaiseNode node) {
        visitNode(node);
    }

    @Override
    public void visit(AssertNode node) {
        visitNode(node);
    }

    @Override
    public void visit(GlobalNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ImportNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ImportFromNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ControlStatementNode node) {
        visitNode(node);
    }

    @Override
    public void visit(ExpressionStatementNode node) {
        visitNode(node);
    }
}
