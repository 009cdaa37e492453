package org.pyoptimizer.parser;

import org.junit.jupiter.api.Test;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.exception.ParseError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static SyntaxTree parse(String text) {
        return new PythonParserAdapter().parse("test.py", text);
    }

    private static List<Node> statements(String text) {
        return parse(text).root.body.elements;
    }

    private static void collectIds(Node node, Set<Integer> ids, List<Integer> duplicates) {
        if (!ids.add(node.getId())) {
            duplicates.add(node.getId());
        }
        for (Node child : node.children()) {
            collectIds(child, ids, duplicates);
        }
    }

    @Test
    public void testNestedCountedLoops() {
        List<Node> body = statements("for i in range(10):\n    for j in range(n):\n        total += i * j\n");
        assertEquals(1, body.size());
        ForNode outer = assertInstanceOf(ForNode.class, body.get(0));
        assertEquals("i", assertInstanceOf(IdentifierNode.class, outer.target).name);
        CallNode range = assertInstanceOf(CallNode.class, outer.iterable);
        assertEquals("range", assertInstanceOf(IdentifierNode.class, range.function).name);
        assertEquals("10", assertInstanceOf(NumberNode.class, range.arguments.get(0)).value);

        ForNode inner = assertInstanceOf(ForNode.class, outer.body.elements.get(0));
        AugAssignNode update = assertInstanceOf(AugAssignNode.class, inner.body.elements.get(0));
        assertEquals("+", update.operator);
        BinaryOperatorNode product = assertInstanceOf(BinaryOperatorNode.class, update.value);
        assertEquals("*", product.operator);
    }

    @Test
    public void testSpansCoverWholeStatements() {
        List<Node> body = statements("x = 1\nfor i in range(3):\n    x += i\nprint(x)\n");
        assertEquals(new SourceSpan(1, 0, 1, 5), body.get(0).getSpan());
        SourceSpan loop = body.get(1).getSpan();
        assertEquals(2, loop.startLine());
        assertEquals(3, loop.endLine());
        assertEquals(4, body.get(2).getSpan().startLine());
    }

    @Test
    public void testFunctionHeaderSpanStopsAtColon() {
        List<Node> body = statements("@decorator\ndef area(w, h=2):\n    return w * h\n");
        FunctionDefNode function = assertInstanceOf(FunctionDefNode.class, body.get(0));
        assertEquals("area", function.name);
        assertEquals(1, function.decorators.size());
        assertEquals(List.of("w", "h"), function.parameters.boundNames());
        assertEquals(2, function.headerSpan.endLine());
        assertEquals(17, function.headerSpan.endColumn());
        assertEquals(3, function.getSpan().endLine());
        assertTrue(function.getSpan().contains(function.headerSpan));
    }

    @Test
    public void testNodeIdsAreUnique() {
        SyntaxTree tree = parse("def f(a):\n    return [x * a for x in range(a) if x]\n\nclass C:\n    y = f(3)\n");
        Set<Integer> ids = new HashSet<>();
        List<Integer> duplicates = new ArrayList<>();
        collectIds(tree.root, ids, duplicates);
        assertTrue(duplicates.isEmpty(), "Duplicate node ids: " + duplicates);
        assertTrue(tree.lastId() >= ids.size());
    }

    @Test
    public void testCopyKeepsIdsAndSharesNothing() {
        SyntaxTree tree = parse("a = [1, 2]\nb = a\n");
        SyntaxTree copy = tree.copy();
        Node original = tree.root.body.elements.get(0);
        Node copied = copy.root.body.elements.get(0);
        assertEquals(original.getId(), copied.getId());
        assertNotSame(original, copied);
        copy.root.body.elements.remove(1);
        assertEquals(2, tree.root.body.elements.size(), "Changing the copy must not change the original");
        assertTrue(copy.nextId() > tree.lastId());
    }

    @Test
    public void testSemicolonsSplitStatements() {
        List<Node> body = statements("a = 1; b = 2; print(a)\n");
        assertEquals(3, body.size());
        assertInstanceOf(AssignNode.class, body.get(0));
        assertInstanceOf(ExpressionStatementNode.class, body.get(2));
    }

    @Test
    public void testElifChain() {
        List<Node> body = statements("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
        IfNode first = assertInstanceOf(IfNode.class, body.get(0));
        assertFalse(first.isElif);
        IfNode second = assertInstanceOf(IfNode.class, first.elseBlock.elements.get(0));
        assertTrue(second.isElif);
        assertNotNull(second.elseBlock);
    }

    @Test
    public void testComparisonChain() {
        List<Node> body = statements("ok = 0 <= i < n and x not in seen\n");
        AssignNode assign = assertInstanceOf(AssignNode.class, body.get(0));
        BinaryOperatorNode and = assertInstanceOf(BinaryOperatorNode.class, assign.value);
        assertEquals("and", and.operator);
        CompareNode chain = assertInstanceOf(CompareNode.class, and.left);
        assertEquals(List.of("<=", "<"), chain.operators);
        CompareNode membership = assertInstanceOf(CompareNode.class, and.right);
        assertEquals(List.of("not in"), membership.operators);
    }

    @Test
    public void testTupleTargetsAndValues() {
        List<Node> body = statements("a, b = b, a\n");
        AssignNode assign = assertInstanceOf(AssignNode.class, body.get(0));
        assertEquals(2, assertInstanceOf(TupleNode.class, assign.targets.get(0)).elements.size());
        assertEquals(2, assertInstanceOf(TupleNode.class, assign.value).elements.size());
    }

    @Test
    public void testGroupingParenthesesLeaveNoNode() {
        List<Node> body = statements("x = ((a))\n");
        AssignNode assign = assertInstanceOf(AssignNode.class, body.get(0));
        assertInstanceOf(IdentifierNode.class, assign.value);
    }

    @Test
    public void testWalrusInCondition() {
        List<Node> body = statements("while (chunk := read()):\n    handle(chunk)\n");
        WhileNode loop = assertInstanceOf(WhileNode.class, body.get(0));
        NamedExpressionNode walrus = assertInstanceOf(NamedExpressionNode.class, loop.condition);
        assertEquals("chunk", walrus.target.name);
    }

    @Test
    public void testSyntaxErrorReportsLine() {
        ParseError error = assertThrows(ParseError.class, () -> parse("x = 1\ny = = 2\n"));
        assertEquals(2, error.getLine());
        assertEquals("test.py", error.getFileName());
        assertTrue(error.getMessage().contains("line 2"), error.getMessage());
    }

    @Test
    public void testMissingIndentedBlock() {
        assertThrows(ParseError.class, () -> parse("for i in range(3):\nprint(i)\n"));
    }

    @Test
    public void testUnexpectedIndent() {
        assertThrows(ParseError.class, () -> parse("x = 1\n    y = 2\n"));
    }
}
