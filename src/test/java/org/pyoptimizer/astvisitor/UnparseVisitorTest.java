package org.pyoptimizer.astvisitor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pyoptimizer.astnode.*;
import org.pyoptimizer.parser.PythonParserAdapter;
import org.pyoptimizer.rules.NodeFactory;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class UnparseVisitorTest {

    private final PythonParserAdapter adapter = new PythonParserAdapter();

    /**
     * Scripts already in the layout the unparser produces; they must come back unchanged.
     */
    static Stream<String> canonicalScripts() {
        return Stream.of(
                "x = 1\n",
                "a, b = b, a\n",
                "x = (a + b) * c\n",
                "x = a - (b - c)\n",
                "x = -y ** 2\n",
                "x = (-y) ** 2\n",
                "ok = not a and b or c\n",
                "t = a if b else c\n",
                "items = [i * 2 for i in range(10) if i % 2]\n",
                "table = {k: v for k, v in pairs.items()}\n",
                "f = lambda x, y=1: x + y\n",
                "d = {'a': 1, **rest}\n",
                "s = data[1:n:2] + data[::2] + data[i][j]\n",
                "print(*args, sep='', end=\"\\n\")\n",
                "x: int = 5\n",
                "from os import path as p\nimport numpy as np\n",
                "for i, j in itertools.product(range(n), range(m)):\n    total += i * j\n",
                "for i in range(3):\n    if i == 1:\n        continue\n    print(i)\nelse:\n    pass\n",
                "while (chunk := read()):\n    handle(chunk)\n",
                "if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n",
                "try:\n    x = 1\nexcept ValueError as e:\n    raise RuntimeError('bad') from e\nfinally:\n    done()\n",
                "with open(p) as fh:\n    data = fh.read()\n",
                "def f(a, b=2, *args, key=None, **kwargs):\n    global total\n    del a[0]\n    assert b, 'msg'\n    return a, b\n",
                "def gen(n):\n    yield n\n",
                "async def main():\n    await asyncio.sleep(1)\n",
                "\"\"\"Module doc.\"\"\"\nimport os\n\n\ndef f():\n    pass\n\n\nx = f()\n",
                "class C(Base):\n    x = 1\n\n    def m(self):\n        return self.x\n\n    @property\n    def n(self):\n        return 2\n",
                "@functools.lru_cache(maxsize=None)\ndef fib(n):\n    return n if n < 2 else fib(n - 1) + fib(n - 2)\n"
        );
    }

    @ParameterizedTest
    @MethodSource("canonicalScripts")
    public void testCanonicalScriptIsReproduced(String script) {
        assertEquals(script, adapter.unparse(adapter.parse("test.py", script)));
    }

    @Test
    public void testRedundantParenthesesAndSpacingAreNormalized() {
        String text = "x=((1+2))*3\ny = (a + b) + c\nz = f((a))\n";
        assertEquals("x = (1 + 2) * 3\ny = a + b + c\nz = f(a)\n", adapter.unparse(adapter.parse("test.py", text)));
    }

    @Test
    public void testCommentsAndBlankLinesAreNotKept() {
        String text = "# header\nx = 1  # trailing\n\n\n\ny = 2\n";
        assertEquals("x = 1\ny = 2\n", adapter.unparse(adapter.parse("test.py", text)));
    }

    @Test
    public void testUnparsedTextParsesAgain() {
        String text = "def f(v):\n  return [x for x in v if x > 0]\nr = f([1, -2, 3])\n";
        String once = adapter.unparse(adapter.parse("test.py", text));
        String twice = adapter.unparse(adapter.parse("test.py", once));
        assertEquals(once, twice);
    }

    @Test
    public void testBuiltTreesGetParenthesesFromPrecedence() {
        SyntaxTree tree = adapter.parse("test.py", "pass\n");
        NodeFactory nodes = new NodeFactory(tree, SourceSpan.UNKNOWN);

        Node sum = nodes.binary("+", nodes.call("np.asarray", nodes.name("a")), nodes.call("np.asarray", nodes.name("b")));
        Node scaled = nodes.binary("*", sum, nodes.number("2"));
        Node statement = nodes.assign(nodes.subscript(nodes.name("c"), nodes.slice(null, null)),
                nodes.call(nodes.attribute(scaled, "tolist")));
        assertEquals("c[:] = ((np.asarray(a) + np.asarray(b)) * 2).tolist()\n", UnparseVisitor.unparse(statement));

        Node pairs = nodes.generator(nodes.tuple(nodes.name("i"), nodes.name("j")), List.of(
                new ComprehensionClause(nodes.name("i"), nodes.call("range", nodes.name("n")), List.of(), false),
                new ComprehensionClause(nodes.name("j"), nodes.call("range", nodes.name("i")), List.of(), false)));
        Node loop = nodes.forLoop(nodes.tuple(nodes.name("i"), nodes.name("j")), pairs,
                nodes.block(List.of(nodes.assign(nodes.name("x"), nodes.name("j")))));
        assertEquals("for i, j in ((i, j) for i in range(n) for j in range(i)):\n    x = j\n",
                UnparseVisitor.unparse(loop));
    }

    @Test
    public void testEmptyBlockGetsPass() {
        SyntaxTree tree = adapter.parse("test.py", "pass\n");
        NodeFactory nodes = new NodeFactory(tree, SourceSpan.UNKNOWN);
        Node loop = nodes.forLoop(nodes.name("i"), nodes.call("range", nodes.number("3")),
                nodes.block(List.of()));
        assertEquals("for i in range(3):\n    pass\n", UnparseVisitor.unparse(loop));
    }
}
