package org.pyoptimizer.rules;

import org.junit.jupiter.api.Test;
import org.pyoptimizer.analysis.StaticPatternAnalyzer;
import org.pyoptimizer.astnode.FunctionDefNode;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.astvisitor.UnparseVisitor;
import org.pyoptimizer.model.*;
import org.pyoptimizer.parser.PythonParserAdapter;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CacheRuleTest {

    private static RuleResult cache(String text) {
        SyntaxTree tree = new PythonParserAdapter().parse("test.py", text);
        SourceUnit unit = new SourceUnit(Path.of("test.py"), text, tree);
        Finding finding = new StaticPatternAnalyzer(1000).analyze(tree).stream()
                .filter(f -> f.kind() == FindingKind.REPEATED_COMPUTATION)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No repeated call found in:\n" + text));
        return new CacheRule().apply(finding, new RuleContext(unit));
    }

    private static void assertDeclined(String text, String reasonPart) {
        RuleResult result = cache(text);
        assertFalse(result.isApplied(), "Expected the rule to decline:\n" + text);
        assertTrue(result.reason().contains(reasonPart), "Unexpected reason: " + result.reason());
    }

    @Test
    public void testFunctionGetsLruCache() {
        String text = "def f(x):\n    return x * x\n\n\nprint(f(3))\ny = f(3)\n";
        RuleResult result = cache(text);
        assertTrue(result.isApplied(), result.reason());
        Patch patch = result.patch();
        assertEquals(1, patch.replacement().size());
        FunctionDefNode cached = assertInstanceOf(FunctionDefNode.class, patch.replacement().get(0));
        assertEquals("@functools.lru_cache(maxsize=None)\ndef f(x):\n    return x * x\n", UnparseVisitor.unparse(cached));
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
        assertEquals(Set.of(RequiredImport.FUNCTOOLS), patch.requiredImports());
        assertEquals(RuleKind.CACHE, patch.ruleKind());
        assertTrue(patch.rationale().contains("[5, 6]"), patch.rationale());
    }

    @Test
    public void testAnchorIsFunctionHeader() {
        String text = "def f(x):\n    return x * x\n\n\na = f(3)\nb = f(3)\n";
        Patch patch = cache(text).patch();
        assertNotNull(patch);
        assertEquals(1, patch.anchor().span().startLine());
        assertEquals(1, patch.anchor().span().endLine());
        assertEquals(patch.replacement().get(0).getId(), patch.anchor().nodeId());
    }

    @Test
    public void testExistingDecoratorsAreKept() {
        String text = "@trace\ndef f(x):\n    return x + 1\n\n\na = f(1)\nb = f(1)\n";
        Patch patch = cache(text).patch();
        assertNotNull(patch);
        assertEquals("@functools.lru_cache(maxsize=None)\n@trace\ndef f(x):\n    return x + 1\n",
                UnparseVisitor.unparse(patch.replacement().get(0)));
    }

    @Test
    public void testAlreadyCachedIsDeclined() {
        assertDeclined("@functools.lru_cache\ndef f(x):\n    return x\n\n\na = f(1)\nb = f(1)\n", "already cached");
        assertDeclined("@cache\ndef f(x):\n    return x\n\n\na = f(1)\nb = f(1)\n", "already cached");
    }

    @Test
    public void testGeneratorIsDeclined() {
        assertDeclined("def f(x):\n    yield x\n\n\na = f(1)\nb = f(1)\n", "generator");
    }

    @Test
    public void testCoroutineIsDeclined() {
        assertDeclined("async def f(x):\n    return x\n\n\na = f(1)\nb = f(1)\n", "coroutine");
    }

    @Test
    public void testUndefinedFunctionIsDeclined() {
        assertDeclined("a = g(1)\nb = g(1)\n", "not a module-level function");
    }

    @Test
    public void testNestedFunctionIsDeclined() {
        assertDeclined("def outer():\n    def g(v):\n        return v\n    return g(2) + g(2)\n", "g is");
    }

    @Test
    public void testModuleFunctionIsDeclined() {
        assertDeclined("import math\n\nx = math.sqrt(2)\ny = math.sqrt(2)\n", "not a function defined in this script");
    }

    @Test
    public void testReboundNameIsDeclined() {
        assertDeclined("def f(x):\n    return x\n\n\nf = print\na = f(1)\nb = f(1)\n", "rebound");
    }

    @Test
    public void testForeignFunctoolsNameIsDeclined() {
        assertDeclined("functools = None\n\n\ndef f(x):\n    return x\n\n\na = f(1)\nb = f(1)\n", "functools");
    }
}
