package org.pyoptimizer.rules;

import org.junit.jupiter.api.Test;
import org.pyoptimizer.analysis.StaticPatternAnalyzer;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.astvisitor.UnparseVisitor;
import org.pyoptimizer.model.*;
import org.pyoptimizer.parser.PythonParserAdapter;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FlattenRuleTest {

    private static RuleResult flatten(String text) {
        SyntaxTree tree = new PythonParserAdapter().parse("test.py", text);
        SourceUnit unit = new SourceUnit(Path.of("test.py"), text, tree);
        Finding finding = new StaticPatternAnalyzer(1000).analyze(tree).stream()
                .filter(f -> f.kind() == FindingKind.NESTED_LOOP)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No nested loop found in:\n" + text));
        return new FlattenRule().apply(finding, new RuleContext(unit));
    }

    private static Patch applied(String text) {
        RuleResult result = flatten(text);
        assertTrue(result.isApplied(), "Expected a patch, declined with: " + result.reason());
        return result.patch();
    }

    private static String replacementText(Patch patch) {
        StringBuilder sb = new StringBuilder();
        patch.replacement().forEach(node -> sb.append(UnparseVisitor.unparse(node)));
        return sb.toString();
    }

    private static void assertDeclined(String text, String reasonPart) {
        RuleResult result = flatten(text);
        assertFalse(result.isApplied(), "Expected the rule to decline:\n" + text);
        assertTrue(result.reason().contains(reasonPart), "Unexpected reason: " + result.reason());
    }

    @Test
    public void testIndependentBoundsUseProduct() {
        Patch patch = applied("total = 0\nfor i in range(10):\n    for j in range(m):\n        total += i * j\n");
        assertEquals("for i, j in itertools.product(range(10), range(m)):\n    total += i * j\n", replacementText(patch));
        assertEquals(Set.of(RequiredImport.ITERTOOLS), patch.requiredImports());
        assertEquals(SafetyLevel.PROVEN, patch.safety());
        assertEquals(RuleKind.FLATTEN, patch.ruleKind());
        assertEquals(patch.finding().anchor(), patch.anchor());
        assertEquals(2, patch.anchor().span().startLine());
    }

    @Test
    public void testDependentBoundUsesGenerator() {
        Patch patch = applied("for i in range(10):\n    for j in range(i):\n        t += j\n");
        assertEquals("for i, j in ((i, j) for i in range(10) for j in range(i)):\n    t += j\n", replacementText(patch));
        assertTrue(patch.requiredImports().isEmpty());
        assertEquals(SafetyLevel.PROVEN, patch.safety());
    }

    @Test
    public void testCallThatMayRebindBoundUsesGenerator() {
        String text = "n = 2\ncount = 0\n\n\ndef grow():\n    global n\n    n += 1\n\n\n"
                + "for i in range(3):\n    for j in range(n):\n        grow()\n        count += 1\nprint(count)\n";
        Patch patch = applied(text);
        assertEquals("for i, j in ((i, j) for i in range(3) for j in range(n)):\n    grow()\n    count += 1\n",
                replacementText(patch));
        assertTrue(patch.requiredImports().isEmpty());
        assertEquals(SafetyLevel.PROVEN, patch.safety());
    }

    @Test
    public void testMethodCallInBodyUsesGenerator() {
        Patch patch = applied("for i in range(3):\n    for j in range(m):\n        rows.append(j)\n");
        assertFalse(replacementText(patch).contains("itertools"), replacementText(patch));
    }

    @Test
    public void testBuiltinCallsKeepProduct() {
        Patch patch = applied("for i in range(3):\n    for j in range(m):\n        print(abs(i - j))\n");
        assertTrue(replacementText(patch).startsWith("for i, j in itertools.product(range(3), range(m)):"),
                replacementText(patch));
    }

    @Test
    public void testConstantBoundsKeepProductWhateverTheBodyCalls() {
        Patch patch = applied("for i in range(3):\n    for j in range(4):\n        grow()\n");
        assertTrue(replacementText(patch).startsWith("for i, j in itertools.product(range(3), range(4)):"),
                replacementText(patch));
    }

    @Test
    public void testComputedInnerBoundUsesGenerator() {
        Patch patch = applied("for k in range(3):\n    for i in range(len(a)):\n        s += a[i]\n");
        assertEquals("for k, i in ((k, i) for k in range(3) for i in range(len(a))):\n    s += a[i]\n",
                replacementText(patch));
    }

    @Test
    public void testForeignItertoolsNameFallsBackToGenerator() {
        Patch patch = applied("itertools = None\nfor i in range(4):\n    for j in range(5):\n        t += j\n");
        assertTrue(replacementText(patch).startsWith("for i, j in ((i, j) for i in range(4)"), replacementText(patch));
        assertTrue(patch.requiredImports().isEmpty());
    }

    @Test
    public void testBodyKeepsEveryStatement() {
        Patch patch = applied("for i in range(4):\n    for j in range(5):\n        if j == i:\n            continue\n        t += j\n");
        assertEquals("for i, j in itertools.product(range(4), range(5)):\n    if j == i:\n        continue\n    t += j\n",
                replacementText(patch));
    }

    @Test
    public void testBreakIsDeclined() {
        assertDeclined("for i in range(4):\n    for j in range(5):\n        if j > i:\n            break\n", "break");
    }

    @Test
    public void testImperfectNestIsDeclined() {
        assertDeclined("for i in range(4):\n    s = 0\n    for j in range(5):\n        s += j\n", "only statement");
    }

    @Test
    public void testElseClauseIsDeclined() {
        assertDeclined("for i in range(4):\n    for j in range(5):\n        t += j\n    else:\n        t = 0\n", "else");
    }

    @Test
    public void testIndexReadAfterLoopIsDeclined() {
        assertDeclined("for i in range(3):\n    for j in range(4):\n        t += j\nprint(i)\n", "read outside");
    }

    @Test
    public void testOuterIndexAssignedInBodyIsDeclined() {
        assertDeclined("for i in range(3):\n    for j in range(4):\n        i = j\n", "assigns the outer index");
    }

    @Test
    public void testLoopInClassBodyIsDeclined() {
        assertDeclined("class Grid:\n    for i in range(3):\n        for j in range(4):\n            pass\n", "class body");
    }

    @Test
    public void testOriginalTreeIsNotModified() {
        String text = "for i in range(10):\n    for j in range(i):\n        t += j\n";
        SyntaxTree tree = new PythonParserAdapter().parse("test.py", text);
        String before = UnparseVisitor.unparse(tree.root);
        SourceUnit unit = new SourceUnit(Path.of("test.py"), text, tree);
        Finding finding = new StaticPatternAnalyzer(1000).analyze(tree).get(0);
        assertTrue(new FlattenRule().apply(finding, new RuleContext(unit)).isApplied());
        assertEquals(before, UnparseVisitor.unparse(tree.root));
    }
}
