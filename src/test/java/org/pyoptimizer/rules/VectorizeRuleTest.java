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

public class VectorizeRuleTest {

    private static RuleResult vectorize(String text) {
        SyntaxTree tree = new PythonParserAdapter().parse("test.py", text);
        SourceUnit unit = new SourceUnit(Path.of("test.py"), text, tree);
        Finding finding = new StaticPatternAnalyzer(1000).analyze(tree).stream()
                .filter(f -> f.kind() == FindingKind.VECTORIZABLE_LOOP)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No vectorizable loop found in:\n" + text));
        return new VectorizeRule().apply(finding, new RuleContext(unit));
    }

    private static Patch applied(String text) {
        RuleResult result = vectorize(text);
        assertTrue(result.isApplied(), "Expected a patch, declined with: " + result.reason());
        return result.patch();
    }

    private static String replacementText(Patch patch) {
        StringBuilder sb = new StringBuilder();
        patch.replacement().forEach(node -> sb.append(UnparseVisitor.unparse(node)));
        return sb.toString();
    }

    @Test
    public void testSmallIntegerListsAreProven() {
        Patch patch = applied("a = [1, 2, 3]\nb = [4, 5, 6]\nc = [0, 0, 0]\nfor i in range(len(a)):\n    c[i] = a[i] + b[i]\n");
        assertEquals("c[:] = (np.asarray(a) + np.asarray(b)).tolist()\n", replacementText(patch));
        assertEquals(SafetyLevel.PROVEN, patch.safety());
        assertEquals(Set.of(RequiredImport.NUMPY), patch.requiredImports());
        assertEquals(4, patch.anchor().span().startLine());
    }

    @Test
    public void testUnknownListsAreSlicedAndHeuristic() {
        Patch patch = applied("for i in range(len(a)):\n    c[i] = a[i] * 2\n");
        assertEquals("c[:len(a)] = (np.asarray(a) * 2).tolist()\n", replacementText(patch));
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
    }

    @Test
    public void testAugmentedAssignmentReadsTarget() {
        Patch patch = applied("for i in range(len(c)):\n    c[i] += a[i]\n");
        assertEquals("c[:] = (np.asarray(c) + np.asarray(a[:len(c)])).tolist()\n", replacementText(patch));
    }

    @Test
    public void testConstantValueFillsArray() {
        Patch patch = applied("for i in range(len(c)):\n    c[i] = 0\n");
        assertEquals("c[:] = np.full(len(c), 0).tolist()\n", replacementText(patch));
    }

    @Test
    public void testIndexBecomesArange() {
        Patch patch = applied("for i in range(len(c)):\n    c[i] = i * 2\n");
        assertEquals("c[:] = (np.arange(len(c)) * 2).tolist()\n", replacementText(patch));
    }

    @Test
    public void testTwoLevelLoop() {
        Patch patch = applied("for i in range(len(m)):\n    for j in range(len(m[i])):\n        out[i][j] = m[i][j] - 1\n");
        assertEquals("out[:] = (np.asarray(m) - 1).tolist()\n", replacementText(patch));
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
    }

    @Test
    public void testTwoMultiplicationsAreHeuristic() {
        Patch patch = applied("a = [1, 2]\nb = [3, 4]\nc = [0, 0]\nfor i in range(len(a)):\n    c[i] = a[i] * b[i] * 2\n");
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
    }

    @Test
    public void testLargeLiteralsAreHeuristic() {
        Patch patch = applied("a = [1, 20000000000]\nc = [0, 0]\nfor i in range(len(a)):\n    c[i] = a[i] + 1\n");
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
    }

    @Test
    public void testCallBetweenDefinitionAndLoopForgetsLiterals() {
        Patch patch = applied("a = [1, 2]\nc = [0, 0]\nshuffle(a)\nfor i in range(len(a)):\n    c[i] = a[i] + 1\n");
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
        assertEquals("c[:len(a)] = (np.asarray(a) + 1).tolist()\n", replacementText(patch));
    }

    @Test
    public void testPartialLoopHoistsElementwiseStatements() {
        Patch patch = applied("for i in range(len(a)):\n    c[i] = a[i] + 1\n    print(c[i])\n");
        assertEquals("c[:len(a)] = (np.asarray(a) + 1).tolist()\nfor i in range(len(a)):\n    print(c[i])\n",
                replacementText(patch));
        assertEquals(SafetyLevel.HEURISTIC, patch.safety());
        assertEquals(2, patch.replacement().size());
    }

    @Test
    public void testPartialLoopWithUnknownCallIsDeclined() {
        RuleResult result = vectorize("for i in range(len(a)):\n    c[i] = a[i] + 1\n    log(c[i])\n");
        assertFalse(result.isApplied());
        assertTrue(result.reason().contains("call log"), result.reason());
    }

    @Test
    public void testPartialLoopReadingBeforeLaterUpdateIsDeclined() {
        RuleResult result = vectorize("for i in range(len(a)):\n    print(c[i])\n    c[i] = a[i] + 1\n");
        assertFalse(result.isApplied());
        assertTrue(result.reason().contains("read before"), result.reason());
    }

    @Test
    public void testPartialLoopWithBreakIsDeclined() {
        RuleResult result = vectorize("for i in range(len(a)):\n    c[i] = a[i] + 1\n    if c[i] > 3:\n        break\n");
        assertFalse(result.isApplied());
        assertTrue(result.reason().contains("early"), result.reason());
    }

    @Test
    public void testForeignNpNameIsDeclined() {
        RuleResult result = vectorize("np = 3\nfor i in range(len(a)):\n    c[i] = a[i] + np\n");
        assertFalse(result.isApplied());
        assertTrue(result.reason().contains("np"), result.reason());
    }

    @Test
    public void testExistingNumpyImportIsAccepted() {
        Patch patch = applied("import numpy as np\nfor i in range(len(a)):\n    c[i] = a[i] + 1\n");
        assertEquals(Set.of(RequiredImport.NUMPY), patch.requiredImports());
    }

    @Test
    public void testIndexReadAfterLoopIsDeclined() {
        RuleResult result = vectorize("for i in range(len(a)):\n    c[i] = a[i] + 1\nlast = i\n");
        assertFalse(result.isApplied());
        assertTrue(result.reason().contains("read outside"), result.reason());
    }
}
