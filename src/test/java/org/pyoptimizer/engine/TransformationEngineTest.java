package org.pyoptimizer.engine;

import org.junit.jupiter.api.Test;
import org.pyoptimizer.analysis.StaticPatternAnalyzer;
import org.pyoptimizer.astnode.SourceSpan;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.model.*;
import org.pyoptimizer.parser.PythonParserAdapter;
import org.pyoptimizer.rules.RuleSet;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TransformationEngineTest {

    private final PythonParserAdapter adapter = new PythonParserAdapter();

    private SourceUnit unit(String text) {
        SyntaxTree tree = adapter.parse("test.py", text);
        return new SourceUnit(Path.of("test.py"), text, tree);
    }

    private static List<Finding> findings(SourceUnit unit) {
        return new StaticPatternAnalyzer(1000).analyze(unit.tree());
    }

    private TransformationEngine engine(EnumSet<RuleKind> enabled) {
        return new TransformationEngine(RuleSet.standard(enabled), adapter);
    }

    private TransformationEngine engine() {
        return engine(EnumSet.allOf(RuleKind.class));
    }

    private static int count(String text, String part) {
        int count = 0;
        for (int at = text.indexOf(part); at >= 0; at = text.indexOf(part, at + 1)) {
            count++;
        }
        return count;
    }

    // A nest whose outer loop flattens and whose inner loop vectorizes.
    private static final String OVERLAPPING = "for k in range(3):\n    for i in range(len(a)):\n        c[i] = a[i] + b[i]\n";

    @Test
    public void testFlattenWinsOverlapWithVectorize() {
        SourceUnit unit = unit(OVERLAPPING);
        PlanResult plan = engine().plan(unit, findings(unit));
        assertEquals(1, plan.patches().size());
        assertEquals(RuleKind.FLATTEN, plan.patches().get(0).ruleKind());
        assertEquals(1, plan.superseded().size());
        SupersededPatch superseded = plan.superseded().get(0);
        assertEquals(RuleKind.VECTORIZE, superseded.patch().ruleKind());
        assertSame(plan.patches().get(0), superseded.supersededBy());
    }

    @Test
    public void testDisabledRuleIsDeclinedAndFreesTheSpan() {
        SourceUnit unit = unit(OVERLAPPING);
        PlanResult plan = engine(EnumSet.of(RuleKind.VECTORIZE, RuleKind.CACHE)).plan(unit, findings(unit));
        assertEquals(1, plan.patches().size());
        assertEquals(RuleKind.VECTORIZE, plan.patches().get(0).ruleKind());
        assertTrue(plan.superseded().isEmpty());
        DeclinedFinding nested = plan.declined().stream()
                .filter(declined -> declined.finding().kind() == FindingKind.NESTED_LOOP)
                .findFirst()
                .orElseThrow();
        assertEquals(RuleKind.FLATTEN, nested.ruleKind());
        assertEquals("rule flatten is disabled", nested.reason());
    }

    @Test
    public void testReportOnlyFindingsAreDeclinedWithoutRule() {
        SourceUnit unit = unit("for i in range(5000):\n    x = i\n");
        PlanResult plan = engine().plan(unit, findings(unit));
        assertTrue(plan.patches().isEmpty());
        assertEquals(1, plan.declined().size());
        assertNull(plan.declined().get(0).ruleKind());
        assertEquals(FindingKind.HIGH_ITERATION_LOOP, plan.declined().get(0).finding().kind());
    }

    @Test
    public void testIndependentPatchesAreKeptInSourceOrder() {
        String text = "def f(x):\n    return x * 2\n\n\n"
                + "for i in range(3):\n    for j in range(4):\n        print(i, j)\n"
                + "a = f(1)\nb = f(1)\n";
        SourceUnit unit = unit(text);
        PlanResult plan = engine().plan(unit, findings(unit));
        assertEquals(2, plan.patches().size());
        assertEquals(RuleKind.CACHE, plan.patches().get(0).ruleKind());
        assertEquals(RuleKind.FLATTEN, plan.patches().get(1).ruleKind());
        assertEquals(1, plan.proven().size());
        assertEquals(1, plan.heuristic().size());
    }

    @Test
    public void testRenderAddsImportAfterDocstringAndFutureImports() {
        String text = "\"\"\"Doc.\"\"\"\nfrom __future__ import annotations\ntotal = 0\n"
                + "for i in range(10):\n    for j in range(m):\n        total += i * j\n";
        SourceUnit unit = unit(text);
        TransformationEngine engine = engine();
        PlanResult plan = engine.plan(unit, findings(unit));
        String rendered = engine.render(unit, plan.patches());
        assertEquals("\"\"\"Doc.\"\"\"\nfrom __future__ import annotations\nimport itertools\ntotal = 0\n"
                + "for i, j in itertools.product(range(10), range(m)):\n    total += i * j\n", rendered);
    }

    @Test
    public void testRenderDoesNotDuplicateExistingImport() {
        String text = "import itertools\nfor i in range(10):\n    for j in range(m):\n        t += j\n";
        SourceUnit unit = unit(text);
        TransformationEngine engine = engine();
        String rendered = engine.render(unit, engine.plan(unit, findings(unit)).patches());
        assertEquals(1, count(rendered, "import itertools"), rendered);
    }

    @Test
    public void testRenderWithoutPatchesIsUnparsedOriginal() {
        SourceUnit unit = unit("x = ( 1 +2)\n");
        assertEquals("x = 1 + 2\n", engine().render(unit, List.of()));
    }

    @Test
    public void testRenderLeavesUnitUntouchedAndIsRepeatable() {
        SourceUnit unit = unit(OVERLAPPING);
        TransformationEngine engine = engine();
        String before = adapter.unparse(unit.tree());
        List<Patch> patches = engine.plan(unit, findings(unit)).patches();
        String first = engine.render(unit, patches);
        String second = engine.render(unit, patches);
        assertEquals(first, second);
        assertEquals(before, adapter.unparse(unit.tree()));
        assertEquals(before, engine.render(unit, List.of()));
    }

    @Test
    public void testPatchInsideReplacedRegionIsSkipped() {
        SourceUnit unit = unit(OVERLAPPING);
        TransformationEngine engine = engine();
        PlanResult plan = engine.plan(unit, findings(unit));
        Patch flatten = plan.patches().get(0);
        Patch vectorize = plan.superseded().get(0).patch();
        String both = engine.render(unit, List.of(vectorize, flatten));
        assertEquals(engine.render(unit, List.of(flatten)), both);
        assertFalse(both.contains("numpy"), both);
    }

    @Test
    public void testStalePatchIsSkipped() {
        SourceUnit unit = unit("x = 1\n");
        Finding finding = new Finding(FindingKind.NESTED_LOOP, new Anchor(9999, new SourceSpan(1, 0, 1, 5)), Map.of());
        Patch stale = new Patch(1, RuleKind.FLATTEN, finding, finding.anchor(), List.of(), "test",
                SafetyLevel.PROVEN, EnumSet.of(RequiredImport.ITERTOOLS));
        assertEquals("x = 1\n", engine().render(unit, List.of(stale)));
    }

    @Test
    public void testRenderedScriptParsesAgain() {
        String text = "a = [1, 2, 3]\nb = [4, 5, 6]\nc = [0, 0, 0]\nfor i in range(len(a)):\n    c[i] = a[i] + b[i]\nprint(c)\n";
        SourceUnit unit = unit(text);
        TransformationEngine engine = engine();
        String rendered = engine.render(unit, engine.plan(unit, findings(unit)).patches());
        assertTrue(rendered.startsWith("import numpy as np\n"), rendered);
        assertTrue(rendered.contains("c[:] = (np.asarray(a) + np.asarray(b)).tolist()\n"), rendered);
        assertDoesNotThrow(() -> adapter.parse("rendered.py", rendered));
    }
}
