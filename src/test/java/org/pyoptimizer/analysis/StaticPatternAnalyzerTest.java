package org.pyoptimizer.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pyoptimizer.astnode.SyntaxTree;
import org.pyoptimizer.model.Evidence;
import org.pyoptimizer.model.Finding;
import org.pyoptimizer.model.FindingKind;
import org.pyoptimizer.parser.PythonParserAdapter;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class StaticPatternAnalyzerTest {

    private final PythonParserAdapter adapter = new PythonParserAdapter();

    private List<Finding> analyze(String text) {
        return new StaticPatternAnalyzer(1000).analyze(adapter.parse("test.py", text));
    }

    private static List<Finding> ofKind(List<Finding> findings, FindingKind kind) {
        return findings.stream().filter(finding -> finding.kind() == kind).collect(Collectors.toList());
    }

    private static String summary(List<Finding> findings) {
        return findings.stream().map(finding -> finding.kind() + "@" + finding.line()).collect(Collectors.joining(" "));
    }

    /**
     * Scripts under resources/scripts declare the findings they should produce in their
     * first line, e.g. {@code # expect: NESTED_LOOP@3 HIGH_ITERATION_LOOP@4}.
     */
    static Stream<Path> provideScripts() throws IOException, URISyntaxException {
        URL resourceUrl = StaticPatternAnalyzerTest.class.getClassLoader().getResource("scripts/clean.py");
        if (resourceUrl == null) {
            throw new IOException("Resource directory not found");
        }
        Path directory = Paths.get(resourceUrl.toURI()).getParent();
        return Files.list(directory).filter(path -> path.toString().endsWith(".py")).sorted();
    }

    @ParameterizedTest(name = "Findings of {0}")
    @MethodSource("provideScripts")
    public void testFindingsOfScript(Path script) throws IOException {
        String text = new String(Files.readAllBytes(script), StandardCharsets.UTF_8);
        String header = text.lines().findFirst().orElse("");
        assertTrue(header.startsWith("# expect:"), "Missing expectation header in " + script);
        String expected = header.substring("# expect:".length()).trim();
        SyntaxTree tree = adapter.parse(script.getFileName().toString(), text);
        assertEquals(expected, summary(new StaticPatternAnalyzer(1000).analyze(tree)));
    }

    @Test
    public void testConstantBoundAboveThreshold() {
        List<Finding> findings = analyze("for i in range(10, 5000, 2):\n    x = i\n");
        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(FindingKind.HIGH_ITERATION_LOOP, finding.kind());
        assertEquals(Evidence.HIGH, finding.get(Evidence.CONFIDENCE));
        assertEquals(BigInteger.valueOf(2495), finding.get(Evidence.ESTIMATED_ITERATIONS));
        assertEquals("i", finding.get(Evidence.LOOP_VARIABLE));
    }

    @Test
    public void testConstantBoundAtThresholdIsNotReported() {
        assertTrue(analyze("for i in range(1000):\n    x = i\n").isEmpty());
        assertTrue(analyze("for i in range(5000, 0):\n    x = i\n").isEmpty(), "An empty range never runs");
    }

    @Test
    public void testUnknownBoundHasLowConfidence() {
        List<Finding> findings = analyze("for i in range(n):\n    x = i\n");
        assertEquals(1, findings.size());
        assertEquals(Evidence.LOW, findings.get(0).get(Evidence.CONFIDENCE));
        assertNull(findings.get(0).get(Evidence.ESTIMATED_ITERATIONS));
    }

    @Test
    public void testLoopsOverOtherIterablesAreIgnored() {
        assertTrue(analyze("for x in items:\n    for y in x:\n        print(y)\n").isEmpty());
        assertTrue(analyze("for i, v in enumerate(range(5000)):\n    pass\n").isEmpty());
    }

    @Test
    public void testNestedLoopEvidence() {
        List<Finding> nested = ofKind(analyze("for i in range(10):\n    for j in range(i):\n        t += j\n"),
                FindingKind.NESTED_LOOP);
        assertEquals(1, nested.size());
        Finding finding = nested.get(0);
        assertEquals("i", finding.get(Evidence.OUTER_VARIABLE));
        assertEquals("j", finding.get(Evidence.INNER_VARIABLE));
        assertEquals(Boolean.TRUE, finding.get(Evidence.PERFECTLY_NESTED));
        assertEquals(Boolean.TRUE, finding.get(Evidence.INNER_DEPENDS_ON_OUTER));
    }

    @Test
    public void testNestedLoopWithStatementsAroundInnerLoop() {
        List<Finding> nested = ofKind(analyze("for i in range(10):\n    s = 0\n    for j in range(5):\n        s += j\n    print(s)\n"),
                FindingKind.NESTED_LOOP);
        assertEquals(1, nested.size());
        assertEquals(Boolean.FALSE, nested.get(0).get(Evidence.PERFECTLY_NESTED));
        assertEquals(Boolean.FALSE, nested.get(0).get(Evidence.INNER_DEPENDS_ON_OUTER));
    }

    @Test
    public void testInnerBoundChangedByOuterBodyIsNotNested() {
        String text = "for i in range(10):\n    n = i * 2\n    for j in range(n):\n        pass\n";
        assertTrue(ofKind(analyze(text), FindingKind.NESTED_LOOP).isEmpty());
    }

    @Test
    public void testVectorizableEvidence() {
        String text = "for i in range(len(a)):\n    c[i] = a[i] + b[i] * k\n    print(i)\n";
        List<Finding> vectorizable = ofKind(analyze(text), FindingKind.VECTORIZABLE_LOOP);
        assertEquals(1, vectorizable.size());
        Finding finding = vectorizable.get(0);
        assertEquals(List.of("c", "a", "b"), finding.get(Evidence.CONTAINERS));
        assertEquals(1, finding.get(Evidence.DIMENSIONS));
        assertEquals(1, finding.get(Evidence.VECTORIZABLE_STATEMENTS));
        assertEquals(2, finding.get(Evidence.TOTAL_STATEMENTS));
    }

    @Test
    public void testShiftedIndexIsNotElementwise() {
        String text = "for i in range(len(a)):\n    c[i] = a[i + 1] - a[i]\n";
        assertTrue(ofKind(analyze(text), FindingKind.VECTORIZABLE_LOOP).isEmpty());
    }

    @Test
    public void testDivisionByLiteralZeroIsNotElementwise() {
        String text = "for i in range(len(a)):\n    c[i] = a[i] / 0\n";
        assertTrue(ofKind(analyze(text), FindingKind.VECTORIZABLE_LOOP).isEmpty());
    }

    @Test
    public void testReassignedLengthSourceIsNotElementwise() {
        String text = "for i in range(len(a)):\n    c[i] = a[i]\n    a = [0]\n";
        assertTrue(ofKind(analyze(text), FindingKind.VECTORIZABLE_LOOP).isEmpty());
    }

    @Test
    public void testRepeatedCallEvidence() {
        String text = "def f(x):\n    return x * x\n\na = f(3)\nb = f(3) + f(4)\n";
        List<Finding> repeated = ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION);
        assertEquals(1, repeated.size());
        Finding finding = repeated.get(0);
        assertEquals("f", finding.get(Evidence.CALLEE));
        assertEquals("f(3)", finding.get(Evidence.SIGNATURE));
        assertEquals(List.of(4, 5), finding.get(Evidence.CALL_SITE_LINES));
        assertEquals(4, finding.line());
    }

    @Test
    public void testRebindingArgumentSeparatesCalls() {
        String text = "a = f(x)\nx = 2\nb = f(x)\n";
        assertTrue(ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION).isEmpty());
    }

    @Test
    public void testMutatingArgumentSeparatesCalls() {
        String text = "a = total(items)\nitems.append(4)\nb = total(items)\n";
        assertTrue(ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION).isEmpty());
    }

    @Test
    public void testSideEffectingBuiltinsAreNotRepeatedComputations() {
        String text = "print(1)\nprint(1)\nopen('a')\nopen('a')\n";
        assertTrue(analyze(text).isEmpty());
    }

    @Test
    public void testRepeatedCallsInsideFunctionBody() {
        String text = "import math\n\n\ndef g(v):\n    return math.sqrt(v) + math.sqrt(v)\n";
        List<Finding> repeated = ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION);
        assertEquals(1, repeated.size());
        assertEquals("math.sqrt", repeated.get(0).get(Evidence.CALLEE));
        assertEquals(List.of(5, 5), repeated.get(0).get(Evidence.CALL_SITE_LINES));
    }

    @Test
    public void testModuleFunctionCallsAcrossStatements() {
        String text = "import math\n\nx = math.sqrt(2)\ny = math.sqrt(2)\n";
        List<Finding> repeated = ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION);
        assertEquals(1, repeated.size(), "Calling into a module must not hide the next call");
        assertEquals("math.sqrt", repeated.get(0).get(Evidence.CALLEE));
        assertEquals(List.of(3, 4), repeated.get(0).get(Evidence.CALL_SITE_LINES));
    }

    @Test
    public void testRebindingModuleSeparatesCalls() {
        String text = "import math\n\nx = math.sqrt(2)\nmath = other\ny = math.sqrt(2)\n";
        assertTrue(ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION).isEmpty());
    }

    @Test
    public void testRepeatedCallWithoutArguments() {
        String text = "def tick():\n    return 1\n\n\na = tick()\nb = tick()\n";
        List<Finding> repeated = ofKind(analyze(text), FindingKind.REPEATED_COMPUTATION);
        assertEquals(1, repeated.size());
        assertEquals("tick()", repeated.get(0).get(Evidence.SIGNATURE));
        assertEquals(List.of(5, 6), repeated.get(0).get(Evidence.CALL_SITE_LINES));
    }

    @Test
    public void testAnalysisIsDeterministicAndReadOnly() {
        String text = "for i in range(n):\n    for j in range(m):\n        c[i] = f(2)\nx = f(2)\n";
        SyntaxTree tree = adapter.parse("test.py", text);
        String before = adapter.unparse(tree);
        StaticPatternAnalyzer analyzer = new StaticPatternAnalyzer(1000);
        List<Finding> first = analyzer.analyze(tree);
        List<Finding> second = analyzer.analyze(tree);
        assertEquals(first, second);
        assertEquals(before, adapter.unparse(tree));
        for (int i = 1; i < first.size(); i++) {
            assertTrue(first.get(i - 1).anchor().span().compareTo(first.get(i).anchor().span()) <= 0,
                    "Findings should be in source order: " + first);
        }
    }
}
