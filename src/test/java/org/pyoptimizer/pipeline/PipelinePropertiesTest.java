package org.pyoptimizer.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pyoptimizer.OptimizerOptions;
import org.pyoptimizer.model.FindingKind;
import org.pyoptimizer.model.Outcome;
import org.pyoptimizer.model.RuleKind;
import org.pyoptimizer.model.ValidationResult;
import org.pyoptimizer.model.Verdict;
import org.pyoptimizer.validation.ExecutionReport;
import org.pyoptimizer.validation.PythonProcessRunner;
import org.pyoptimizer.validation.ScriptRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * End-to-end checks that run real scripts through python3. Timings are replaced so that
 * candidates always look faster and the verdict depends on the observed output alone.
 */
public class PipelinePropertiesTest {

    @TempDir
    Path dir;

    private OptimizerOptions options;

    @BeforeEach
    void setUp() {
        options = new OptimizerOptions();
        options.repeats = 1;
        options.workers = 1;
    }

    private static boolean pythonHas(String modules) {
        try {
            Process process = new ProcessBuilder("python3", "-c", "import " + modules).redirectErrorStream(true).start();
            return process.waitFor(20, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ScriptRunner candidatesLookFaster(ScriptRunner real) {
        return (scriptText, sourceDirectory, label, timeout) -> {
            ExecutionReport report = real.run(scriptText, sourceDirectory, label, timeout);
            if (!report.succeeded()) {
                return report;
            }
            Duration runtime = Duration.ofMillis(label.endsWith("baseline") ? 100 : 10);
            return ExecutionReport.success(report.stdout(), report.stderr(), runtime, report.peakMemoryKb());
        };
    }

    private Outcome optimize(String name, String text, ScriptRunner runner) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, text);
        return PipelineController.create(options, runner).process(path);
    }

    private static ValidationResult onlyResult(Outcome outcome) {
        assertEquals(1, outcome.validationResults().size(), outcome.validationResults().toString());
        return outcome.validationResults().get(0);
    }

    @Test
    public void testVectorizedAdditionMatchesOriginal() throws IOException {
        assumeTrue(pythonHas("resource, numpy"), "python3 with numpy not available");
        String text = "arr = [1, 2, 3, 4, 5]\nc = 10\nfor i in range(len(arr)):\n    arr[i] += c\nprint(arr)\n";
        ScriptRunner real = new PythonProcessRunner("python3", 0);
        Outcome outcome = optimize("vector.py", text, candidatesLookFaster(real));

        assertEquals(1, outcome.findings().stream().filter(f -> f.kind() == FindingKind.VECTORIZABLE_LOOP).count());
        ValidationResult result = onlyResult(outcome);
        assertEquals(RuleKind.VECTORIZE, result.patch().ruleKind());
        assertEquals(Verdict.ACCEPTED, result.verdict(), String.valueOf(result.detail()));
        assertEquals(Boolean.TRUE, result.outputsEqual());

        ExecutionReport optimized = real.run(outcome.transformedText(), "optimized", Duration.ofSeconds(60));
        assertEquals("[11, 12, 13, 14, 15]\n", optimized.stdout());
    }

    @Test
    public void testFlattenedMatrixSumIsUnchanged() throws IOException {
        assumeTrue(pythonHas("resource"), "python3 not available");
        String text = "m = [[r * 5 + k for k in range(5)] for r in range(5)]\ntotal = 0\n"
                + "for i in range(5):\n    for j in range(5):\n        total += m[i][j]\nprint(total)\n";
        ScriptRunner real = new PythonProcessRunner("python3", 0);
        Outcome outcome = optimize("matrix.py", text, candidatesLookFaster(real));

        assertEquals(Verdict.ACCEPTED, onlyResult(outcome).verdict());
        assertTrue(outcome.transformedText().contains("itertools.product"), outcome.transformedText());
        assertEquals("300\n", real.run(text, "original", Duration.ofSeconds(60)).stdout());
        assertEquals("300\n", real.run(outcome.transformedText(), "optimized", Duration.ofSeconds(60)).stdout());
    }

    @Test
    public void testFlattenKeepsBoundRebuiltEachOuterIteration() throws IOException {
        assumeTrue(pythonHas("resource"), "python3 not available");
        String text = "n = 2\ncount = 0\n\n\ndef grow():\n    global n\n    n += 1\n\n\n"
                + "for i in range(3):\n    for j in range(n):\n        grow()\n        count += 1\nprint(count)\n";
        ScriptRunner real = new PythonProcessRunner("python3", 0);
        options.enabledRules = EnumSet.of(RuleKind.FLATTEN);
        Outcome outcome = optimize("grow.py", text, candidatesLookFaster(real));

        assertEquals(Verdict.ACCEPTED, onlyResult(outcome).verdict());
        assertEquals("14\n", real.run(text, "original", Duration.ofSeconds(60)).stdout());
        assertEquals("14\n", real.run(outcome.transformedText(), "optimized", Duration.ofSeconds(60)).stdout());
    }

    @Test
    public void testScriptImportingSiblingModuleIsValidated() throws IOException {
        assumeTrue(pythonHas("resource"), "python3 not available");
        Files.writeString(dir.resolve("shapes.py"), "def area(w, h):\n    return w * h\n");
        Files.writeString(dir.resolve("sizes.txt"), "3\n");
        String text = "from shapes import area\n\nwith open('sizes.txt') as f:\n    n = int(f.read())\n"
                + "for i in range(4):\n    for j in range(5):\n        print(area(i, j) + n)\n";
        Outcome outcome = optimize("uses_sibling.py", text, candidatesLookFaster(new PythonProcessRunner("python3", 0)));

        ValidationResult result = onlyResult(outcome);
        assertEquals(Verdict.ACCEPTED, result.verdict(), String.valueOf(result.detail()));
        assertTrue(outcome.hasTransformedText());
    }

    @Test
    public void testCachingImpureFunctionIsRejected() throws IOException {
        assumeTrue(pythonHas("resource"), "python3 not available");
        String text = "seen = []\n\n\ndef f(x):\n    seen.append(x)\n    return x\n\n\nf(1)\nf(1)\nprint(len(seen))\n";
        Outcome outcome = optimize("impure.py", text, candidatesLookFaster(new PythonProcessRunner("python3", 0)));

        ValidationResult result = onlyResult(outcome);
        assertEquals(RuleKind.CACHE, result.patch().ruleKind());
        assertEquals(Verdict.REJECTED_UNSAFE, result.verdict());
        assertFalse(outcome.hasTransformedText());
    }

    @Test
    public void testOptimizedOutputHasNothingLeftToOptimize() throws IOException {
        String text = "def sq(x):\n    return x * x\n\n\n"
                + "for i in range(10):\n    for j in range(20):\n        print(i, j)\n"
                + "a = sq(4)\nb = sq(4)\n";
        ScriptRunner equalAndFaster = (scriptText, sourceDirectory, label, timeout) ->
                ExecutionReport.success("same", "", Duration.ofMillis(label.endsWith("baseline") ? 100 : 10), 1000);
        Outcome first = optimize("twice.py", text, equalAndFaster);
        assertEquals(2, first.appliedPatches().size());

        Outcome second = optimize("twice_again.py", first.transformedText(), equalAndFaster);
        assertEquals(Outcome.Status.COMPLETED, second.status());
        assertTrue(second.appliedPatches().isEmpty(), second.transformedText());
        assertTrue(second.candidatePatches().isEmpty());
    }
}
