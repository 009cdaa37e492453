package org.pyoptimizer.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pyoptimizer.OptimizerOptions;
import org.pyoptimizer.exception.ValidationException;
import org.pyoptimizer.model.FindingKind;
import org.pyoptimizer.model.Outcome;
import org.pyoptimizer.model.RuleKind;
import org.pyoptimizer.model.Verdict;
import org.pyoptimizer.validation.ExecutionReport;
import org.pyoptimizer.validation.ScriptRunner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineControllerTest {

    private static final String NESTED = "for i in range(3):\n    for j in range(4):\n        print(i, j)\n";

    @TempDir
    Path dir;

    private OptimizerOptions options;

    @BeforeEach
    void setUp() {
        options = new OptimizerOptions();
        options.repeats = 1;
        options.workers = 2;
    }

    private Path script(String name, String text) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, text.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    private static ScriptRunner fasterWhenFlattened() {
        return (scriptText, sourceDirectory, label, timeout) -> ExecutionReport.success("out", "",
                Duration.ofMillis(scriptText.contains("itertools") ? 40 : 100), 1000);
    }

    @Test
    public void testCompletedFileCarriesOptimizedText() throws IOException {
        Path path = script("nested.py", NESTED);
        Outcome outcome = PipelineController.create(options, fasterWhenFlattened()).process(path);

        assertEquals(Outcome.Status.COMPLETED, outcome.status());
        assertNull(outcome.failureMessage());
        assertEquals(FindingKind.NESTED_LOOP, outcome.findings().get(0).kind());
        assertEquals(1, outcome.candidatePatches().size());
        assertEquals(1, outcome.appliedPatches().size());
        assertEquals(RuleKind.FLATTEN, outcome.appliedPatches().get(0).ruleKind());
        assertEquals(Verdict.ACCEPTED, outcome.validationResults().get(0).verdict());
        assertTrue(outcome.transformedText().contains("itertools.product(range(3), range(4))"), outcome.transformedText());
    }

    @Test
    public void testAnalyzeOnlyListsCandidatesWithoutRunning() throws IOException {
        Path path = script("nested.py", NESTED);
        Outcome outcome = PipelineController.create(options, null).process(path);

        assertEquals(Outcome.Status.COMPLETED, outcome.status());
        assertEquals(1, outcome.candidatePatches().size());
        assertTrue(outcome.appliedPatches().isEmpty());
        assertTrue(outcome.validationResults().isEmpty());
        assertFalse(outcome.hasTransformedText());
    }

    @Test
    public void testSyntaxErrorFailsOnlyThatFile() throws IOException {
        Path broken = script("broken.py", "def f(:\n    pass\n");
        Path good = script("good.py", NESTED);
        List<Outcome> outcomes = PipelineController.create(options, null).processAll(List.of(broken, good));

        assertEquals(Outcome.Status.FAILED, outcomes.get(0).status());
        assertNotNull(outcomes.get(0).failureMessage());
        assertNull(outcomes.get(0).sourceUnit());
        assertEquals(Outcome.Status.COMPLETED, outcomes.get(1).status());
    }

    @Test
    public void testMissingFileFails() {
        Outcome outcome = PipelineController.create(options, null).process(dir.resolve("absent.py"));
        assertEquals(Outcome.Status.FAILED, outcome.status());
        assertTrue(outcome.failureMessage().startsWith("cannot read file"), outcome.failureMessage());
    }

    @Test
    public void testRunnerThatCannotStartLeavesFileIncomplete() throws IOException {
        Path path = script("nested.py", NESTED);
        ScriptRunner broken = (scriptText, sourceDirectory, label, timeout) -> {
            throw new ValidationException("cannot start python9", new IOException("not found"));
        };
        Outcome outcome = PipelineController.create(options, broken).process(path);

        assertEquals(Outcome.Status.INCOMPLETE, outcome.status());
        assertEquals("cannot start python9", outcome.failureMessage());
        assertFalse(outcome.findings().isEmpty(), "Findings survive a failed validation");
        assertFalse(outcome.hasTransformedText());
    }

    @Test
    public void testCancelledRunLeavesFileIncomplete() throws IOException {
        Path path = script("nested.py", NESTED);
        ScriptRunner cancelled = (scriptText, sourceDirectory, label, timeout) -> {
            throw new CancellationException("interrupted");
        };
        Outcome outcome = PipelineController.create(options, cancelled).process(path);
        assertEquals(Outcome.Status.INCOMPLETE, outcome.status());
        assertTrue(outcome.failureMessage().contains("cancelled"), outcome.failureMessage());
    }

    @Test
    public void testPerFileTimeoutInterruptsValidation() throws IOException {
        options.fileTimeout = Duration.ofMillis(200);
        Path slow = script("slow.py", NESTED);
        Path clean = script("clean.py", "x = 1\n");
        ScriptRunner sleeper = (scriptText, sourceDirectory, label, timeout) -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("interrupted");
            }
            return ExecutionReport.success("out", "", Duration.ofMillis(100), 1000);
        };
        long start = System.nanoTime();
        List<Outcome> outcomes = PipelineController.create(options, sleeper).processAll(List.of(slow, clean));

        assertTrue(System.nanoTime() - start < Duration.ofSeconds(20).toNanos(), "Watchdog did not interrupt the run");
        assertEquals(Outcome.Status.INCOMPLETE, outcomes.get(0).status());
        assertTrue(outcomes.get(0).failureMessage().contains("per-file timeout"), outcomes.get(0).failureMessage());
        assertEquals(Outcome.Status.COMPLETED, outcomes.get(1).status());
    }

    @Test
    public void testOutcomesFollowInputOrder() throws IOException {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            paths.add(script("s" + i + ".py", "x = " + i + "\n"));
        }
        options.workers = 4;
        List<Outcome> outcomes = PipelineController.create(options, null).processAll(paths);
        assertEquals(paths.size(), outcomes.size());
        for (int i = 0; i < paths.size(); i++) {
            assertEquals(paths.get(i), outcomes.get(i).path());
        }
    }

    @Test
    public void testEmptyBatch() {
        assertTrue(PipelineController.create(options, null).processAll(List.of()).isEmpty());
    }
}
