package org.pyoptimizer.io;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pyoptimizer.OptimizerOptions;
import org.pyoptimizer.model.Outcome;
import org.pyoptimizer.pipeline.PipelineController;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonReportWriterTest {

    @TempDir
    Path dir;

    private Outcome analyze(String name, String text) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, text);
        return PipelineController.create(new OptimizerOptions(), null).process(path);
    }

    private static JSONObject write(Outcome... outcomes) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonReportWriter report = new JsonReportWriter(out)) {
            for (Outcome outcome : outcomes) {
                report.accept(outcome);
            }
        }
        return JSON.parseObject(out.toString());
    }

    @Test
    public void testSummaryCountsStatuses() throws IOException {
        JSONObject report = write(
                analyze("ok.py", "x = 1\n"),
                analyze("bad.py", "def (:\n"),
                Outcome.incomplete(dir.resolve("slow.py"), null, List.of(), "timeout"));

        assertEquals("pyoptimizer", report.getString("tool"));
        JSONObject summary = report.getJSONObject("summary");
        assertEquals(3, summary.getIntValue("files"));
        assertEquals(1, summary.getIntValue("completed"));
        assertEquals(1, summary.getIntValue("failed"));
        assertEquals(1, summary.getIntValue("incomplete"));
        assertEquals(0, summary.getIntValue("acceptedPatches"));

        JSONArray files = report.getJSONArray("files");
        assertEquals("COMPLETED", files.getJSONObject(0).getString("status"));
        assertFalse(files.getJSONObject(0).containsKey("failureMessage"));
        assertEquals("FAILED", files.getJSONObject(1).getString("status"));
        assertNotNull(files.getJSONObject(1).getString("failureMessage"));
        assertEquals("timeout", files.getJSONObject(2).getString("failureMessage"));
    }

    @Test
    public void testFindingsAndPlannedPatches() throws IOException {
        Outcome outcome = analyze("nested.py", "for k in range(3):\n    for i in range(len(a)):\n        c[i] = a[i] + b[i]\n");
        JSONObject file = write(outcome).getJSONArray("files").getJSONObject(0);

        assertFalse(file.getBooleanValue("optimized"));
        JSONArray findings = file.getJSONArray("findings");
        assertFalse(findings.isEmpty());
        JSONObject nested = findings.getJSONObject(0);
        assertEquals("NESTED_LOOP", nested.getString("kind"));
        assertEquals(1, nested.getIntValue("line"));
        assertEquals("k", nested.getJSONObject("evidence").getString("outerVariable"));

        JSONArray candidates = file.getJSONArray("candidatePatches");
        assertEquals(1, candidates.size());
        assertEquals("flatten", candidates.getJSONObject(0).getString("rule"));
        assertEquals("PROVEN", candidates.getJSONObject(0).getString("safety"));

        JSONArray superseded = file.getJSONArray("supersededPatches");
        assertEquals(1, superseded.size());
        assertEquals("vectorize", superseded.getJSONObject(0).getString("rule"));
        assertNotNull(superseded.getJSONObject(0).getString("supersededBy"));

        assertTrue(file.getJSONArray("appliedPatches").isEmpty());
        assertTrue(file.getJSONArray("validation").isEmpty());
    }

    @Test
    public void testEmptyReport() throws IOException {
        JSONObject report = write();
        assertEquals(0, report.getJSONObject("summary").getIntValue("files"));
        assertTrue(report.getJSONArray("files").isEmpty());
    }
}
