package org.pyoptimizer.io;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.pyoptimizer.Configuration;
import org.pyoptimizer.model.*;

import java.io.IOException;
import java.io.Writer;
import java.time.Duration;

/**
 * Collects outcomes and writes them as one JSON document when closed. Closing the
 * report closes the underlying writer.
 */
public class JsonReportWriter implements ReportSink {
    private final Writer out;
    private final JSONArray files = new JSONArray();
    private int completed;
    private int failed;
    private int incomplete;
    private int acceptedPatches;

    public JsonReportWriter(Writer out) {
        this.out = out;
    }

    @Override
    public void accept(Outcome outcome) {
        switch (outcome.status()) {
            case COMPLETED -> completed++;
            case FAILED -> failed++;
            case INCOMPLETE -> incomplete++;
        }
        acceptedPatches += outcome.appliedPatches().size();
        files.add(toJson(outcome));
    }

    @Override
    public void close() throws IOException {
        JSONObject summary = new JSONObject();
        summary.put("files", files.size());
        summary.put("completed", completed);
        summary.put("failed", failed);
        summary.put("incomplete", incomplete);
        summary.put("acceptedPatches", acceptedPatches);

        JSONObject report = new JSONObject();
        report.put("tool", "pyoptimizer");
        report.put("version", Configuration.version);
        report.put("summary", summary);
        report.put("files", files);
        out.write(JSON.toJSONString(report, JSONWriter.Feature.PrettyFormat));
        out.write(System.lineSeparator());
        out.close();
    }

    static JSONObject toJson(Outcome outcome) {
        JSONObject file = new JSONObject();
        file.put("path", outcome.path().toString());
        file.put("status", outcome.status().name());
        if (outcome.failureMessage() != null) {
            file.put("failureMessage", outcome.failureMessage());
        }
        file.put("optimized", outcome.hasTransformedText());

        JSONArray findings = new JSONArray();
        for (Finding finding : outcome.findings()) {
            JSONObject item = new JSONObject();
            item.put("kind", finding.kind().name());
            item.put("line", finding.line());
            item.put("evidence", new JSONObject(finding.evidence()));
            findings.add(item);
        }
        file.put("findings", findings);

        JSONArray candidates = new JSONArray();
        for (Patch patch : outcome.candidatePatches()) {
            candidates.add(patchJson(patch));
        }
        file.put("candidatePatches", candidates);

        JSONArray applied = new JSONArray();
        for (Patch patch : outcome.appliedPatches()) {
            applied.add(patchJson(patch));
        }
        file.put("appliedPatches", applied);

        JSONArray superseded = new JSONArray();
        for (SupersededPatch entry : outcome.supersededPatches()) {
            JSONObject item = patchJson(entry.patch());
            item.put("supersededBy", entry.supersededBy().label());
            superseded.add(item);
        }
        file.put("supersededPatches", superseded);

        JSONArray declined = new JSONArray();
        for (DeclinedFinding entry : outcome.declinedFindings()) {
            JSONObject item = new JSONObject();
            item.put("kind", entry.finding().kind().name());
            item.put("line", entry.finding().line());
            if (entry.ruleKind() != null) {
                item.put("rule", entry.ruleKind().optionName());
            }
            item.put("reason", entry.reason());
            declined.add(item);
        }
        file.put("declinedFindings", declined);

        JSONArray validation = new JSONArray();
        for (ValidationResult result : outcome.validationResults()) {
            JSONObject item = new JSONObject();
            item.put("patch", result.patch().label());
            item.put("verdict", result.verdict().name());
            item.put("executionSucceeded", result.executionSucceeded());
            if (result.outputsEqual() != null) {
                item.put("outputsEqual", result.outputsEqual());
            }
            putMillis(item, "baselineRuntimeMs", result.baselineRuntime());
            putMillis(item, "candidateRuntimeMs", result.candidateRuntime());
            item.put("baselinePeakMemoryKb", result.baselinePeakMemoryKb());
            item.put("candidatePeakMemoryKb", result.candidatePeakMemoryKb());
            item.put("runtimeImprovement", result.runtimeImprovement());
            item.put("memoryImprovement", result.memoryImprovement());
            if (result.failureCause() != null) {
                item.put("failureCause", result.failureCause().name());
            }
            if (result.detail() != null) {
                item.put("detail", result.detail());
            }
            validation.add(item);
        }
        file.put("validation", validation);
        return file;
    }

    private static JSONObject patchJson(Patch patch) {
        JSONObject item = new JSONObject();
        item.put("id", patch.id());
        item.put("rule", patch.ruleKind().optionName());
        item.put("line", patch.anchor().span().startLine());
        item.put("safety", patch.safety().name());
        item.put("rationale", patch.rationale());
        return item;
    }

    private static void putMillis(JSONObject item, String key, Duration duration) {
        if (duration != null) {
            item.put(key, duration.toNanos() / 1_000_000.0);
        }
    }
}
