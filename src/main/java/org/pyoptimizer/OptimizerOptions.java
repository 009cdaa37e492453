package org.pyoptimizer;

import org.pyoptimizer.model.RuleKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Settings of one optimizer run. Defaults come from {@link Configuration}, a YAML file
 * may override them ({@link ConfigLoader}), and command line switches override both
 * ({@link ArgumentParser}).
 */
public class OptimizerOptions implements Cloneable {
    // Counted loops with more iterations than this are reported
    public long highIterationThreshold = Configuration.DEFAULT_HIGH_ITERATION_THRESHOLD;
    // Minimum relative runtime or memory gain for a patch to be accepted
    public double improvementThreshold = Configuration.DEFAULT_IMPROVEMENT_THRESHOLD;
    public Duration candidateTimeout = Configuration.DEFAULT_CANDIDATE_TIMEOUT;
    public Set<RuleKind> enabledRules = EnumSet.allOf(RuleKind.class);
    public String pythonExecutable = Configuration.DEFAULT_PYTHON;
    // Runs per script variant; the fastest counts
    public int repeats = Configuration.DEFAULT_REPEATS;
    public int workers = Configuration.DEFAULT_WORKERS;
    // Upper bound for all work on one file, validation included
    public Duration fileTimeout = Configuration.DEFAULT_FILE_TIMEOUT;
    // 0 means no limit
    public int memoryLimitMb = 0;
    public Path outputDirectory = null;
    public Path reportFile = null;
    // Analyze and plan only, never run Python
    public boolean analyzeOnly = false;
    public Path configFile = null;
    public List<Path> inputs = new ArrayList<>();

    @Override
    public OptimizerOptions clone() {
        try {
            OptimizerOptions copy = (OptimizerOptions) super.clone();
            copy.enabledRules = enabledRules.isEmpty() ? EnumSet.noneOf(RuleKind.class) : EnumSet.copyOf(enabledRules);
            copy.inputs = new ArrayList<>(inputs);
            return copy;
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "OptimizerOptions{\n" +
                "    highIterationThreshold=" + highIterationThreshold + ",\n" +
                "    improvementThreshold=" + improvementThreshold + ",\n" +
                "    candidateTimeout=" + candidateTimeout + ",\n" +
                "    enabledRules=" + enabledRules + ",\n" +
                "    pythonExecutable='" + pythonExecutable + "',\n" +
                "    repeats=" + repeats + ",\n" +
                "    workers=" + workers + ",\n" +
                "    fileTimeout=" + fileTimeout + ",\n" +
                "    memoryLimitMb=" + memoryLimitMb + ",\n" +
                "    outputDirectory=" + outputDirectory + ",\n" +
                "    reportFile=" + reportFile + ",\n" +
                "    analyzeOnly=" + analyzeOnly + ",\n" +
                "    configFile=" + configFile + ",\n" +
                "    inputs=" + inputs + "\n" +
                "}";
    }
}
