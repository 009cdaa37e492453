package org.pyoptimizer;

import java.time.Duration;

/**
 * Central configuration class for the optimizer.
 * Contains the defaults every run starts from.
 */
public final class Configuration {

    public static final String version = "1.0.0";

    public static final long DEFAULT_HIGH_ITERATION_THRESHOLD = 1000;
    public static final double DEFAULT_IMPROVEMENT_THRESHOLD = 0.05;
    public static final Duration DEFAULT_CANDIDATE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_FILE_TIMEOUT = Duration.ofMinutes(10);
    public static final String DEFAULT_PYTHON = "python3";
    public static final int DEFAULT_REPEATS = 3;
    public static final int DEFAULT_WORKERS = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

    // Suffix of emitted scripts: foo.py becomes foo_optimized.py
    public static final String OPTIMIZED_SUFFIX = "_optimized";
    public static final String DEFAULT_CONFIG_FILE = "pyoptimizer.yaml";

    // Prevent instantiation
    private Configuration() {
    }
}
