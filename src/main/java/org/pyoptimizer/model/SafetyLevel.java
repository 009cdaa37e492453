package org.pyoptimizer.model;

/**
 * Whether a rewrite is equivalent by construction (PROVEN) or only believed to be,
 * pending execution-based validation (HEURISTIC).
 */
public enum SafetyLevel {
    PROVEN,
    HEURISTIC
}
