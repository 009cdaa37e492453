package org.pyoptimizer.model;

/**
 * The inefficiency patterns the analyzer recognizes.
 */
public enum FindingKind {
    HIGH_ITERATION_LOOP,
    NESTED_LOOP,
    REPEATED_COMPUTATION,
    VECTORIZABLE_LOOP
}
