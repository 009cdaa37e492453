package org.pyoptimizer.model;

public enum Verdict {
    ACCEPTED,
    /**
     * Observable output changed.
     */
    REJECTED_UNSAFE,
    /**
     * Equivalent but not measurably faster or leaner; kept as a suggestion.
     */
    REJECTED_NO_BENEFIT,
    REJECTED_EXECUTION_FAILED
}
