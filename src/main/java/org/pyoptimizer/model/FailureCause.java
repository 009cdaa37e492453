package org.pyoptimizer.model;

/**
 * Why a script run did not complete normally.
 */
public enum FailureCause {
    /**
     * Uncaught exception (traceback on stderr, exit status 1).
     */
    EXCEPTION,
    NONZERO_EXIT,
    TIMEOUT,
    MEMORY_LIMIT,
    /**
     * The unmodified script already failed, so no candidate can be judged.
     */
    BASELINE_FAILED,
    /**
     * The patch passed alone but broke the script together with other accepted patches.
     */
    COMBINATION_FAILED
}
