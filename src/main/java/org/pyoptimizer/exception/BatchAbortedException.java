package org.pyoptimizer.exception;

import java.io.Serial;

/**
 * Top-level signal that a whole batch had to be abandoned because a global resource
 * (the worker pool, the caller's thread) was exhausted or interrupted. Failures of a
 * single file never raise this; they produce a FAILED or INCOMPLETE outcome instead.
 */
public class BatchAbortedException extends OptimizerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public BatchAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
