package org.pyoptimizer.exception;

import java.io.Serial;

/**
 * Base class of the exceptions raised by the optimizer pipeline.
 * <p>
 * Like the rest of the tool's error types it is unchecked: callers that can recover
 * (the pipeline controller, the command line) catch the concrete subclasses, everything
 * else lets them travel up.
 */
public class OptimizerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public OptimizerException(String message) {
        super(message);
    }

    public OptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
