package org.pyoptimizer.exception;

import java.io.Serial;

/**
 * Raised when the validator cannot run a script at all, for instance because the
 * interpreter is missing or the scratch directory cannot be written. A script that
 * runs and fails is not an exception; it is reported through
 * {@link org.pyoptimizer.validation.ExecutionReport}.
 */
public class ValidationException extends OptimizerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
