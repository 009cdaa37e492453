package org.pyoptimizer.exception;

import java.io.Serial;

/**
 * Invalid option value, either from a YAML file or from the command line.
 */
public class ConfigurationException extends OptimizerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
