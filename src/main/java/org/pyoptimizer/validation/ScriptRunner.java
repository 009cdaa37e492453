package org.pyoptimizer.validation;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Executes a script variant in isolation and reports what happened.
 * <p>
 * Implementations must bound every run by the timeout and must never leave a child
 * process behind, also when the calling thread is interrupted.
 */
public interface ScriptRunner {

    /**
     * @param scriptText      the complete script
     * @param sourceDirectory directory of the original file; the run uses it as working
     *                        directory and import root so that sibling modules and
     *                        relative data files resolve. May be null.
     * @param label           short name for logs, such as the file name and the patch set
     * @param timeout         upper bound for the run
     * @throws org.pyoptimizer.exception.ValidationException if the run could not be started
     * @throws java.util.concurrent.CancellationException    if the thread was interrupted
     */
    ExecutionReport run(String scriptText, Path sourceDirectory, String label, Duration timeout);

    default ExecutionReport run(String scriptText, String label, Duration timeout) {
        return run(scriptText, null, label, timeout);
    }
}
