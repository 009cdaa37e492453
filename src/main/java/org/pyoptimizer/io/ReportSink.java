package org.pyoptimizer.io;

import org.pyoptimizer.model.Outcome;

import java.io.IOException;

/**
 * Receives the outcome of every processed file, in input order.
 */
public interface ReportSink extends AutoCloseable {

    void accept(Outcome outcome) throws IOException;

    /**
     * Called once after the last outcome.
     */
    @Override
    default void close() throws IOException {
    }
}
