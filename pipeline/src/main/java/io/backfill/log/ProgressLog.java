package io.backfill.log;

import java.io.Closeable;
import java.io.IOException;

/**
 * Line-oriented operator log: per-batch progress and the final run summary.
 */
public interface ProgressLog extends Closeable {
    void log(String message) throws IOException;

    @Override
    default void close() throws IOException {}
}
