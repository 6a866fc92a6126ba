package io.backfill.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces units in order, blocking until the next one is available.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next unit, or empty once the source is exhausted. Once empty has been returned
     * every later call returns empty too.
     */
    Optional<T> next() throws IOException;

    @Override
    default void close() throws IOException {}
}
