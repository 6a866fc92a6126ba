package io.backfill.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes units in the order they are handed over.
 */
public interface Sink<T> extends Closeable {
    void accept(T unit) throws IOException;

    /** Push anything buffered to the underlying device. */
    default void flush() throws IOException {}

    @Override
    default void close() throws IOException {}
}
