package io.backfill.channel;

import io.backfill.core.Source;
import io.backfill.error.PipelineAbortedException;

import java.io.IOException;
import java.util.Optional;

/**
 * Lets the first stage pull straight from a {@link Source}: the next read happens only when the stage asks
 * for it, so a suspended stage stops consuming the source without any buffer in between.
 * <p>
 * Once {@link #abort aborted}, no further read reaches the source.
 */
public class SourceInlet<T> implements Inlet<T> {
    private final Source<T> source;
    private volatile Throwable abortCause;

    public SourceInlet(Source<T> source) {
        this.source = source;
    }

    @Override
    public Optional<T> receive() throws IOException {
        Throwable cause = abortCause;
        if (cause != null) throw new PipelineAbortedException("source", cause);
        return source.next();
    }

    /** Refuse every later read. Only the first cause is kept. */
    public void abort(Throwable cause) {
        if (abortCause == null) abortCause = cause;
    }

    public boolean isAborted() { return abortCause != null; }
}
