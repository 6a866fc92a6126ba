package io.backfill.stage;

import io.backfill.channel.Inlet;
import io.backfill.channel.Outlet;
import io.backfill.core.Sink;
import io.backfill.metrics.Metrics;

import java.io.IOException;

/**
 * Terminal stage draining formatted lines into the {@link Sink}. It flushes the sink before closing, so a
 * closed sink stage means every line reached the device.
 */
public class SinkStage extends Stage<String, Void> {
    private final Sink<String> sink;
    private long written = 0;

    public SinkStage(Sink<String> sink, Inlet<String> inlet, Metrics metrics) {
        super("sink", inlet, Outlet.none(), metrics);
        this.sink = sink;
    }

    @Override
    protected void onElement(String line) throws IOException {
        sink.accept(line);
        written++;
    }

    @Override
    protected void onEndOfInput() throws IOException {
        sink.flush();
    }

    public long writtenCount() { return written; }
}
